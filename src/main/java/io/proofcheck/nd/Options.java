package io.proofcheck.nd;

/**
 * Verification options.
 */
public class Options {
    /** Reject a proof that ends with scopes still open. */
    public boolean rejectUnclosedScopes = false;
    /** ∨e: the first branch box must end before the second begins. */
    public boolean orderedOrBranches = true;
}
