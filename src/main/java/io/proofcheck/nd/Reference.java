package io.proofcheck.nd;

/**
 * A citation in a rule clause: a single line, or a start-end box.
 */
public sealed interface Reference {
    record Line(int number) implements Reference {
        @Override public String toString() { return String.valueOf(number); }
    }

    record Box(int start, int end) implements Reference {
        @Override public String toString() { return start + "-" + end; }
    }

    static Reference line(int number) { return new Line(number); }
    static Reference box(int start, int end) { return new Box(start, end); }
}
