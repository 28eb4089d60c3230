package net.littleredcomputer.gadget2sat;

/**
 * Hands out fresh variable numbers, in increasing order, starting at a given value.
 * Passed explicitly to whoever needs new variables.
 */
public class VariableGenerator {
    private int next;

    private VariableGenerator(int first) {
        if (first < 0) throw new IllegalArgumentException("first variable must be nonnegative");
        this.next = first;
    }

    public static VariableGenerator startingAt(int first) { return new VariableGenerator(first); }

    public int next() {
        if (next == Integer.MAX_VALUE) throw new IllegalStateException("variable numbers exhausted");
        return next++;
    }

    /** @return the variable the next call to {@link #next()} will return */
    public int peek() { return next; }
}
