package net.littleredcomputer.gadget2sat;

/**
 * The clause families handled here. Every clause of a formula belongs to the
 * formula's family and has exactly that family's arity.
 */
public enum ClauseKind {
    THREE(3),
    TWO(2);

    private final int arity;

    ClauseKind(int arity) { this.arity = arity; }

    public int arity() { return arity; }
}
