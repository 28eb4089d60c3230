package net.littleredcomputer.gadget2sat;

/**
 * Thrown when a clause does not have the arity its family requires. This is
 * the one input fault that stops a run before transformation.
 */
public class MalformedClauseException extends IllegalArgumentException {
    private final ClauseKind kind;
    private final int observedArity;

    public MalformedClauseException(ClauseKind kind, int observedArity) {
        super(String.format("%s clause must have %d literals, found %d", kind, kind.arity(), observedArity));
        this.kind = kind;
        this.observedArity = observedArity;
    }

    public ClauseKind kind() { return kind; }
    public int observedArity() { return observedArity; }
}
