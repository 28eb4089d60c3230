package net.littleredcomputer.gadget2sat;

/**
 * A variable or its negation. Variables are numbered from zero. A literal is
 * also a vertex of the implication graph, via the [2v|2v+1] encoding used
 * throughout: the positive literal of v is 2v and its negation is 2v+1.
 */
public final class Literal {
    private final int variable;
    private final boolean negated;

    private Literal(int variable, boolean negated) {
        if (variable < 0) throw new IllegalArgumentException("variable must be nonnegative: " + variable);
        this.variable = variable;
        this.negated = negated;
    }

    public static Literal positive(int variable) { return new Literal(variable, false); }
    public static Literal negative(int variable) { return new Literal(variable, true); }
    public static Literal of(int variable, boolean negated) { return new Literal(variable, negated); }

    /**
     * @param dimacs a nonzero, 1-based signed variable number as found in a DIMACS file
     * @return the corresponding (0-based) literal
     */
    public static Literal fromDimacs(int dimacs) {
        if (dimacs == 0) throw new IllegalArgumentException("literal cannot be 0");
        return new Literal(Math.abs(dimacs) - 1, dimacs < 0);
    }

    static Literal fromCode(int code) { return new Literal(code >> 1, (code & 1) != 0); }

    public int variable() { return variable; }
    public boolean isNegated() { return negated; }
    public Literal not() { return new Literal(variable, !negated); }

    /** @return the implication graph vertex of this literal */
    public int code() { return 2 * variable + (negated ? 1 : 0); }

    public int toDimacs() { return negated ? -(variable + 1) : variable + 1; }

    public boolean isTrueUnder(Assignment a) { return a.get(variable) != negated; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal l = (Literal) o;
        return variable == l.variable && negated == l.negated;
    }

    @Override
    public int hashCode() { return code(); }

    @Override
    public String toString() { return (negated ? "~" : "") + variable; }
}
