package net.littleredcomputer.gadget2sat;

/**
 * The state of one clause gadget that satisfies the three 2-clauses without the original
 * 3-clause being satisfied: l1 false, l2 false, auxiliary true.
 */
public final class SpuriousPattern {
    private final int clauseIndex;
    private final Literal l1;
    private final Literal l2;
    private final int auxiliary;

    SpuriousPattern(int clauseIndex, Clause original, int auxiliary) {
        this.clauseIndex = clauseIndex;
        this.l1 = original.get(0);
        this.l2 = original.get(1);
        this.auxiliary = auxiliary;
    }

    public int clauseIndex() { return clauseIndex; }
    public int auxiliary() { return auxiliary; }

    public boolean matchedBy(Assignment a) {
        return !a.value(l1) && !a.value(l2) && a.get(auxiliary);
    }

    @Override
    public String toString() {
        return String.format("clause %d: {%d=%b, %d=%b, %d=true}",
                clauseIndex, l1.variable(), l1.isNegated(), l2.variable(), l2.isNegated(), auxiliary);
    }
}
