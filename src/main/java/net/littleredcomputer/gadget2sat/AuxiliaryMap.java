package net.littleredcomputer.gadget2sat;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Records, for each clause of the original 3-CNF formula, the auxiliary variable its
 * gadget introduced. Built once during transformation and read-only thereafter.
 */
public final class AuxiliaryMap {
    private final int nOriginalVariables;
    private final int[] auxiliaryOf;  // indexed by original clause
    private final BitSet auxiliaries = new BitSet();

    private AuxiliaryMap(int nOriginalVariables, int[] auxiliaryOf) {
        this.nOriginalVariables = nOriginalVariables;
        this.auxiliaryOf = auxiliaryOf;
        for (int a : auxiliaryOf) auxiliaries.set(a);
    }

    public int nOriginalVariables() { return nOriginalVariables; }
    public int size() { return auxiliaryOf.length; }
    public int auxiliaryOf(int clauseIndex) { return auxiliaryOf[clauseIndex]; }
    public boolean isAuxiliary(int variable) { return auxiliaries.get(variable); }

    /** @return true if the variable belongs to the original formula */
    public boolean isOriginal(int variable) { return variable < nOriginalVariables && !isAuxiliary(variable); }

    @Override
    public String toString() { return Arrays.toString(auxiliaryOf); }

    static class Builder {
        private final int nOriginalVariables;
        private final TIntArrayList auxiliaryOf = new TIntArrayList();
        private boolean built = false;

        Builder(int nOriginalVariables) { this.nOriginalVariables = nOriginalVariables; }

        /** Clauses must be registered in index order. */
        void register(int clauseIndex, int auxiliary) {
            if (built) throw new IllegalStateException("auxiliary map already built");
            if (clauseIndex != auxiliaryOf.size()) {
                throw new IllegalArgumentException("clause " + clauseIndex + " registered out of order");
            }
            if (auxiliary < nOriginalVariables) {
                throw new IllegalArgumentException("auxiliary " + auxiliary + " collides with an original variable");
            }
            auxiliaryOf.add(auxiliary);
        }

        AuxiliaryMap build() {
            built = true;
            return new AuxiliaryMap(nOriginalVariables, auxiliaryOf.toArray());
        }
    }
}
