package net.littleredcomputer.gadget2sat;

import com.google.common.collect.ImmutableList;

import java.math.BigInteger;
import java.util.BitSet;
import java.util.List;

/**
 * The free choices available around a canonical 2-SAT assignment. Every satisfying assignment
 * of the formula is obtained from the canonical one by choosing a set of groups no two of which
 * conflict, and it is obtained from exactly one such set in which no group implies another.
 * Relations between groups are not tabulated; they are tested as sets are built, see
 * {@link Selection}.
 */
public final class FreeChoiceSet {
    private final ImmutableList<FreeChoiceGroup> groups;
    private final BitSet forced;
    private final int nVertices;

    FreeChoiceSet(List<FreeChoiceGroup> groups, BitSet forced, int nVertices) {
        this.groups = ImmutableList.copyOf(groups);
        this.forced = forced;
        this.nVertices = nVertices;
    }

    static FreeChoiceSet empty() {
        return new FreeChoiceSet(ImmutableList.of(), new BitSet(), 0);
    }

    public int size() { return groups.size(); }
    public boolean isEmpty() { return groups.isEmpty(); }
    public ImmutableList<FreeChoiceGroup> groups() { return groups; }
    public FreeChoiceGroup group(int i) { return groups.get(i); }

    /** @return variables whose canonical value holds in every satisfying assignment */
    public BitSet forcedVariables() { return (BitSet) forced.clone(); }
    public boolean isForced(int variable) { return forced.get(variable); }

    /** @return true if no satisfying assignment has both groups chosen */
    public boolean conflicts(int g, int h) { return group(g).conflicts(group(h)); }

    /** @return true if choosing g necessarily chooses h as well */
    public boolean implies(int g, int h) { return group(g).implies(group(h)); }

    /** @return the number of independent groups, in the narrow sense of {@link FreeChoiceGroup#isIndependent()} */
    public long independentCount() { return groups.stream().filter(FreeChoiceGroup::isIndependent).count(); }

    /** @return 2^size(), the number of subsets of groups */
    public BigInteger subsetSpace() { return BigInteger.ONE.shiftLeft(groups.size()); }

    /** @return the selection of no groups at all */
    Selection none() { return new Selection(new BitSet(nVertices), new BitSet(nVertices), new BitSet(nVertices), new BitSet()); }

    /**
     * Apply the chosen groups to the canonical assignment. The choice must be free of conflicts
     * for the result to satisfy the formula.
     */
    public Assignment apply(Assignment canonical, int... chosen) {
        BitSet flips = new BitSet(canonical.size());
        for (int g : chosen) flips.or(groups.get(g).flipsQuick());
        return canonical.flip(flips);
    }

    @Override
    public String toString() {
        return String.format("%d free groups (%d independent), %d forced variables",
                groups.size(), independentCount(), forced.cardinality());
    }

    /**
     * The literals made true by a set of chosen groups. Another group may join the set if it
     * conflicts with no member, is implied by no member and implies no member; each test is one
     * pass over the group's literals.
     */
    static final class Selection {
        private final BitSet literals;   // union of the members' literals
        private final BitSet negations;  // complements of those
        private final BitSet roots;      // one vertex of each member's component
        private final BitSet flips;

        private Selection(BitSet literals, BitSet negations, BitSet roots, BitSet flips) {
            this.literals = literals;
            this.negations = negations;
            this.roots = roots;
            this.flips = flips;
        }

        boolean admits(FreeChoiceGroup h) {
            return !h.literals().intersects(negations)
                    && !literals.get(h.root())
                    && !h.literals().intersects(roots);
        }

        Selection with(FreeChoiceGroup h) {
            BitSet ls = (BitSet) literals.clone();
            BitSet ns = (BitSet) negations.clone();
            BitSet rs = (BitSet) roots.clone();
            BitSet fs = (BitSet) flips.clone();
            BitSet hl = h.literals();
            ls.or(hl);
            for (int x = hl.nextSetBit(0); x >= 0; x = hl.nextSetBit(x + 1)) ns.set(x ^ 1);
            rs.set(h.root());
            fs.or(h.flipsQuick());
            return new Selection(ls, ns, rs, fs);
        }

        Assignment applyTo(Assignment canonical) { return canonical.flip(flips); }
    }
}
