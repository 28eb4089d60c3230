package net.littleredcomputer.gadget2sat;

import java.util.BitSet;

/**
 * One free choice: a strong component whose literals are all false under the canonical
 * assignment, and which could be made true. The variables with a literal in that component
 * form an equivalence group, they can only flip together. Making the component true also
 * makes everything it reaches true, so choosing the group may flip further variables.
 */
public final class FreeChoiceGroup {
    private final int index;
    private final int component;
    private final int root;         // a vertex of the component
    private final int[] variables;
    private final BitSet literals;  // vertices reachable from the component, its own included
    private final BitSet flips;     // variables whose value changes when this group is chosen

    FreeChoiceGroup(int index, int component, int root, int[] variables, BitSet literals, BitSet flips) {
        this.index = index;
        this.component = component;
        this.root = root;
        this.variables = variables;
        this.literals = literals;
        this.flips = flips;
    }

    public int index() { return index; }

    /** @return the component made true by choosing this group */
    public int component() { return component; }

    public int[] variables() { return variables.clone(); }
    public BitSet flips() { return (BitSet) flips.clone(); }

    /**
     * @return true if choosing this group flips only its own variables, i.e. it can be flipped
     * with every other variable held at its canonical value
     */
    public boolean isIndependent() { return flips.cardinality() == variables.length; }

    /** @return true if choosing this group makes h's component true as well */
    public boolean implies(FreeChoiceGroup h) { return h != this && literals.get(h.root); }

    /** @return true if the two groups require some literal and its complement */
    public boolean conflicts(FreeChoiceGroup h) {
        for (int x = h.literals.nextSetBit(0); x >= 0; x = h.literals.nextSetBit(x + 1)) {
            if (literals.get(x ^ 1)) return true;
        }
        return false;
    }

    int root() { return root; }
    BitSet literals() { return literals; }
    BitSet flipsQuick() { return flips; }

    @Override
    public String toString() {
        return String.format("group %d: component %d, flips %s", index, component, flips);
    }
}
