package net.littleredcomputer.gadget2sat;

import java.util.Arrays;
import java.util.BitSet;

/**
 * A total truth assignment to the variables [0, size()). Instances are immutable;
 * the search derives new candidates with {@link #flip(BitSet)}.
 */
public final class Assignment {
    private final boolean[] values;

    private Assignment(boolean[] values) {
        this.values = values;
    }

    public static Assignment of(boolean... values) { return new Assignment(values.clone()); }

    public int size() { return values.length; }
    public boolean get(int variable) { return values[variable]; }
    public boolean value(Literal l) { return l.isTrueUnder(this); }
    public boolean[] toArray() { return values.clone(); }

    /**
     * @param variables set of variables to negate
     * @return a copy of this assignment with the given variables negated
     */
    public Assignment flip(BitSet variables) {
        boolean[] v = values.clone();
        for (int i = variables.nextSetBit(0); i >= 0; i = variables.nextSetBit(i + 1)) v[i] = !v[i];
        return new Assignment(v);
    }

    /** @return the assignment restricted to variables [0, n) */
    public Assignment prefix(int n) { return new Assignment(Arrays.copyOf(values, n)); }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Assignment && Arrays.equals(values, ((Assignment) o).values));
    }

    @Override
    public int hashCode() { return Arrays.hashCode(values); }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (boolean b : values) s.append(b ? '1' : '0');
        return s.toString();
    }
}
