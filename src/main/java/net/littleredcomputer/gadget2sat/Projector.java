package net.littleredcomputer.gadget2sat;

import com.google.common.collect.ImmutableSortedMap;

/**
 * Restricts an assignment of the transformed formula to the variables of the original one.
 */
public final class Projector {
    private Projector() {}

    public static ImmutableSortedMap<Integer, Boolean> project(Assignment a, AuxiliaryMap auxiliaries) {
        checkCovers(a, auxiliaries);
        ImmutableSortedMap.Builder<Integer, Boolean> b = ImmutableSortedMap.naturalOrder();
        for (int v = 0; v < auxiliaries.nOriginalVariables(); ++v) {
            if (auxiliaries.isOriginal(v)) b.put(v, a.get(v));
        }
        return b.build();
    }

    /** @return the projection as an assignment of the original formula's variables */
    public static Assignment projectToAssignment(Assignment a, AuxiliaryMap auxiliaries) {
        checkCovers(a, auxiliaries);
        return a.prefix(auxiliaries.nOriginalVariables());
    }

    private static void checkCovers(Assignment a, AuxiliaryMap auxiliaries) {
        if (a.size() < auxiliaries.nOriginalVariables()) {
            throw new IllegalArgumentException("assignment does not cover the original variables");
        }
    }
}
