package net.littleredcomputer.gadget2sat;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Finds which variables of a satisfiable 2-CNF formula may leave their canonical value.
 * <p>
 * Let f be the literal of variable v that the canonical assignment makes false. Making f true
 * forces every literal reachable from f in the implication graph; the canonical assignment
 * with exactly those literals made true satisfies the formula unless f reaches ~f, in which
 * case v is forced. The work is one traversal of the condensation per distinct component of
 * false literals, O(k(V+E)) for k such components. Relations between the resulting groups are
 * left to the search, which tests them only for the sets it builds.
 */
public final class FreeChoiceAnalyzer {
    private static final Logger log = LogManager.getFormatterLogger(FreeChoiceAnalyzer.class);

    private FreeChoiceAnalyzer() {}

    public static FreeChoiceSet analyze(DecisionResult decision) {
        return analyze(decision.condensation(), canonical(decision));
    }

    public static FreeChoiceSet analyze(Condensation condensation, Assignment canonical) {
        return analyze(condensation, canonical, () -> false)
                .orElseThrow(() -> new IllegalStateException("analysis without a deadline cannot expire"));
    }

    /**
     * As {@link #analyze(DecisionResult)}, giving up when the deadline passes. The deadline is
     * consulted once per traversal.
     * @return the free choices, or empty if the deadline passed first
     */
    static Optional<FreeChoiceSet> analyze(DecisionResult decision, Deadline deadline) {
        return analyze(decision.condensation(), canonical(decision), deadline::isExpired);
    }

    private static Assignment canonical(DecisionResult decision) {
        return decision.assignment()
                .orElseThrow(() -> new IllegalArgumentException("no free choices in an unsatisfiable formula"));
    }

    private static Optional<FreeChoiceSet> analyze(Condensation condensation, Assignment canonical, BooleanSupplier expired) {
        final int nVariables = condensation.graph().nVariables();
        if (canonical.size() != nVariables) throw new IllegalArgumentException("assignment does not fit formula");
        final int[] groupOf = new int[condensation.nComponents()];  // -1 unvisited, -2 forced
        Arrays.fill(groupOf, -1);
        BitSet forced = new BitSet(nVariables);
        List<FreeChoiceGroup> groups = new ArrayList<>();

        for (int v = 0; v < nVariables; ++v) {
            final int falseLiteral = canonical.get(v) ? 2 * v + 1 : 2 * v;
            final int c = condensation.component(falseLiteral);
            if (groupOf[c] == -2) {
                forced.set(v);
                continue;
            }
            if (groupOf[c] >= 0) continue;
            if (expired.getAsBoolean()) {
                log.info("deadline passed after %d of %d variables, %d groups", v, nVariables, groups.size());
                return Optional.empty();
            }
            BitSet closure = reach(condensation, c);
            if (isContradictory(condensation, closure)) {
                groupOf[c] = -2;
                forced.set(v);
                continue;
            }
            groupOf[c] = groups.size();
            groups.add(group(groups.size(), condensation, canonical, c, falseLiteral, closure));
        }
        FreeChoiceSet free = new FreeChoiceSet(groups, forced, condensation.graph().nVertices());
        log.debug("%s", free);
        return Optional.of(free);
    }

    /** @return the components reachable from c, c included */
    private static BitSet reach(Condensation condensation, int c) {
        BitSet seen = new BitSet(condensation.nComponents());
        TIntStack stack = new TIntArrayStack();
        seen.set(c);
        stack.push(c);
        while (stack.size() > 0) {
            for (int d : condensation.successorsQuick(stack.pop())) {
                if (!seen.get(d)) {
                    seen.set(d);
                    stack.push(d);
                }
            }
        }
        return seen;
    }

    private static boolean isContradictory(Condensation condensation, BitSet closure) {
        for (int d = closure.nextSetBit(0); d >= 0; d = closure.nextSetBit(d + 1)) {
            if (closure.get(condensation.dual(d))) return true;
        }
        return false;
    }

    private static FreeChoiceGroup group(int index, Condensation condensation, Assignment canonical, int c, int root, BitSet closure) {
        TIntArrayList variables = new TIntArrayList();
        for (int x : condensation.membersQuick(c)) variables.add(x >> 1);
        variables.sort();
        BitSet literals = new BitSet(condensation.graph().nVertices());
        BitSet flips = new BitSet(canonical.size());
        for (int d = closure.nextSetBit(0); d >= 0; d = closure.nextSetBit(d + 1)) {
            for (int x : condensation.membersQuick(d)) {
                literals.set(x);
                // x is about to become true; if it is false now, its variable changes
                if (canonical.get(x >> 1) == ((x & 1) != 0)) flips.set(x >> 1);
            }
        }
        return new FreeChoiceGroup(index, c, root, variables.toArray(), literals, flips);
    }
}
