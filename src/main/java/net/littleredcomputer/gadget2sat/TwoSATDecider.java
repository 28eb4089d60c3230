package net.littleredcomputer.gadget2sat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Linear-time 2-SAT via strong components of the implication graph.
 */
public final class TwoSATDecider {
    private static final Logger log = LogManager.getFormatterLogger(TwoSATDecider.class);

    private TwoSATDecider() {}

    public static DecisionResult decide(Formula psi) {
        return decide(Condensation.of(ImplicationGraph.of(psi)));
    }

    /**
     * The formula is unsatisfiable iff some variable has both of its literals in one component.
     * Otherwise components are visited sinks first, and the first literal of each variable
     * encountered is made true.
     */
    static DecisionResult decide(Condensation condensation) {
        final int nVariables = condensation.graph().nVariables();
        for (int v = 0; v < nVariables; ++v) {
            if (condensation.component(2 * v) == condensation.component(2 * v + 1)) {
                log.debug("variable %d and its negation are strongly connected", v);
                return DecisionResult.unsat(condensation, v);
            }
        }
        boolean[] value = new boolean[nVariables];
        boolean[] resolved = new boolean[nVariables];
        for (int c : condensation.reverseTopologicalOrder()) {
            for (int x : condensation.membersQuick(c)) {
                final int v = x >> 1;
                if (resolved[v]) continue;
                value[v] = (x & 1) == 0;
                resolved[v] = true;
            }
        }
        return DecisionResult.sat(condensation, Assignment.of(value));
    }
}
