package net.littleredcomputer.gadget2sat;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites 3-clauses into 2-clauses with the gadget
 * (l1 ∨ l2 ∨ l3) ↦ (¬l1 ∨ a) ∧ (¬l2 ∨ a) ∧ (a ∨ l3), a fresh.
 */
public class ClauseTransformer {
    private static final Logger log = LogManager.getFormatterLogger(ClauseTransformer.class);

    private ClauseTransformer() {}

    /**
     * Rewrite a single clause. The fresh variable is drawn from the generator and recorded
     * against the clause index in the auxiliary map under construction.
     */
    static List<Clause> transform(int clauseIndex, Clause c, VariableGenerator fresh, AuxiliaryMap.Builder auxiliaries) {
        if (c.kind() != ClauseKind.THREE) throw new MalformedClauseException(ClauseKind.THREE, c.literals().size());
        final Literal a = Literal.positive(fresh.next());
        auxiliaries.register(clauseIndex, a.variable());
        return ImmutableList.of(
                Clause.of(c.get(0).not(), a),
                Clause.of(c.get(1).not(), a),
                Clause.of(a, c.get(2)));
    }

    public static Transformation transform(Formula phi) {
        return transform(phi, VariableGenerator.startingAt(phi.nVariables()));
    }

    /**
     * Rewrite every clause of phi. The generator must not hand out any of phi's variables.
     * The resulting 2-CNF formula declares every variable up to the last auxiliary.
     */
    public static Transformation transform(Formula phi, VariableGenerator fresh) {
        if (phi.kind() != ClauseKind.THREE) throw new IllegalArgumentException("can only transform 3-CNF formulas");
        if (fresh.peek() < phi.nVariables()) {
            throw new IllegalArgumentException("auxiliary variables must follow the original variables");
        }
        AuxiliaryMap.Builder auxiliaries = new AuxiliaryMap.Builder(phi.nVariables());
        List<Clause> clauses = new ArrayList<>(3 * phi.nClauses());
        for (int i = 0; i < phi.nClauses(); ++i) {
            clauses.addAll(transform(i, phi.getClause(i), fresh, auxiliaries));
        }
        Formula psi = new Formula(Math.max(phi.nVariables(), fresh.peek()), ClauseKind.TWO, clauses);
        log.debug("transformed %d clauses over %d variables into %d clauses over %d variables",
                phi.nClauses(), phi.nVariables(), psi.nClauses(), psi.nVariables());
        return new Transformation(phi, psi, auxiliaries.build());
    }
}
