package net.littleredcomputer.gadget2sat;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Outcome of deciding a 2-CNF formula: either a canonical satisfying assignment, or a
 * variable whose two literals share a strong component.
 */
public final class DecisionResult {
    private final Condensation condensation;
    private final Assignment assignment;
    private final int conflictVariable;

    private DecisionResult(Condensation condensation, Assignment assignment, int conflictVariable) {
        this.condensation = condensation;
        this.assignment = assignment;
        this.conflictVariable = conflictVariable;
    }

    static DecisionResult sat(Condensation condensation, Assignment assignment) {
        return new DecisionResult(condensation, assignment, -1);
    }

    static DecisionResult unsat(Condensation condensation, int conflictVariable) {
        return new DecisionResult(condensation, null, conflictVariable);
    }

    public boolean isSatisfiable() { return assignment != null; }
    public Optional<Assignment> assignment() { return Optional.ofNullable(assignment); }
    public Condensation condensation() { return condensation; }

    public OptionalInt conflictVariable() {
        return conflictVariable < 0 ? OptionalInt.empty() : OptionalInt.of(conflictVariable);
    }

    @Override
    public String toString() {
        return isSatisfiable() ? "SAT " + assignment : "UNSAT (variable " + conflictVariable + ")";
    }
}
