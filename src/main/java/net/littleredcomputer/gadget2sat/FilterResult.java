package net.littleredcomputer.gadget2sat;

import java.util.Optional;

public final class FilterResult {
    public enum Outcome {
        /** An assignment satisfying the 2-CNF formula and avoiding every spurious pattern was found. */
        FOUND,
        /** Every satisfying assignment was examined and each one matches some spurious pattern. */
        EXHAUSTED,
        /** The search stopped at its budget with candidates left to try. */
        BUDGET_EXCEEDED,
    }

    private final Outcome outcome;
    private final Assignment witness;
    private final SearchStatistics statistics;

    private FilterResult(Outcome outcome, Assignment witness, SearchStatistics statistics) {
        this.outcome = outcome;
        this.witness = witness;
        this.statistics = statistics;
    }

    static FilterResult found(Assignment witness, SearchStatistics s) { return new FilterResult(Outcome.FOUND, witness, s); }
    static FilterResult exhausted(SearchStatistics s) { return new FilterResult(Outcome.EXHAUSTED, null, s); }
    static FilterResult budgetExceeded(SearchStatistics s) { return new FilterResult(Outcome.BUDGET_EXCEEDED, null, s); }

    public Outcome outcome() { return outcome; }
    public Optional<Assignment> witness() { return Optional.ofNullable(witness); }
    public SearchStatistics statistics() { return statistics; }

    @Override
    public String toString() {
        return outcome + (witness != null ? " " + witness : "") + " (" + statistics + ")";
    }
}
