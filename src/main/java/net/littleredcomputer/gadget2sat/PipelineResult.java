package net.littleredcomputer.gadget2sat;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Optional;

public final class PipelineResult {
    public enum Outcome {
        /** A model of the original formula was found. */
        SATISFIABLE,
        /** The 2-CNF relaxation is unsatisfiable, hence so is the original formula. */
        UNSAT_EARLY,
        /** The relaxation is satisfiable but every model of it is spurious. */
        FILTER_EXHAUSTED,
        /** The filter search gave up; nothing is known about the original formula. */
        BUDGET_EXCEEDED,
    }

    private final Outcome outcome;
    private final ImmutableSortedMap<Integer, Boolean> model;
    private final DecisionResult decision;
    private final FilterResult filter;

    private PipelineResult(Outcome outcome, ImmutableSortedMap<Integer, Boolean> model, DecisionResult decision, FilterResult filter) {
        this.outcome = outcome;
        this.model = model;
        this.decision = decision;
        this.filter = filter;
    }

    static PipelineResult unsatEarly(DecisionResult decision) {
        return new PipelineResult(Outcome.UNSAT_EARLY, null, decision, null);
    }

    static PipelineResult filtered(DecisionResult decision, FilterResult filter, ImmutableSortedMap<Integer, Boolean> model) {
        switch (filter.outcome()) {
            case FOUND: return new PipelineResult(Outcome.SATISFIABLE, model, decision, filter);
            case EXHAUSTED: return new PipelineResult(Outcome.FILTER_EXHAUSTED, null, decision, filter);
            case BUDGET_EXCEEDED: return new PipelineResult(Outcome.BUDGET_EXCEEDED, null, decision, filter);
            default: throw new IllegalArgumentException("unknown filter outcome " + filter.outcome());
        }
    }

    public Outcome outcome() { return outcome; }
    public boolean isSatisfiable() { return outcome == Outcome.SATISFIABLE; }

    /** @return the model of the original formula, keyed by (0-based) original variable */
    public Optional<ImmutableSortedMap<Integer, Boolean>> model() { return Optional.ofNullable(model); }

    /** @return the model as an assignment of the original variables */
    public Optional<Assignment> assignment() {
        if (model == null) return Optional.empty();
        boolean[] bs = new boolean[model.size()];
        model.forEach((v, b) -> bs[v] = b);
        return Optional.of(Assignment.of(bs));
    }

    public DecisionResult decision() { return decision; }
    public Optional<FilterResult> filterResult() { return Optional.ofNullable(filter); }
    public Optional<SearchStatistics> statistics() { return filterResult().map(FilterResult::statistics); }

    @Override
    public String toString() {
        return outcome + (model != null ? " " + model : "");
    }
}
