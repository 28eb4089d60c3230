package net.littleredcomputer.gadget2sat;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkState;

/**
 * Runs a 3-CNF formula through transformation, 2-SAT decision, filtering and projection.
 * Each stage may be driven separately; {@link #run()} drives whatever remains.
 * <pre>
 *   BUILT → TRANSFORMED → DECIDED → FILTERED → DONE
 *                           ↘ UNSAT_EARLY
 * </pre>
 */
public class Pipeline {
    private static final Logger log = LogManager.getFormatterLogger(Pipeline.class);

    public enum State {
        BUILT,
        TRANSFORMED,
        DECIDED,
        FILTERED,
        DONE,
        UNSAT_EARLY;

        public boolean isTerminal() { return this == DONE || this == UNSAT_EARLY; }
    }

    private final Formula phi;
    private final Function<Formula, Transformation> transformer;
    private State state = State.BUILT;
    private SearchBudget budget = SearchBudget.unlimited();
    private int threads = 1;
    private Duration logInterval = Duration.ofMillis(1000);
    private Transformation transformation;
    private DecisionResult decision;
    private FreeChoiceSet free;
    private FilterResult filterResult;
    private PipelineResult result;

    public Pipeline(Formula phi) {
        this(phi, ClauseTransformer::transform);
    }

    // The gadget alone always yields a satisfiable 2-CNF formula (make every auxiliary true);
    // tests reach UNSAT_EARLY by transforming with extra constraints.
    Pipeline(Formula phi, Function<Formula, Transformation> transformer) {
        if (phi.kind() != ClauseKind.THREE) throw new MalformedClauseException(ClauseKind.THREE, ClauseKind.TWO.arity());
        this.phi = phi;
        this.transformer = transformer;
    }

    public Pipeline setBudget(SearchBudget budget) {
        this.budget = budget;
        return this;
    }

    public Pipeline setThreads(int threads) {
        if (threads < 1) throw new IllegalArgumentException("need at least one thread");
        this.threads = threads;
        return this;
    }

    public Pipeline setLogInterval(Duration interval) {
        this.logInterval = interval;
        return this;
    }

    public State state() { return state; }
    public Optional<PipelineResult> result() { return Optional.ofNullable(result); }
    public Optional<Transformation> transformation() { return Optional.ofNullable(transformation); }
    public Optional<FreeChoiceSet> freeChoices() { return Optional.ofNullable(free); }

    public Transformation transform() {
        checkState(state == State.BUILT, "cannot transform in state %s", state);
        transformation = transformer.apply(phi);
        advance(State.TRANSFORMED);
        return transformation;
    }

    public DecisionResult decide() {
        checkState(state == State.TRANSFORMED, "cannot decide in state %s", state);
        decision = TwoSATDecider.decide(transformation.transformed());
        if (decision.isSatisfiable()) {
            advance(State.DECIDED);
        } else {
            result = PipelineResult.unsatEarly(decision);
            advance(State.UNSAT_EARLY);
        }
        return decision;
    }

    /**
     * Analyze the free choices and search them for a witness. The budget's duration covers
     * both steps.
     */
    public FilterResult filter() {
        checkState(state == State.DECIDED, "cannot filter in state %s", state);
        Deadline deadline = budget.start();
        Optional<FreeChoiceSet> analyzed = FreeChoiceAnalyzer.analyze(decision, deadline);
        if (analyzed.isPresent()) {
            free = analyzed.get();
            filterResult = searcher().search(canonical(), free, deadline);
        } else {
            log.info("budget exceeded before the free choice analysis finished");
            filterResult = FilterResult.budgetExceeded(new SearchStatistics(0, 0, 0, 0, deadline.elapsed()));
        }
        advance(State.FILTERED);
        return filterResult;
    }

    public PipelineResult project() {
        checkState(state == State.FILTERED, "cannot project in state %s", state);
        result = PipelineResult.filtered(decision, filterResult, filterResult.witness()
                .map(w -> Projector.project(w, transformation.auxiliaryMap()))
                .orElse(null));
        advance(State.DONE);
        return result;
    }

    public PipelineResult run() {
        Stopwatch sw = Stopwatch.createStarted();
        while (!state.isTerminal()) {
            switch (state) {
                case BUILT: transform(); break;
                case TRANSFORMED: decide(); break;
                case DECIDED: filter(); break;
                case FILTERED: project(); break;
                default: throw new IllegalStateException("unexpected state " + state);
            }
        }
        log.info("%s in %s", result.outcome(), sw);
        return result;
    }

    /**
     * Collect up to limit distinct models of the original formula. The formula must have been
     * decided satisfiable in its 2-CNF form.
     */
    public List<Assignment> survivors(int limit) {
        checkState(decision != null && decision.isSatisfiable(), "no satisfiable decision in state %s", state);
        if (free == null) free = FreeChoiceAnalyzer.analyze(decision);
        return searcher().survivors(canonical(), free, budget, limit);
    }

    private Assignment canonical() {
        return decision.assignment().orElseThrow(() -> new IllegalStateException("no canonical assignment"));
    }

    private InvariantFilterSearch searcher() {
        return new InvariantFilterSearch(transformation).setThreads(threads).setLogInterval(logInterval);
    }

    private void advance(State next) {
        log.debug("%s -> %s", state, next);
        state = next;
    }
}
