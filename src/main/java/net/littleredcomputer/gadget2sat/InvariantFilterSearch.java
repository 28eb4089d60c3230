package net.littleredcomputer.gadget2sat;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Looks for a satisfying assignment of the transformed formula in which no clause gadget is in
 * its spurious state. Candidates are the canonical assignment changed by a set of free groups;
 * sets are tried by increasing size, so the first witness is a smallest perturbation of the
 * canonical assignment.
 * <p>
 * Sets containing two conflicting groups are never built, nor are sets containing a group
 * implied by another member (the same assignment arises from a smaller set). Every candidate
 * built is thus a distinct satisfying assignment, and all of them are reached. The number of
 * candidates is still exponential in the number of free groups in the worst case; the cost of a
 * run is reported in its {@link SearchStatistics}. Once a size admits no candidate, no larger
 * size can, and the search stops there.
 */
public class InvariantFilterSearch {
    private static final Logger log = LogManager.getFormatterLogger(InvariantFilterSearch.class);
    private final Transformation transformation;
    private int threads = 1;
    private Duration logInterval = Duration.ofMillis(1000);

    public InvariantFilterSearch(Transformation transformation) {
        this.transformation = transformation;
    }

    public InvariantFilterSearch setThreads(int threads) {
        if (threads < 1) throw new IllegalArgumentException("need at least one thread");
        this.threads = threads;
        return this;
    }

    public InvariantFilterSearch setLogInterval(Duration interval) {
        this.logInterval = interval;
        return this;
    }

    @CheckReturnValue
    public FilterResult search(Assignment canonical, FreeChoiceSet free, SearchBudget budget) {
        return search(canonical, free, budget.start());
    }

    /**
     * Search against a budget whose clock is already running, e.g. one that has also paid for
     * the free choice analysis.
     */
    @CheckReturnValue
    FilterResult search(Assignment canonical, FreeChoiceSet free, Deadline deadline) {
        final AtomicReference<Assignment> witness = new AtomicReference<>();
        Run run = new Run(canonical, free, deadline, a -> {
            witness.compareAndSet(null, a);
            return true;
        });
        run.execute();
        SearchStatistics s = run.statistics();
        FilterResult result;
        if (witness.get() != null) result = FilterResult.found(witness.get(), s);
        else if (run.budgetExceeded.get()) result = FilterResult.budgetExceeded(s);
        else result = FilterResult.exhausted(s);
        log.info("filter search %s: %s", result.outcome(), s);
        return result;
    }

    /**
     * Continue the search past the first witness, collecting distinct surviving assignments
     * projected onto the original variables.
     * @param limit the most models to collect
     * @return the models, in the order found
     */
    public List<Assignment> survivors(Assignment canonical, FreeChoiceSet free, SearchBudget budget, int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be positive");
        final Set<Assignment> models = new LinkedHashSet<>();
        new Run(canonical, free, budget.start(), a -> {
            synchronized (models) {
                models.add(Projector.projectToAssignment(a, transformation.auxiliaryMap()));
                return models.size() >= limit;
            }
        }).execute();
        synchronized (models) {
            return new ArrayList<>(models);
        }
    }

    // The state of one search. Workers share it; each builds its own candidates.
    private class Run {
        private final Assignment canonical;
        private final FreeChoiceSet free;
        private final Deadline deadline;
        private final Predicate<Assignment> survivor;  // returns true when the search should stop
        private final ProgressMeter meter = new ProgressMeter("filter");
        private final AtomicBoolean stop = new AtomicBoolean();
        private final AtomicBoolean budgetExceeded = new AtomicBoolean();
        private final AtomicLong explored = new AtomicLong();
        private final AtomicLong pruned = new AtomicLong();
        private final AtomicLong levelCandidates = new AtomicLong();
        private final AtomicInteger level = new AtomicInteger();

        Run(Assignment canonical, FreeChoiceSet free, Deadline deadline, Predicate<Assignment> survivor) {
            if (canonical.size() != transformation.transformed().nVariables()) {
                throw new IllegalArgumentException("canonical assignment does not fit the transformed formula");
            }
            this.canonical = canonical;
            this.free = free;
            this.deadline = deadline;
            this.survivor = survivor;
            meter.setLogInterval(logInterval);
        }

        void execute() {
            meter.start();
            try {
                if (!evaluate(free.none(), 0)) return;
                if (threads == 1) {
                    for (int size = 1; size <= free.size() && !stop.get(); ++size) {
                        beginLevel(size);
                        for (int first = 0; first + size <= free.size() && !stop.get(); ++first) enumerate(size, first);
                        if (endLevel()) break;
                    }
                } else {
                    executeInParallel();
                }
            } finally {
                meter.stop();
            }
        }

        private void executeInParallel() {
            ExecutorService pool = Executors.newFixedThreadPool(threads,
                    new ThreadFactoryBuilder().setNameFormat("filter-search-%d").setDaemon(true).build());
            try {
                for (int size = 1; size <= free.size() && !stop.get(); ++size) {
                    beginLevel(size);
                    final int s = size;
                    List<Future<?>> work = new ArrayList<>();
                    for (int first = 0; first + size <= free.size(); ++first) {
                        final int f = first;
                        work.add(pool.submit(() -> enumerate(s, f)));
                    }
                    for (Future<?> w : work) w.get();
                    if (endLevel()) break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("filter search interrupted at subset size %d", level.get());
                budgetExceeded.set(true);
                stop.set(true);
            } catch (ExecutionException e) {
                stop.set(true);
                throw new IllegalStateException("filter search worker failed", e.getCause());
            } finally {
                pool.shutdownNow();
            }
        }

        private void beginLevel(int size) {
            level.set(size);
            levelCandidates.set(0);
            log.debug("trying subsets of size %d", size);
        }

        // Returns true if no set of the level just finished was consistent, in which case no
        // larger one is either.
        private boolean endLevel() {
            if (stop.get() || levelCandidates.get() > 0) return false;
            log.debug("no consistent subset of size %d; search space exhausted", level.get());
            return true;
        }

        // All subsets of the given size whose smallest group is first.
        private void enumerate(int size, int first) {
            extend(free.none().with(free.group(first)), first, 1, size);
        }

        // Extend a selection of depth groups, the last of them last, to one of size groups.
        private boolean extend(FreeChoiceSet.Selection chosen, int last, int depth, int size) {
            if (depth == size) return evaluate(chosen, size);
            final int k = free.size();
            for (int g = last + 1; g + (size - depth) <= k; ++g) {
                if (stop.get()) return false;
                FreeChoiceGroup h = free.group(g);
                if (!chosen.admits(h)) {
                    // whole levels may be pruned without a candidate, so the clock is read here too
                    if (pruned.incrementAndGet() % ProgressMeter.logCheckSteps == 0 && deadline.isExpired()) {
                        return exceedBudget();
                    }
                    continue;
                }
                if (!extend(chosen.with(h), g, depth + 1, size)) return false;
            }
            return true;
        }

        // Returns false when the search should stop.
        private boolean evaluate(FreeChoiceSet.Selection chosen, int size) {
            if (stop.get()) return false;
            if (deadline.isExpired()) return exceedBudget();
            if (explored.incrementAndGet() > deadline.budget().maxSubsets()) {
                explored.decrementAndGet();
                return exceedBudget();
            }
            levelCandidates.incrementAndGet();
            Assignment candidate = chosen.applyTo(canonical);
            meter.step(() -> String.format("size %d, %d explored, %d pruned", size, explored.get(), pruned.get()));
            if (transformation.invariantHolds(candidate) && survivor.test(candidate)) {
                stop.set(true);
                return false;
            }
            return true;
        }

        private boolean exceedBudget() {
            budgetExceeded.set(true);
            stop.set(true);
            return false;
        }

        SearchStatistics statistics() {
            return new SearchStatistics(free.size(), explored.get(), pruned.get(), level.get(), deadline.elapsed());
        }
    }
}
