package net.littleredcomputer.gadget2sat;

import com.google.common.base.Stopwatch;

import java.time.Duration;

/**
 * The running clock of one search budget, started when the budget's work begins. Reads are
 * unsynchronized so that workers may consult it for every candidate.
 */
final class Deadline {
    private final SearchBudget budget;
    private final Stopwatch stopwatch = Stopwatch.createStarted();

    private Deadline(SearchBudget budget) {
        this.budget = budget;
    }

    static Deadline start(SearchBudget budget) { return new Deadline(budget); }

    SearchBudget budget() { return budget; }
    Duration elapsed() { return stopwatch.elapsed(); }
    boolean isExpired() { return budget.isExpired(stopwatch.elapsed()); }
}
