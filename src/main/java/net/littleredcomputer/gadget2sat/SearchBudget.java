package net.littleredcomputer.gadget2sat;

import java.time.Duration;
import java.util.Optional;

/**
 * Limits on the filter search: how many candidate assignments it may evaluate, and for how long
 * it may run. A search stopped by its budget says so; it never reports exhaustion.
 */
public final class SearchBudget {
    private static final SearchBudget UNLIMITED = new SearchBudget(Long.MAX_VALUE, null);
    private final long maxSubsets;
    private final Duration maxDuration;

    private SearchBudget(long maxSubsets, Duration maxDuration) {
        if (maxSubsets < 1) throw new IllegalArgumentException("maxSubsets must be positive");
        if (maxDuration != null && (maxDuration.isNegative() || maxDuration.isZero())) {
            throw new IllegalArgumentException("maxDuration must be positive");
        }
        this.maxSubsets = maxSubsets;
        this.maxDuration = maxDuration;
    }

    public static SearchBudget unlimited() { return UNLIMITED; }

    public SearchBudget withMaxSubsets(long n) { return new SearchBudget(n, maxDuration); }
    public SearchBudget withMaxDuration(Duration d) { return new SearchBudget(maxSubsets, d); }

    public long maxSubsets() { return maxSubsets; }
    public Optional<Duration> maxDuration() { return Optional.ofNullable(maxDuration); }

    boolean isExpired(Duration elapsed) { return maxDuration != null && elapsed.compareTo(maxDuration) >= 0; }

    /** @return a clock measuring this budget's duration from now */
    Deadline start() { return Deadline.start(this); }

    @Override
    public String toString() {
        return String.format("budget[subsets=%s, duration=%s]",
                maxSubsets == Long.MAX_VALUE ? "∞" : Long.toString(maxSubsets),
                maxDuration == null ? "∞" : maxDuration);
    }
}
