package net.littleredcomputer.gadget2sat;

import java.math.BigInteger;
import java.time.Duration;

/**
 * What a filter search cost. The number of explored candidates never exceeds the number of
 * subsets of free groups.
 */
public final class SearchStatistics {
    private final int groups;
    private final long explored;
    private final long pruned;
    private final int largestSubset;
    private final Duration elapsed;

    SearchStatistics(int groups, long explored, long pruned, int largestSubset, Duration elapsed) {
        this.groups = groups;
        this.explored = explored;
        this.pruned = pruned;
        this.largestSubset = largestSubset;
        this.elapsed = elapsed;
    }

    /** @return the number of free groups k; there are 2^k subsets */
    public int groups() { return groups; }

    /** @return candidate assignments built and tested against the invariant */
    public long explored() { return explored; }

    /** @return subset extensions rejected as conflicting or redundant without being built */
    public long pruned() { return pruned; }

    /** @return the largest subset size the search reached */
    public int largestSubset() { return largestSubset; }

    public Duration elapsed() { return elapsed; }

    public BigInteger subsetSpace() { return BigInteger.ONE.shiftLeft(groups); }

    @Override
    public String toString() {
        return String.format("%d groups, %d explored, %d pruned, subsets up to size %d, %s",
                groups, explored, pruned, largestSubset, elapsed);
    }
}
