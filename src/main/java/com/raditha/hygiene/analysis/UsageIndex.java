package com.raditha.hygiene.analysis;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Forward usage index over one statement sequence, built by {@link UsageAnalyzer#build}.
 * <p>
 * Positions are statement indices. For every name the index keeps the sorted positions of the
 * statements that read it and of the statements that rebind it at block level, plus the
 * positions of wildcard statements (statements that may read anything).
 */
public final class UsageIndex {

    private static final int[] NONE = new int[0];

    private final List<FreeVariableCollector.Reads> perStatement;
    private final Map<String, int[]> reads;
    private final Map<String, int[]> rebinds;
    private final int[] wildcards;

    UsageIndex(List<FreeVariableCollector.Reads> perStatement, Map<String, int[]> reads,
               Map<String, int[]> rebinds, int[] wildcards) {
        this.perStatement = perStatement;
        this.reads = reads;
        this.rebinds = rebinds;
        this.wildcards = wildcards;
    }

    public int size() {
        return perStatement.size();
    }

    /**
     * True when some statement at or after {@code from} reads {@code name}, or may read it.
     * Rebinding in between is ignored, which makes this the cheaper and more conservative query.
     */
    public boolean usedLater(int from, String name) {
        if (wildcards.length > 0 && wildcards[wildcards.length - 1] >= from) {
            return true;
        }
        int[] r = reads.getOrDefault(name, NONE);
        return r.length > 0 && r[r.length - 1] >= from;
    }

    /**
     * True when the binding of {@code name} visible at {@code from} is read before a later
     * statement replaces it. A statement that reads and rebinds ({@code x = x + 1}) reads first.
     */
    public boolean liveAt(int from, String name) {
        int nextUse = Math.min(next(reads.getOrDefault(name, NONE), from), next(wildcards, from));
        if (nextUse == Integer.MAX_VALUE) {
            return false;
        }
        return nextUse <= next(rebinds.getOrDefault(name, NONE), from);
    }

    /**
     * Number of read occurrences of {@code name} in statements at or after {@code from}.
     * Wildcard statements are not counted; check {@link #hasWildcardFrom(int)} separately.
     */
    public int readCount(int from, String name) {
        int total = 0;
        for (int i = Math.max(from, 0); i < perStatement.size(); i++) {
            total += perStatement.get(i).count(name);
        }
        return total;
    }

    public boolean hasWildcardFrom(int from) {
        return wildcards.length > 0 && wildcards[wildcards.length - 1] >= from;
    }

    public FreeVariableCollector.Reads readsAt(int position) {
        return perStatement.get(position);
    }

    public boolean rebindsAt(int position, String name) {
        return Arrays.binarySearch(rebinds.getOrDefault(name, NONE), position) >= 0;
    }

    private static int next(int[] sorted, int from) {
        int i = Arrays.binarySearch(sorted, from);
        if (i < 0) {
            i = -i - 1;
        }
        return i < sorted.length ? sorted[i] : Integer.MAX_VALUE;
    }
}
