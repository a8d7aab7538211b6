package com.example.groupstats.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Cumulative aggregate state for one group across every chunk of a job.
 *
 * <p>Mutated additively only. {@code count} always equals the number of rows seen
 * for the group so far, and {@code sum} accumulates chunk sums in chunk order.
 */
public final class RunningAggregate {

    private double sum = 0.0;
    private long count = 0;
    private final Map<String, Long> frequencies = new HashMap<>();

    /**
     * Folds one chunk's partial aggregate into this running state.
     *
     * @param partial the partial aggregate for the same group
     */
    public void merge(PartialAggregate partial) {
        sum += partial.sum();
        count += partial.count();
        partial.frequencies().forEach((category, occurrences) ->
                frequencies.merge(category, occurrences, Long::sum));
    }

    /**
     * Returns the category with the highest merged frequency.
     *
     * <p>When several categories share the highest count, the lexicographically
     * smallest one wins, so the result never depends on encounter order.
     *
     * @return the dominant category
     * @throws IllegalStateException if no rows have been merged
     */
    public String dominantCategory() {
        String best = null;
        long bestCount = -1;
        for (Map.Entry<String, Long> entry : frequencies.entrySet()) {
            long occurrences = entry.getValue();
            if (occurrences > bestCount
                    || (occurrences == bestCount && entry.getKey().compareTo(best) < 0)) {
                best = entry.getKey();
                bestCount = occurrences;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No categories merged yet");
        }
        return best;
    }

    /**
     * Returns {@code sum / count}.
     *
     * @throws IllegalStateException if no rows have been merged
     */
    public double average() {
        if (count == 0) {
            throw new IllegalStateException("No rows merged yet");
        }
        return sum / count;
    }

    public double sum() {
        return sum;
    }

    public long count() {
        return count;
    }

    public Map<String, Long> frequencies() {
        return Collections.unmodifiableMap(frequencies);
    }

    @Override
    public String toString() {
        return "RunningAggregate[sum=" + sum + ", count=" + count + ", frequencies=" + frequencies + "]";
    }
}
