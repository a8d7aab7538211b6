package com.example.groupstats.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate state for one group, scoped to a single chunk.
 *
 * <p>Created fresh per chunk and discarded once merged into a
 * {@link RunningAggregate}.
 */
public final class PartialAggregate {

    private double sum = 0.0;
    private long count = 0;
    private final Map<String, Long> frequencies = new LinkedHashMap<>();

    /**
     * Adds one row's measures.
     *
     * @param row the row to add
     */
    public void add(Row row) {
        sum += row.numericMeasure();
        count++;
        frequencies.merge(row.categoricalMeasure(), 1L, Long::sum);
    }

    /**
     * Combines another partial aggregate of the same group into this one.
     *
     * @param other the partial aggregate to absorb
     * @return this partial aggregate with combined totals
     */
    public PartialAggregate combine(PartialAggregate other) {
        this.sum += other.sum;
        this.count += other.count;
        other.frequencies.forEach((category, occurrences) ->
                this.frequencies.merge(category, occurrences, Long::sum));
        return this;
    }

    public double sum() {
        return sum;
    }

    public long count() {
        return count;
    }

    /**
     * Returns a read-only view of category occurrence counts within the chunk.
     */
    public Map<String, Long> frequencies() {
        return Collections.unmodifiableMap(frequencies);
    }

    @Override
    public String toString() {
        return "PartialAggregate[sum=" + sum + ", count=" + count + ", frequencies=" + frequencies + "]";
    }
}
