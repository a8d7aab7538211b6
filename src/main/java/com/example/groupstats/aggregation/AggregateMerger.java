package com.example.groupstats.aggregation;

import com.example.groupstats.model.GroupKey;
import com.example.groupstats.model.PartialAggregate;
import com.example.groupstats.model.RunningAggregate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Owns the running aggregate of every group for the lifetime of one job.
 *
 * <p>Partial aggregates must be merged in source chunk order. Frequency merging is
 * order independent, but floating-point sums are only reproducible for a fixed
 * chunk order and partition.
 *
 * <p>Frequencies are always merged globally before a dominant category is chosen;
 * a per-chunk winner is never carried forward.
 *
 * <p>Memory grows with the number of distinct groups, not with the number of rows.
 * This class is NOT thread-safe: exactly one consumer merges into it.
 */
public class AggregateMerger {

    private final Map<GroupKey, RunningAggregate> running = new HashMap<>();
    private long rowsSeen = 0;
    private long chunksSeen = 0;

    /**
     * Merges one chunk's partial aggregates into the running state.
     *
     * @param partials partial aggregates of a single chunk
     * @return this merger
     */
    public AggregateMerger merge(Map<GroupKey, PartialAggregate> partials) {
        for (Map.Entry<GroupKey, PartialAggregate> entry : partials.entrySet()) {
            PartialAggregate partial = entry.getValue();
            running.computeIfAbsent(entry.getKey(), group -> new RunningAggregate()).merge(partial);
            rowsSeen += partial.count();
        }
        chunksSeen++;
        return this;
    }

    /**
     * Returns a read-only view of the running aggregates keyed by group.
     */
    public Map<GroupKey, RunningAggregate> runningAggregates() {
        return Collections.unmodifiableMap(running);
    }

    /**
     * Returns the running aggregate of one group, or {@code null} if the group
     * has not been seen.
     */
    public RunningAggregate get(GroupKey group) {
        return running.get(group);
    }

    public int groupCount() {
        return running.size();
    }

    public long rowsSeen() {
        return rowsSeen;
    }

    public long chunksSeen() {
        return chunksSeen;
    }
}
