package com.example.groupstats.model;

import java.util.Objects;

/**
 * Finalized statistics for one group, ready to be persisted.
 */
public record FinalRecord(
        GroupKey group,
        double averageValue,
        String dominantCategory
) {
    public FinalRecord {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(dominantCategory, "dominantCategory must not be null");
    }

    /**
     * Builds the final record for a group from its running aggregate.
     */
    public static FinalRecord from(GroupKey group, RunningAggregate aggregate) {
        return new FinalRecord(group, aggregate.average(), aggregate.dominantCategory());
    }
}
