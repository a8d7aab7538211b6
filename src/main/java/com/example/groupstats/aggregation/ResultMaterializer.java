package com.example.groupstats.aggregation;

import com.example.groupstats.model.FinalRecord;
import com.example.groupstats.model.GroupKey;
import com.example.groupstats.model.RunningAggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns the final running aggregates into one {@link FinalRecord} per group.
 *
 * <p>Records are ordered ascending by {@code (group.first, group.second)}. Every
 * group produces exactly one record; nothing is filtered.
 */
public class ResultMaterializer {

    /**
     * Materializes the records held by a merger.
     *
     * @param merger the merger after the last chunk has been merged
     * @return final records in group order
     */
    public List<FinalRecord> materialize(AggregateMerger merger) {
        return materialize(merger.runningAggregates());
    }

    /**
     * Materializes records from running aggregates keyed by group.
     *
     * @param aggregates running aggregates keyed by group
     * @return final records in group order
     */
    public List<FinalRecord> materialize(Map<GroupKey, RunningAggregate> aggregates) {
        List<GroupKey> groups = new ArrayList<>(aggregates.keySet());
        groups.sort(Comparator.naturalOrder());

        List<FinalRecord> records = new ArrayList<>(groups.size());
        for (GroupKey group : groups) {
            records.add(FinalRecord.from(group, aggregates.get(group)));
        }
        return records;
    }
}
