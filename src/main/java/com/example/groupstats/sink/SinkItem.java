package com.example.groupstats.sink;

import com.example.groupstats.model.FinalRecord;
import com.example.groupstats.model.GroupKey;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One result item addressed for the destination key-value store.
 *
 * @param partitionKey the job's request identifier, shared by every item of a job
 * @param sortKey {@code #diagnosis#<second>#hospital#<first>}
 * @param group the group the statistics belong to
 * @param averageValue mean of the numeric measure
 * @param dominantCategory most frequent categorical value
 */
public record SinkItem(
        String partitionKey,
        String sortKey,
        GroupKey group,
        double averageValue,
        String dominantCategory
) {
    public static final String PARTITION_KEY = "PK";
    public static final String SORT_KEY = "SK";
    public static final String HOSPITAL = "Hospital";
    public static final String DIAGNOSIS = "Diagnosis";
    public static final String AVERAGE_RECOVERY_TIME = "AverageRecoveryTime";
    public static final String MOST_USED_TREATMENT = "MostUsedTreatment";

    public SinkItem {
        Objects.requireNonNull(partitionKey, "partitionKey must not be null");
        Objects.requireNonNull(sortKey, "sortKey must not be null");
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(dominantCategory, "dominantCategory must not be null");
    }

    /**
     * Addresses a final record under the given partition key.
     */
    public static SinkItem of(String partitionKey, FinalRecord record) {
        return new SinkItem(
                partitionKey,
                sortKeyFor(record.group()),
                record.group(),
                record.averageValue(),
                record.dominantCategory()
        );
    }

    /**
     * Builds the sort key of a group.
     */
    public static String sortKeyFor(GroupKey group) {
        return "#diagnosis#" + group.second() + "#hospital#" + group.first();
    }

    /**
     * Renders this item as store attributes. The average is written as a decimal string.
     */
    public Map<String, String> toAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(PARTITION_KEY, partitionKey);
        attributes.put(SORT_KEY, sortKey);
        attributes.put(HOSPITAL, group.first());
        attributes.put(DIAGNOSIS, group.second());
        attributes.put(AVERAGE_RECOVERY_TIME, Double.toString(averageValue));
        attributes.put(MOST_USED_TREATMENT, dominantCategory);
        return attributes;
    }
}
