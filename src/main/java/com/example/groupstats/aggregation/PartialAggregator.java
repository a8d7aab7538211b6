package com.example.groupstats.aggregation;

import com.example.groupstats.model.Chunk;
import com.example.groupstats.model.GroupKey;
import com.example.groupstats.model.PartialAggregate;
import com.example.groupstats.model.Row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reduces exactly one chunk of rows to a partial aggregate per group.
 *
 * <p>Pure and stateless across calls: no I/O, and nothing survives from one chunk
 * to the next. An empty chunk yields an empty map.
 *
 * <p>Groups appear in the result in first-encounter order.
 */
public class PartialAggregator
        implements Aggregator<Row, Map<GroupKey, PartialAggregate>, Map<GroupKey, PartialAggregate>> {

    /**
     * Aggregates the rows of a chunk.
     *
     * @param chunk the chunk to aggregate
     * @return partial aggregates keyed by group
     */
    public Map<GroupKey, PartialAggregate> aggregate(Chunk chunk) {
        return aggregate(chunk.rows());
    }

    /**
     * Adds one row to a per-group accumulator map, creating the group entry on
     * first occurrence.
     */
    static void accumulate(Map<GroupKey, PartialAggregate> partials, Row row) {
        partials.computeIfAbsent(row.group(), group -> new PartialAggregate()).add(row);
    }

    @Override
    public Supplier<Map<GroupKey, PartialAggregate>> supplier() {
        return LinkedHashMap::new;
    }

    @Override
    public BiConsumer<Map<GroupKey, PartialAggregate>, Row> accumulator() {
        return PartialAggregator::accumulate;
    }

    @Override
    public Function<Map<GroupKey, PartialAggregate>, Map<GroupKey, PartialAggregate>> finisher() {
        return Collections::unmodifiableMap;
    }
}
