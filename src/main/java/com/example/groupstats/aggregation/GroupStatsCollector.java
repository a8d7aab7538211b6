package com.example.groupstats.aggregation;

import com.example.groupstats.model.GroupKey;
import com.example.groupstats.model.PartialAggregate;
import com.example.groupstats.model.Row;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * A Collector that aggregates a whole stream of rows in one pass.
 *
 * <p>The entire stream is treated as a single chunk: rows fold into one partial
 * aggregate per group, which is merged once into a fresh {@link AggregateMerger}.
 * Only per-group totals are kept in memory, never the rows.
 *
 * <p>Example usage:
 * <pre>{@code
 * AggregateMerger merger = rows.collect(GroupStatsCollector.toGroupStats());
 * List<FinalRecord> records = new ResultMaterializer().materialize(merger);
 * }</pre>
 */
public class GroupStatsCollector implements Collector<Row, Map<GroupKey, PartialAggregate>, AggregateMerger> {

    /**
     * Returns a Collector that aggregates rows into per-group statistics.
     */
    public static GroupStatsCollector toGroupStats() {
        return new GroupStatsCollector();
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
    public BinaryOperator<Map<GroupKey, PartialAggregate>> combiner() {
        return (left, right) -> {
            right.forEach((group, partial) -> left.merge(group, partial, PartialAggregate::combine));
            return left;
        };
    }

    @Override
    public Function<Map<GroupKey, PartialAggregate>, AggregateMerger> finisher() {
        return partials -> partials.isEmpty()
                ? new AggregateMerger()
                : new AggregateMerger().merge(partials);
    }

    @Override
    public Set<Characteristics> characteristics() {
        // Not UNORDERED: summation order decides the floating-point result
        return Set.of();
    }
}
