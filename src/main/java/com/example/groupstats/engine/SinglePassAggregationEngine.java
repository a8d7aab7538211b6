package com.example.groupstats.engine;

import com.example.groupstats.aggregation.AggregateMerger;
import com.example.groupstats.aggregation.GroupStatsCollector;
import com.example.groupstats.model.Row;
import com.example.groupstats.source.RecordSource;
import com.example.groupstats.source.RowSpliterator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.stream.Stream;

/**
 * Aggregates the whole input as one stream of rows, as if it were a single chunk.
 *
 * <p>The source is still read lazily, but sums are accumulated row by row across the
 * whole dataset instead of per chunk.
 */
public class SinglePassAggregationEngine implements AggregationEngine {

    @Override
    public AggregateMerger aggregate(RecordSource source) throws IOException {
        try (Stream<Row> rows = RowSpliterator.stream(source)) {
            return rows.collect(GroupStatsCollector.toGroupStats());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
