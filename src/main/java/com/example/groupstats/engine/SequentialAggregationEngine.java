package com.example.groupstats.engine;

import com.example.groupstats.aggregation.AggregateMerger;
import com.example.groupstats.aggregation.PartialAggregator;
import com.example.groupstats.model.Chunk;
import com.example.groupstats.source.ChunkIterator;
import com.example.groupstats.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Pull-based chunked aggregation on the calling thread.
 *
 * <p>Each chunk is reduced to partial aggregates and merged before the next chunk is
 * read, so memory holds one chunk plus the per-group state.
 */
public class SequentialAggregationEngine implements AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(SequentialAggregationEngine.class);

    private final PartialAggregator partialAggregator = new PartialAggregator();

    @Override
    public AggregateMerger aggregate(RecordSource source) throws IOException {
        AggregateMerger merger = new AggregateMerger();
        ChunkIterator chunks = new ChunkIterator(source);
        try {
            while (chunks.hasNext()) {
                Chunk chunk = chunks.next();
                merger.merge(partialAggregator.aggregate(chunk));
                log.debug("Merged chunk {} ({} rows, {} groups so far)",
                        chunk.index(), chunk.size(), merger.groupCount());
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return merger;
    }
}
