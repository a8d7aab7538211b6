package com.example.groupstats.engine;

import com.example.groupstats.aggregation.AggregateMerger;
import com.example.groupstats.aggregation.PartialAggregator;
import com.example.groupstats.model.Row;
import com.example.groupstats.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.List;

/**
 * Chunked aggregation with reading and aggregation on separate threads.
 *
 * <p>Uses Project Reactor:
 * <ul>
 *   <li>{@link Flux#generate} pulls chunks from the source on a bounded elastic scheduler</li>
 *   <li>{@code publishOn} with a bounded prefetch is the queue between the two stages</li>
 *   <li>{@code reduceWith} merges partials on a single consumer thread, in source order</li>
 * </ul>
 *
 * <p>The reader runs at most {@code queueCapacity} chunks ahead of the aggregator.
 * Results are identical to {@link SequentialAggregationEngine} for the same chunking.
 */
public class PipelinedAggregationEngine implements AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelinedAggregationEngine.class);

    private final int queueCapacity;
    private final PartialAggregator partialAggregator = new PartialAggregator();

    /**
     * @param queueCapacity maximum number of chunks buffered between reader and aggregator
     */
    public PipelinedAggregationEngine(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    @Override
    public AggregateMerger aggregate(RecordSource source) throws IOException {
        Scheduler mergeScheduler = Schedulers.newSingle("group-stats-merge");
        try {
            return Flux.<List<Row>>generate(sink -> emitNextChunk(source, sink))
                    .subscribeOn(Schedulers.boundedElastic())
                    .publishOn(mergeScheduler, queueCapacity)
                    .map(rows -> partialAggregator.aggregate(rows))
                    .reduceWith(AggregateMerger::new, (merger, partials) -> {
                        merger.merge(partials);
                        log.debug("Merged chunk {} ({} groups so far)", merger.chunksSeen(), merger.groupCount());
                        return merger;
                    })
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw e;
        } finally {
            mergeScheduler.dispose();
        }
    }

    private static void emitNextChunk(RecordSource source, SynchronousSink<List<Row>> sink) {
        try {
            List<Row> rows = source.nextChunk();
            if (rows == null || rows.isEmpty()) {
                sink.complete();
            } else {
                sink.next(rows);
            }
        } catch (IOException e) {
            sink.error(e);
        }
    }
}
