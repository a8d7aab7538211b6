package com.example.groupstats.engine;

import com.example.groupstats.aggregation.AggregateMerger;
import com.example.groupstats.job.JobConfig;
import com.example.groupstats.source.RecordSource;

import java.io.IOException;

/**
 * Reads a record source to exhaustion and returns the merged per-group state.
 *
 * <p>Every engine produces the same merged frequencies and counts for the same input;
 * they differ only in how reading and aggregation are scheduled. A failure aborts
 * the whole aggregation and no partial state is returned.
 */
public interface AggregationEngine {

    /**
     * Aggregates every row of the source.
     *
     * @param source the source to drain; the caller remains responsible for closing it
     * @return the merger holding one running aggregate per group
     * @throws IOException if the source cannot be read or a row is malformed
     */
    AggregateMerger aggregate(RecordSource source) throws IOException;

    /**
     * Creates the engine for a processing mode.
     *
     * @param config the job configuration
     * @return the engine selected by {@link JobConfig#mode()}
     */
    static AggregationEngine forConfig(JobConfig config) {
        return switch (config.mode()) {
            case SINGLE_PASS -> new SinglePassAggregationEngine();
            case CHUNKED -> new SequentialAggregationEngine();
            case PIPELINED -> new PipelinedAggregationEngine(config.pipelineQueueCapacity());
        };
    }
}
