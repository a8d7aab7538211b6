package com.example.groupstats.engine;

/**
 * How a job reads and aggregates its input.
 */
public enum ProcessingMode {

    /** All rows flow through one collector in a single in-memory pass. */
    SINGLE_PASS,

    /** Chunks are read and merged one after another on the calling thread. */
    CHUNKED,

    /** Chunk reading overlaps with aggregation through a bounded queue. */
    PIPELINED
}
