package com.example.groupstats.job;

import java.time.Duration;

/**
 * Outcome of a successful aggregation job.
 *
 * @param requestId identifier of the job, used as partition key of every written item
 * @param rowsRead number of input rows aggregated
 * @param chunksRead number of chunks the input was read in
 * @param groupsWritten number of groups, and therefore items, written
 * @param elapsed wall-clock duration of the job
 */
public record JobResult(
        String requestId,
        long rowsRead,
        long chunksRead,
        int groupsWritten,
        Duration elapsed
) {
}
