package com.example.groupstats.job;

/**
 * Terminal failure of an aggregation job.
 *
 * <p>Jobs are not resumable: aggregation state is not checkpointed, so a failed job
 * is retried by running it again from the start.
 */
public class JobFailedException extends RuntimeException {

    private final String requestId;

    public JobFailedException(String requestId, String message, Throwable cause) {
        super("Job " + requestId + " failed: " + message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
