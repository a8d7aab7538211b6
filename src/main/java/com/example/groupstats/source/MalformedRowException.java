package com.example.groupstats.source;

import java.io.IOException;

/**
 * Thrown when an input row cannot be decoded into a typed row.
 *
 * <p>Bad rows are never skipped; one malformed row fails the whole job.
 */
public class MalformedRowException extends IOException {

    private final long lineNumber;

    public MalformedRowException(long lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public MalformedRowException(long lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based line of the offending row, or 0 when unknown.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
