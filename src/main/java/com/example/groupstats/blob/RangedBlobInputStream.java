package com.example.groupstats.blob;

import java.io.IOException;
import java.io.InputStream;

/**
 * An InputStream that reads a blob as a series of consecutive byte ranges.
 *
 * <p>A range is only fetched once the previous one has been consumed, so at most one
 * range is held in memory. Lines may straddle range boundaries; callers that decode
 * text read through this stream and never see the boundaries.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe.
 */
public class RangedBlobInputStream extends InputStream {

    /**
     * Fetches the bytes {@code start..end} (inclusive) of a blob.
     */
    @FunctionalInterface
    public interface RangeFetcher {
        BlobRange fetch(long start, long end) throws IOException;
    }

    private final RangeFetcher fetcher;
    private final long rangeSize;

    private byte[] buffer = new byte[0];
    private int position = 0;
    private long nextStart = 0;
    private boolean lastRangeFetched = false;
    private boolean closed = false;

    /**
     * @param fetcher performs the ranged reads
     * @param rangeSize number of bytes requested per range
     */
    public RangedBlobInputStream(RangeFetcher fetcher, long rangeSize) {
        if (rangeSize <= 0) {
            throw new IllegalArgumentException("rangeSize must be positive: " + rangeSize);
        }
        this.fetcher = fetcher;
        this.rangeSize = rangeSize;
    }

    @Override
    public int read() throws IOException {
        if (!ensureAvailable()) {
            return -1;
        }
        return buffer[position++] & 0xFF;
    }

    @Override
    public int read(byte[] target, int offset, int length) throws IOException {
        if (length == 0) {
            return 0;
        }
        if (!ensureAvailable()) {
            return -1;
        }
        int count = Math.min(length, buffer.length - position);
        System.arraycopy(buffer, position, target, offset, count);
        position += count;
        return count;
    }

    @Override
    public int available() {
        return buffer.length - position;
    }

    @Override
    public void close() {
        closed = true;
        buffer = new byte[0];
        position = 0;
    }

    private boolean ensureAvailable() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        while (position >= buffer.length) {
            if (lastRangeFetched) {
                return false;
            }
            fetchNextRange();
        }
        return true;
    }

    private void fetchNextRange() throws IOException {
        BlobRange range = fetcher.fetch(nextStart, nextStart + rangeSize - 1);
        if (range.body().length == 0 && !range.isLast()) {
            throw new IOException("Empty range returned at offset " + nextStart
                    + " of " + range.totalLength() + " bytes");
        }
        buffer = range.body();
        position = 0;
        nextStart = range.end() + 1;
        lastRangeFetched = range.isLast();
    }
}
