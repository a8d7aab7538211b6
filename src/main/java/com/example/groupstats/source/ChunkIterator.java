package com.example.groupstats.source;

import com.example.groupstats.model.Chunk;
import com.example.groupstats.model.Row;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * An Iterator that lazily pulls chunks from a {@link RecordSource}.
 *
 * <p>A chunk is only read when {@link #hasNext()} needs it, so at most one chunk is
 * held by the iterator at a time. Iteration ends at the first empty chunk.
 *
 * <p>Example usage:
 * <pre>{@code
 * ChunkIterator chunks = new ChunkIterator(source);
 * while (chunks.hasNext()) {
 *     Chunk chunk = chunks.next();
 *     // Process chunk
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 */
public class ChunkIterator implements Iterator<Chunk> {

    private final RecordSource source;

    private Chunk pending;
    private long chunksRead = 0;
    private boolean finished = false;

    /**
     * Creates a new ChunkIterator.
     *
     * @param source the source to read from
     */
    public ChunkIterator(RecordSource source) {
        this.source = source;
    }

    /**
     * Returns {@code true} if another non-empty chunk is available.
     *
     * <p>May read the next chunk from the source.
     *
     * @throws UncheckedIOException if the source fails
     */
    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        return fetchNextChunk();
    }

    /**
     * Returns the next chunk.
     *
     * @throws NoSuchElementException if the source is exhausted
     */
    @Override
    public Chunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more chunks available");
        }
        Chunk chunk = pending;
        pending = null;
        return chunk;
    }

    /**
     * Returns how many non-empty chunks have been read so far.
     */
    public long chunksRead() {
        return chunksRead;
    }

    private boolean fetchNextChunk() {
        try {
            List<Row> rows = source.nextChunk();
            if (rows == null || rows.isEmpty()) {
                finished = true;
                return false;
            }
            chunksRead++;
            pending = new Chunk(chunksRead, rows);
            return true;
        } catch (IOException e) {
            finished = true;
            throw new UncheckedIOException("Failed to read chunk " + (chunksRead + 1), e);
        }
    }
}
