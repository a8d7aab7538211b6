package com.example.groupstats.source;

import com.example.groupstats.model.Row;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * A finite, lazily read sequence of rows delivered in bounded chunks.
 *
 * <p>A source can only be read once, from the start. An empty chunk signals
 * end-of-stream; every later call returns an empty chunk as well.
 *
 * <p><b>Thread Safety:</b> implementations are NOT thread-safe. A single consumer
 * pulls chunks in order.
 */
public interface RecordSource extends Closeable {

    /**
     * Reads the next chunk of rows.
     *
     * @return the next rows in source order, or an empty list at end-of-stream
     * @throws MalformedRowException if a row cannot be decoded
     * @throws IOException if the underlying bytes cannot be read
     */
    List<Row> nextChunk() throws IOException;

    /**
     * Releases the underlying resources. The default does nothing.
     */
    @Override
    default void close() throws IOException {
    }
}
