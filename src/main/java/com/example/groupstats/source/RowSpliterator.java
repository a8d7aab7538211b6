package com.example.groupstats.source;

import com.example.groupstats.model.Chunk;
import com.example.groupstats.model.Row;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A Spliterator that flattens the chunks of a {@link RecordSource} into single rows.
 *
 * <p>Chunks are read lazily as rows are consumed, so only one chunk is resident at a
 * time. Splitting is not supported: a record source can only be read sequentially.
 */
public class RowSpliterator implements Spliterator<Row> {

    private final ChunkIterator chunks;
    private Iterator<Row> currentChunkIterator;

    /**
     * Creates a new RowSpliterator.
     *
     * @param source the source to read from
     */
    public RowSpliterator(RecordSource source) {
        this.chunks = new ChunkIterator(source);
    }

    /**
     * Returns a sequential, lazy stream over every row of the source.
     *
     * @param source the source to read from
     * @return lazy stream of rows
     */
    public static Stream<Row> stream(RecordSource source) {
        return StreamSupport.stream(new RowSpliterator(source), false);
    }

    @Override
    public boolean tryAdvance(Consumer<? super Row> action) {
        while (currentChunkIterator == null || !currentChunkIterator.hasNext()) {
            if (!chunks.hasNext()) {
                return false;
            }
            Chunk chunk = chunks.next();
            currentChunkIterator = chunk.rows().iterator();
        }
        action.accept(currentChunkIterator.next());
        return true;
    }

    @Override
    public Spliterator<Row> trySplit() {
        return null;
    }

    /**
     * The total row count is unknown up front.
     */
    @Override
    public long estimateSize() {
        return Long.MAX_VALUE;
    }

    @Override
    public int characteristics() {
        return ORDERED | NONNULL | IMMUTABLE;
    }
}
