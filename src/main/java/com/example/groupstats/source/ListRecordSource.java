package com.example.groupstats.source;

import com.example.groupstats.model.Row;

import java.util.List;
import java.util.Objects;

/**
 * Serves rows that are already in memory, in chunks of a fixed size.
 */
public class ListRecordSource implements RecordSource {

    private final List<Row> rows;
    private final int chunkSize;
    private int position = 0;

    /**
     * Creates a source over the given rows.
     *
     * @param rows the rows to serve, in order
     * @param chunkSize maximum number of rows per chunk
     */
    public ListRecordSource(List<Row> rows, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
        this.chunkSize = chunkSize;
    }

    @Override
    public List<Row> nextChunk() {
        if (position >= rows.size()) {
            return List.of();
        }
        int end = Math.min(position + chunkSize, rows.size());
        List<Row> chunk = rows.subList(position, end);
        position = end;
        return chunk;
    }
}
