package com.example.groupstats.model;

import java.util.List;

/**
 * A bounded batch of rows read from a record source.
 *
 * @param index 1-based position of the chunk in the source
 * @param rows the rows, in source order
 */
public record Chunk(
        long index,
        List<Row> rows
) {
    public Chunk {
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    /**
     * Returns the number of rows in this chunk.
     */
    public int size() {
        return rows.size();
    }

    /**
     * Checks if this chunk is empty.
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
