package com.example.groupstats.sink;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Minimal batch-write client of a partition/sort keyed store.
 *
 * <p>Every item carries its key in the {@link SinkItem#PARTITION_KEY} and
 * {@link SinkItem#SORT_KEY} attributes. Writing an item whose key already exists
 * replaces it.
 */
public interface KeyValueStore {

    /**
     * Writes one batch of items to a table.
     *
     * @param table the table name
     * @param items the items of the batch
     * @throws IOException if the batch could not be written
     */
    void batchWrite(String table, List<Map<String, String>> items) throws IOException;
}
