package com.example.groupstats.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits result items into batches no larger than the store's batch-write limit.
 */
public class BatchingSinkAdapter implements SinkAdapter {

    private static final Logger log = LoggerFactory.getLogger(BatchingSinkAdapter.class);

    private final KeyValueStore store;
    private final String table;
    private final int batchSize;

    /**
     * @param store the destination store
     * @param table the destination table
     * @param batchSize maximum items per batch write
     */
    public BatchingSinkAdapter(KeyValueStore store, String table, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.batchSize = batchSize;
    }

    @Override
    public int write(List<SinkItem> items) throws IOException {
        int written = 0;
        List<Map<String, String>> batch = new ArrayList<>(batchSize);
        for (SinkItem item : items) {
            batch.add(item.toAttributes());
            if (batch.size() == batchSize) {
                written += flush(batch);
            }
        }
        if (!batch.isEmpty()) {
            written += flush(batch);
        }
        return written;
    }

    private int flush(List<Map<String, String>> batch) throws IOException {
        int size = batch.size();
        store.batchWrite(table, List.copyOf(batch));
        log.debug("Wrote batch of {} items to {}", size, table);
        batch.clear();
        return size;
    }
}
