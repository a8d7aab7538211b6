package com.example.groupstats.sink;

import java.io.IOException;
import java.util.List;

/**
 * Persists result items into the destination store.
 */
public interface SinkAdapter {

    /**
     * Writes all items.
     *
     * @param items the items to persist, in order
     * @return the number of items written
     * @throws IOException if the store rejects a write
     */
    int write(List<SinkItem> items) throws IOException;
}
