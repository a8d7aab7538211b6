package com.example.groupstats.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps tables in memory, ordered by partition key then sort key.
 *
 * <p>Also records the size of every batch it receives, which makes batching
 * behavior observable.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, Map<ItemKey, Map<String, String>>> tables = new ConcurrentHashMap<>();
    private final List<Integer> batchSizes = new CopyOnWriteArrayList<>();

    @Override
    public void batchWrite(String table, List<Map<String, String>> items) {
        Map<ItemKey, Map<String, String>> rows = tables.computeIfAbsent(table, name -> new TreeMap<>());
        synchronized (rows) {
            for (Map<String, String> item : items) {
                rows.put(ItemKey.of(item), Map.copyOf(item));
            }
        }
        batchSizes.add(items.size());
    }

    /**
     * Returns every item of a table, in key order.
     */
    public List<Map<String, String>> items(String table) {
        Map<ItemKey, Map<String, String>> rows = tables.get(table);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return new ArrayList<>(rows.values());
        }
    }

    /**
     * Returns one item, or {@code null} if absent.
     */
    public Map<String, String> get(String table, String partitionKey, String sortKey) {
        Map<ItemKey, Map<String, String>> rows = tables.get(table);
        if (rows == null) {
            return null;
        }
        synchronized (rows) {
            return rows.get(new ItemKey(partitionKey, sortKey));
        }
    }

    /**
     * Returns the sizes of all batches received, in arrival order.
     */
    public List<Integer> batchSizes() {
        return Collections.unmodifiableList(batchSizes);
    }

    private record ItemKey(String partitionKey, String sortKey) implements Comparable<ItemKey> {

        static ItemKey of(Map<String, String> item) {
            String partitionKey = item.get(SinkItem.PARTITION_KEY);
            String sortKey = item.get(SinkItem.SORT_KEY);
            if (partitionKey == null || sortKey == null) {
                throw new IllegalArgumentException("Item is missing its key attributes: " + item);
            }
            return new ItemKey(partitionKey, sortKey);
        }

        @Override
        public int compareTo(ItemKey other) {
            int byPartition = partitionKey.compareTo(other.partitionKey);
            return byPartition != 0 ? byPartition : sortKey.compareTo(other.sortKey);
        }
    }
}
