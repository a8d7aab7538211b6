package com.example.groupstats.sink;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Appends items as JSON objects, one per line, to {@code <directory>/<table>.jsonl}.
 *
 * <p>Being append-only, a later item with the same key does not replace an earlier
 * line; readers keep the last line per key.
 */
public class JsonLinesKeyValueStore implements KeyValueStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonLinesKeyValueStore(Path directory) {
        this(directory, new ObjectMapper());
    }

    public JsonLinesKeyValueStore(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public synchronized void batchWrite(String table, List<Map<String, String>> items) throws IOException {
        Files.createDirectories(directory);
        try (BufferedWriter writer = Files.newBufferedWriter(
                tableFile(table),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND)) {
            for (Map<String, String> item : items) {
                writer.write(objectMapper.writeValueAsString(item));
                writer.newLine();
            }
        }
    }

    /**
     * Returns the file backing a table.
     */
    public Path tableFile(String table) {
        return directory.resolve(table + ".jsonl");
    }
}
