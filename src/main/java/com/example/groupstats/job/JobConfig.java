package com.example.groupstats.job;

import com.example.groupstats.engine.ProcessingMode;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of one aggregation job.
 *
 * @param chunkSize maximum number of rows read per chunk
 * @param groupFields input columns forming the group key
 * @param numericField input column that is averaged
 * @param categoricalField input column whose most frequent value is reported
 * @param sinkBatchSize maximum number of items per store batch write
 * @param pipelineQueueCapacity chunks buffered between reader and aggregator in pipelined mode
 * @param mode how chunks are read and aggregated
 */
public record JobConfig(
        int chunkSize,
        GroupFields groupFields,
        String numericField,
        String categoricalField,
        int sinkBatchSize,
        int pipelineQueueCapacity,
        ProcessingMode mode
) {
    public static final int DEFAULT_CHUNK_SIZE = 10_000;
    public static final int DEFAULT_SINK_BATCH_SIZE = 25;
    public static final int DEFAULT_PIPELINE_QUEUE_CAPACITY = 4;

    public JobConfig {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (sinkBatchSize <= 0) {
            throw new IllegalArgumentException("sinkBatchSize must be positive: " + sinkBatchSize);
        }
        if (pipelineQueueCapacity <= 0) {
            throw new IllegalArgumentException("pipelineQueueCapacity must be positive: " + pipelineQueueCapacity);
        }
        Objects.requireNonNull(groupFields, "groupFields must not be null");
        Objects.requireNonNull(numericField, "numericField must not be null");
        Objects.requireNonNull(categoricalField, "categoricalField must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
    }

    /**
     * Column layout of the medical records dataset, read in chunks of 10,000 rows.
     */
    public static JobConfig defaults() {
        return new JobConfig(
                DEFAULT_CHUNK_SIZE,
                new GroupFields("Hospital", "Diagnosis"),
                "Recovery Time",
                "Treatment",
                DEFAULT_SINK_BATCH_SIZE,
                DEFAULT_PIPELINE_QUEUE_CAPACITY,
                ProcessingMode.CHUNKED
        );
    }

    /**
     * Overlays the defaults with values found in an environment map.
     *
     * <p>Recognized variables: {@code CHUNK_SIZE}, {@code PROCESSING_MODE},
     * {@code GROUP_FIELDS} (two comma-separated names), {@code NUMERIC_FIELD},
     * {@code CATEGORICAL_FIELD}, {@code SINK_BATCH_SIZE} and
     * {@code PIPELINE_QUEUE_CAPACITY}. Absent or blank variables keep their default.
     *
     * @param env environment variables, usually {@code System.getenv()}
     * @return the resulting configuration
     * @throws IllegalArgumentException if a variable is present but invalid
     */
    public static JobConfig fromEnvironment(Map<String, String> env) {
        JobConfig defaults = defaults();
        return new JobConfig(
                intValue(env, "CHUNK_SIZE", defaults.chunkSize()),
                groupFieldsValue(env, defaults.groupFields()),
                stringValue(env, "NUMERIC_FIELD", defaults.numericField()),
                stringValue(env, "CATEGORICAL_FIELD", defaults.categoricalField()),
                intValue(env, "SINK_BATCH_SIZE", defaults.sinkBatchSize()),
                intValue(env, "PIPELINE_QUEUE_CAPACITY", defaults.pipelineQueueCapacity()),
                modeValue(env, defaults.mode())
        );
    }

    public JobConfig withChunkSize(int newChunkSize) {
        return new JobConfig(newChunkSize, groupFields, numericField, categoricalField,
                sinkBatchSize, pipelineQueueCapacity, mode);
    }

    public JobConfig withMode(ProcessingMode newMode) {
        return new JobConfig(chunkSize, groupFields, numericField, categoricalField,
                sinkBatchSize, pipelineQueueCapacity, newMode);
    }

    public JobConfig withSinkBatchSize(int newSinkBatchSize) {
        return new JobConfig(chunkSize, groupFields, numericField, categoricalField,
                newSinkBatchSize, pipelineQueueCapacity, mode);
    }

    private static String stringValue(Map<String, String> env, String name, String fallback) {
        String value = env.get(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intValue(Map<String, String> env, String name, int fallback) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: '" + value + "'", e);
        }
    }

    private static ProcessingMode modeValue(Map<String, String> env, ProcessingMode fallback) {
        String value = env.get("PROCESSING_MODE");
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return ProcessingMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("PROCESSING_MODE must be one of "
                    + Arrays.toString(ProcessingMode.values()) + ": '" + value + "'", e);
        }
    }

    private static GroupFields groupFieldsValue(Map<String, String> env, GroupFields fallback) {
        String value = env.get("GROUP_FIELDS");
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String[] parts = value.split(",");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("GROUP_FIELDS must name exactly two columns: '" + value + "'");
        }
        return new GroupFields(parts[0].trim(), parts[1].trim());
    }

    /**
     * The two input columns that form a group key, in key order.
     */
    public record GroupFields(String first, String second) {
        public GroupFields {
            Objects.requireNonNull(first, "first must not be null");
            Objects.requireNonNull(second, "second must not be null");
        }
    }
}
