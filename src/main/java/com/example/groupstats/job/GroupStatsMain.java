package com.example.groupstats.job;

import com.example.groupstats.sink.BatchingSinkAdapter;
import com.example.groupstats.sink.JsonLinesKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;

/**
 * Process entry point: aggregates one blob and writes the results as JSON lines.
 *
 * <p>Usage:
 * <pre>
 * BLOB_SOURCE=./data FILE_NAME=rows_1000000_medical_records.csv \
 * DB_TABLE=hospital-averages OUTPUT_DIR=./out \
 * java -cp ... com.example.groupstats.job.GroupStatsMain
 *
 * # Optional: CHUNK_SIZE=50000 PROCESSING_MODE=pipelined
 * </pre>
 *
 * <p>Exits with status 1 if the job fails and 2 if the environment is invalid.
 */
public class GroupStatsMain {

    private static final Logger log = LoggerFactory.getLogger(GroupStatsMain.class);

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();

        LaunchSettings settings;
        JobConfig config;
        try {
            settings = LaunchSettings.fromEnvironment(env);
            config = JobConfig.fromEnvironment(env);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        AggregationJob job = new AggregationJob(
                settings.blobStore(),
                new BatchingSinkAdapter(
                        new JsonLinesKeyValueStore(settings.outputDirectory()),
                        settings.table(),
                        config.sinkBatchSize()),
                config);

        try {
            JobResult result = job.run(UUID.randomUUID().toString(), settings.fileName());
            log.info("Data processed and stored successfully: {} records written to {}",
                    result.groupsWritten(), settings.table());
        } catch (JobFailedException e) {
            log.error(e.getMessage(), e);
            System.exit(1);
        }
    }
}
