package com.example.groupstats.job;

import com.example.groupstats.aggregation.AggregateMerger;
import com.example.groupstats.aggregation.ResultMaterializer;
import com.example.groupstats.blob.BlobStore;
import com.example.groupstats.engine.AggregationEngine;
import com.example.groupstats.model.FinalRecord;
import com.example.groupstats.sink.SinkAdapter;
import com.example.groupstats.sink.SinkItem;
import com.example.groupstats.source.CsvRecordSource;
import com.example.groupstats.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs one aggregation job end to end.
 *
 * <p>The pipeline is:
 * <ol>
 *   <li>open the input blob and decode it as CSV, chunk by chunk</li>
 *   <li>aggregate every chunk and merge it into the running per-group state</li>
 *   <li>materialize one final record per group, in group order</li>
 *   <li>address each record under the request id and hand them to the sink</li>
 * </ol>
 *
 * <p>Nothing reaches the sink unless the whole input was aggregated. Any failure is
 * reported as a single {@link JobFailedException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * AggregationJob job = new AggregationJob(
 *     new FileSystemBlobStore(Path.of("data")),
 *     new BatchingSinkAdapter(new InMemoryKeyValueStore(), "hospital-averages", 25),
 *     JobConfig.defaults()
 * );
 * JobResult result = job.run(UUID.randomUUID().toString(), "medical_records.csv");
 * }</pre>
 */
public class AggregationJob {

    private static final Logger log = LoggerFactory.getLogger(AggregationJob.class);

    private final BlobStore blobStore;
    private final SinkAdapter sink;
    private final JobConfig config;
    private final AggregationEngine engine;
    private final ResultMaterializer materializer = new ResultMaterializer();

    /**
     * Creates a job using the engine selected by {@link JobConfig#mode()}.
     */
    public AggregationJob(BlobStore blobStore, SinkAdapter sink, JobConfig config) {
        this(blobStore, sink, config, AggregationEngine.forConfig(config));
    }

    /**
     * Creates a job with an explicit engine.
     */
    public AggregationJob(BlobStore blobStore, SinkAdapter sink, JobConfig config, AggregationEngine engine) {
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Aggregates a blob and persists one item per group.
     *
     * @param requestId identifier of this invocation, used as partition key
     * @param blobKey key of the input blob
     * @return counts of what was read and written
     * @throws JobFailedException if reading, aggregating or writing fails
     */
    public JobResult run(String requestId, String blobKey) {
        long startNanos = System.nanoTime();
        log.info("Job {} started: blob={}, mode={}, chunkSize={}",
                requestId, blobKey, config.mode(), config.chunkSize());

        AggregateMerger merger = aggregate(requestId, blobKey);
        List<FinalRecord> records = materializer.materialize(merger);
        List<SinkItem> items = records.stream()
                .map(record -> SinkItem.of(requestId, record))
                .collect(Collectors.toList());

        int written;
        try {
            written = sink.write(items);
        } catch (IOException | RuntimeException e) {
            log.error("Job {} failed while writing results", requestId, e);
            throw new JobFailedException(requestId, "could not persist " + items.size() + " results", e);
        }

        JobResult result = new JobResult(
                requestId,
                merger.rowsSeen(),
                merger.chunksSeen(),
                written,
                Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("Job {} finished: {} rows in {} chunks, {} groups written in {} ms",
                requestId, result.rowsRead(), result.chunksRead(), result.groupsWritten(),
                result.elapsed().toMillis());
        return result;
    }

    private AggregateMerger aggregate(String requestId, String blobKey) {
        try (InputStream input = blobStore.open(blobKey);
             RecordSource source = new CsvRecordSource(input, config)) {
            return engine.aggregate(source);
        } catch (IOException | RuntimeException e) {
            log.error("Job {} failed while aggregating {}", requestId, blobKey, e);
            throw new JobFailedException(requestId, "could not aggregate blob '" + blobKey + "'", e);
        }
    }
}
