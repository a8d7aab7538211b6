package com.example.groupstats.engine;

import com.example.groupstats.MedicalRecordsFixture;
import com.example.groupstats.aggregation.AggregateMerger;
import com.example.groupstats.aggregation.ResultMaterializer;
import com.example.groupstats.job.JobConfig;
import com.example.groupstats.model.FinalRecord;
import com.example.groupstats.model.Row;
import com.example.groupstats.source.ListRecordSource;
import com.example.groupstats.source.MalformedRowException;
import com.example.groupstats.source.RecordSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests that every engine produces the same results regardless of chunking.
 *
 * <h2>What This Tests</h2>
 * <ul>
 *   <li>Same groups, averages and dominant categories for chunk sizes 1, 7 and 10,000</li>
 *   <li>Pipelined results are bit-identical to sequential results for the same chunking</li>
 *   <li>Read failures abort the aggregation in every mode</li>
 * </ul>
 */
class AggregationEngineTest {

    private static final List<Row> ROWS = MedicalRecordsFixture.randomRows(2_000, 42);
    private static final int[] CHUNK_SIZES = {1, 7, 10_000};

    private final ResultMaterializer materializer = new ResultMaterializer();

    private static AggregationEngine engine(ProcessingMode mode) {
        return AggregationEngine.forConfig(JobConfig.defaults().withMode(mode));
    }

    private List<FinalRecord> run(AggregationEngine engine, List<Row> rows, int chunkSize) throws IOException {
        return materializer.materialize(engine.aggregate(new ListRecordSource(rows, chunkSize)));
    }

    // =========================================================================
    // CHUNK INVARIANCE
    // =========================================================================

    @ParameterizedTest
    @EnumSource(ProcessingMode.class)
    @DisplayName("Should produce the same results for every chunk size")
    void shouldBeChunkInvariant(ProcessingMode mode) throws IOException {
        // Given
        List<FinalRecord> reference = run(new SequentialAggregationEngine(), ROWS, ROWS.size());

        for (int chunkSize : CHUNK_SIZES) {
            // When
            List<FinalRecord> actual = run(engine(mode), ROWS, chunkSize);

            // Then
            assertThat(actual).hasSameSizeAs(reference);
            for (int i = 0; i < reference.size(); i++) {
                FinalRecord expected = reference.get(i);
                FinalRecord record = actual.get(i);
                assertThat(record.group()).isEqualTo(expected.group());
                assertThat(record.dominantCategory())
                        .as("dominant category of %s with chunk size %d", expected.group(), chunkSize)
                        .isEqualTo(expected.dominantCategory());
                assertThat(record.averageValue()).isCloseTo(expected.averageValue(), within(1e-9));
            }
        }
    }

    @Test
    @DisplayName("Should produce bit-identical results in pipelined and sequential mode")
    void shouldMatchSequentialExactly() throws IOException {
        for (int chunkSize : CHUNK_SIZES) {
            List<FinalRecord> sequential = run(new SequentialAggregationEngine(), ROWS, chunkSize);
            List<FinalRecord> pipelined = run(new PipelinedAggregationEngine(2), ROWS, chunkSize);

            assertThat(pipelined).isEqualTo(sequential);
        }
    }

    @ParameterizedTest
    @EnumSource(ProcessingMode.class)
    @DisplayName("Should count every row exactly once")
    void shouldConserveRowCount(ProcessingMode mode) throws IOException {
        AggregateMerger merger = engine(mode).aggregate(new ListRecordSource(ROWS, 7));

        assertThat(merger.rowsSeen()).isEqualTo(ROWS.size());
        long total = merger.runningAggregates().values().stream()
                .mapToLong(aggregate -> aggregate.count())
                .sum();
        assertThat(total).isEqualTo(ROWS.size());
    }

    // =========================================================================
    // EDGE CASES
    // =========================================================================

    @ParameterizedTest
    @EnumSource(ProcessingMode.class)
    @DisplayName("Should produce no records for an empty source")
    void shouldHandleEmptySource(ProcessingMode mode) throws IOException {
        List<FinalRecord> records = run(engine(mode), List.of(), 10);

        assertThat(records).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(ProcessingMode.class)
    @DisplayName("Should abort on a malformed row after earlier chunks succeeded")
    void shouldPropagateReadFailure(ProcessingMode mode) {
        // Given
        RecordSource failing = new RecordSource() {
            private int calls = 0;

            @Override
            public List<Row> nextChunk() throws IOException {
                if (++calls == 1) {
                    return ROWS.subList(0, 10);
                }
                throw new MalformedRowException(12, "Recovery Time is not a number: 'abc'");
            }
        };

        // When / Then
        assertThatThrownBy(() -> engine(mode).aggregate(failing))
                .isInstanceOf(MalformedRowException.class)
                .hasMessageContaining("Line 12");
    }

    // =========================================================================
    // ENGINE SELECTION
    // =========================================================================

    @Test
    @DisplayName("Should select the engine for each processing mode")
    void shouldSelectEngineForMode() {
        assertThat(engine(ProcessingMode.SINGLE_PASS)).isInstanceOf(SinglePassAggregationEngine.class);
        assertThat(engine(ProcessingMode.CHUNKED)).isInstanceOf(SequentialAggregationEngine.class);
        assertThat(engine(ProcessingMode.PIPELINED)).isInstanceOf(PipelinedAggregationEngine.class);
    }

    @Test
    @DisplayName("Should reject a non-positive queue capacity")
    void shouldRejectInvalidQueueCapacity() {
        assertThatThrownBy(() -> new PipelinedAggregationEngine(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
