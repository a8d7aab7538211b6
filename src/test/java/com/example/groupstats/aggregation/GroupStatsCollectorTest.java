package com.example.groupstats.aggregation;

import com.example.groupstats.MedicalRecordsFixture;
import com.example.groupstats.model.FinalRecord;
import com.example.groupstats.model.GroupKey;
import com.example.groupstats.model.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for GroupStatsCollector - single-pass aggregation of a row stream.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AggregateMerger merger = rows.collect(GroupStatsCollector.toGroupStats());
 * }</pre>
 */
class GroupStatsCollectorTest {

    @Test
    @DisplayName("Should aggregate a stream of rows per group")
    void shouldAggregateStream() {
        // When
        AggregateMerger merger = Stream.of(
                Row.of("H1", "D1", "TxA", 10),
                Row.of("H1", "D1", "TxA", 20),
                Row.of("H1", "D1", "TxB", 30),
                Row.of("H2", "D1", "TxC", 4)
        ).collect(GroupStatsCollector.toGroupStats());

        // Then
        assertThat(merger.rowsSeen()).isEqualTo(4);
        assertThat(merger.chunksSeen()).isEqualTo(1);
        assertThat(new ResultMaterializer().materialize(merger)).containsExactly(
                new FinalRecord(GroupKey.of("H1", "D1"), 20.0, "TxA"),
                new FinalRecord(GroupKey.of("H2", "D1"), 4.0, "TxC"));
    }

    @Test
    @DisplayName("Should handle empty stream")
    void shouldHandleEmptyStream() {
        AggregateMerger merger = Stream.<Row>empty().collect(GroupStatsCollector.toGroupStats());

        assertThat(merger.groupCount()).isZero();
        assertThat(merger.chunksSeen()).isZero();
    }

    @Test
    @DisplayName("Should give the same results for a parallel stream")
    void shouldSupportParallelStreams() {
        // Given
        List<Row> rows = MedicalRecordsFixture.randomRows(10_000, 11);

        // When
        List<FinalRecord> sequential = new ResultMaterializer()
                .materialize(rows.stream().collect(GroupStatsCollector.toGroupStats()));
        List<FinalRecord> parallel = new ResultMaterializer()
                .materialize(rows.parallelStream().collect(GroupStatsCollector.toGroupStats()));

        // Then
        assertThat(parallel).hasSameSizeAs(sequential);
        for (int i = 0; i < sequential.size(); i++) {
            assertThat(parallel.get(i).group()).isEqualTo(sequential.get(i).group());
            assertThat(parallel.get(i).dominantCategory()).isEqualTo(sequential.get(i).dominantCategory());
            assertThat(parallel.get(i).averageValue()).isCloseTo(sequential.get(i).averageValue(), within(1e-9));
        }
    }
}
