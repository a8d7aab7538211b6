package com.example.groupstats.aggregation;

import com.example.groupstats.model.Chunk;
import com.example.groupstats.model.GroupKey;
import com.example.groupstats.model.PartialAggregate;
import com.example.groupstats.model.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PartialAggregator - reduces exactly one chunk to per-group partials.
 */
class PartialAggregatorTest {

    private final PartialAggregator aggregator = new PartialAggregator();

    @Test
    @DisplayName("Should compute sum, count and frequencies per group")
    void shouldAggregateChunkPerGroup() {
        // Given
        Chunk chunk = new Chunk(1, List.of(
                Row.of("H1", "D1", "TxA", 10),
                Row.of("H1", "D2", "TxB", 5),
                Row.of("H1", "D1", "TxA", 20),
                Row.of("H1", "D1", "TxB", 30)
        ));

        // When
        Map<GroupKey, PartialAggregate> partials = aggregator.aggregate(chunk);

        // Then
        assertThat(partials).hasSize(2);
        PartialAggregate d1 = partials.get(GroupKey.of("H1", "D1"));
        assertThat(d1.sum()).isEqualTo(60.0);
        assertThat(d1.count()).isEqualTo(3);
        assertThat(d1.frequencies()).containsOnly(Map.entry("TxA", 2L), Map.entry("TxB", 1L));

        PartialAggregate d2 = partials.get(GroupKey.of("H1", "D2"));
        assertThat(d2.sum()).isEqualTo(5.0);
        assertThat(d2.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep groups in first-encounter order")
    void shouldKeepEncounterOrder() {
        Map<GroupKey, PartialAggregate> partials = aggregator.aggregate(List.of(
                Row.of("Z", "1", "T", 1),
                Row.of("A", "1", "T", 1),
                Row.of("Z", "1", "T", 1)
        ));

        assertThat(partials.keySet()).containsExactly(GroupKey.of("Z", "1"), GroupKey.of("A", "1"));
    }

    @Test
    @DisplayName("Should treat keys that differ only in case or whitespace as distinct")
    void shouldNotNormalizeKeys() {
        Map<GroupKey, PartialAggregate> partials = aggregator.aggregate(List.of(
                Row.of("General Hospital", "Asthma", "T", 1),
                Row.of("general hospital", "Asthma", "T", 1),
                Row.of("General Hospital ", "Asthma", "T", 1)
        ));

        assertThat(partials).hasSize(3);
    }

    @Test
    @DisplayName("Should return an empty map for an empty chunk")
    void shouldHandleEmptyChunk() {
        assertThat(aggregator.aggregate(new Chunk(1, List.of()))).isEmpty();
    }

    @Test
    @DisplayName("Should not carry state from one chunk to the next")
    void shouldBeStatelessAcrossCalls() {
        aggregator.aggregate(List.of(Row.of("H1", "D1", "TxA", 100)));

        Map<GroupKey, PartialAggregate> second = aggregator.aggregate(List.of(Row.of("H1", "D1", "TxB", 1)));

        PartialAggregate partial = second.get(GroupKey.of("H1", "D1"));
        assertThat(partial.count()).isEqualTo(1);
        assertThat(partial.sum()).isEqualTo(1.0);
        assertThat(partial.frequencies()).containsOnlyKeys("TxB");
    }
}
