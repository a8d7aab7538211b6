package com.example.groupstats.sink;

import com.example.groupstats.model.FinalRecord;
import com.example.groupstats.model.GroupKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SinkItemTest {

    @Test
    @DisplayName("Should address a record by request id and diagnosis/hospital sort key")
    void shouldAddressRecord() {
        // Given
        FinalRecord record = new FinalRecord(GroupKey.of("H1", "D1"), 20.0, "TxA");

        // When
        SinkItem item = SinkItem.of("req-1", record);

        // Then
        assertThat(item.partitionKey()).isEqualTo("req-1");
        assertThat(item.sortKey()).isEqualTo("#diagnosis#D1#hospital#H1");
    }

    @Test
    @DisplayName("Should render attributes with the average as a decimal string")
    void shouldRenderAttributes() {
        SinkItem item = SinkItem.of("req-1", new FinalRecord(GroupKey.of("General Hospital", "Asthma"), 12.5, "Therapy A"));

        Map<String, String> attributes = item.toAttributes();

        assertThat(attributes).containsExactly(
                Map.entry("PK", "req-1"),
                Map.entry("SK", "#diagnosis#Asthma#hospital#General Hospital"),
                Map.entry("Hospital", "General Hospital"),
                Map.entry("Diagnosis", "Asthma"),
                Map.entry("AverageRecoveryTime", "12.5"),
                Map.entry("MostUsedTreatment", "Therapy A"));
    }

    @Test
    @DisplayName("Should keep the full precision of the average")
    void shouldNotRoundAverage() {
        SinkItem item = SinkItem.of("req-1", new FinalRecord(GroupKey.of("H", "D"), 10.0 / 3.0, "T"));

        assertThat(item.toAttributes().get(SinkItem.AVERAGE_RECOVERY_TIME)).isEqualTo(Double.toString(10.0 / 3.0));
    }
}
