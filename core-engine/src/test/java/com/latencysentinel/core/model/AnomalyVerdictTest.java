package com.latencysentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyVerdict} and {@link AnomalyType}.
 */
class AnomalyVerdictTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should serialize with the incident manager's field names")
    void shouldSerializeWireShape() throws Exception {
        AnomalyVerdict verdict = AnomalyVerdict.builder()
                .anomalyDetected(true)
                .anomalyType(AnomalyType.SPIKE)
                .anomalyScore(100)
                .mean(100.1)
                .stdDev(1.7)
                .zScore(235.2)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(verdict));

        assertThat(json.get("anomalyDetected").asBoolean()).isTrue();
        assertThat(json.get("anomalyType").asText()).isEqualTo("spike");
        assertThat(json.get("anomalyScore").asDouble()).isEqualTo(100.0);
        assertThat(json.get("mean").asDouble()).isEqualTo(100.1);
        assertThat(json.get("stdDev").asDouble()).isEqualTo(1.7);
        assertThat(json.get("zScore").asDouble()).isEqualTo(235.2);
        assertThat(json.size()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should read back a verdict from JSON")
    void shouldDeserialize() throws Exception {
        String json = "{\"anomalyDetected\":true,\"anomalyType\":\"slowdown\",\"anomalyScore\":87.5,"
                + "\"mean\":120.0,\"stdDev\":10.0,\"zScore\":2.625}";

        AnomalyVerdict verdict = mapper.readValue(json, AnomalyVerdict.class);

        assertThat(verdict.isAnomalyDetected()).isTrue();
        assertThat(verdict.getAnomalyType()).isEqualTo(AnomalyType.SLOWDOWN);
        assertThat(verdict.getAnomalyScore()).isEqualTo(87.5);
        assertThat(verdict.getZScore()).isEqualTo(2.625);
    }

    @Test
    @DisplayName("Insufficient-history verdict echoes the current value as mean")
    void insufficientHistoryVerdict() {
        AnomalyVerdict verdict = AnomalyVerdict.insufficientHistory(250);

        assertThat(verdict.isAnomalyDetected()).isFalse();
        assertThat(verdict.getAnomalyType()).isEqualTo(AnomalyType.UNKNOWN);
        assertThat(verdict.getAnomalyScore()).isZero();
        assertThat(verdict.getMean()).isEqualTo(250.0);
        assertThat(verdict.getStdDev()).isZero();
        assertThat(verdict.getZScore()).isZero();
    }

    @Test
    @DisplayName("Equality distinguishes -0.0 from 0.0")
    void equalityIsBitwise() {
        AnomalyVerdict positive = AnomalyVerdict.builder().zScore(0.0).build();
        AnomalyVerdict negative = AnomalyVerdict.builder().zScore(-0.0).build();

        assertThat(positive).isNotEqualTo(negative);
        assertThat(positive).isEqualTo(AnomalyVerdict.builder().zScore(0.0).build());
    }

    @Test
    @DisplayName("Builder rejects a null type")
    void shouldRejectNullType() {
        assertThatThrownBy(() -> AnomalyVerdict.builder().anomalyType(null).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Anomaly types resolve from their wire values")
    void shouldResolveWireValues() {
        assertThat(AnomalyType.fromWireValue("SPIKE")).isEqualTo(AnomalyType.SPIKE);
        assertThat(AnomalyType.fromWireValue("unknown")).isEqualTo(AnomalyType.UNKNOWN);
        assertThatThrownBy(() -> AnomalyType.fromWireValue("outage"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown anomaly type");
    }
}
