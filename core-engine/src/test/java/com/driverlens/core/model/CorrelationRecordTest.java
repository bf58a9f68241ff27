package com.driverlens.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CorrelationRecord}.
 */
class CorrelationRecordTest {

    @Test
    @DisplayName("Should clip r and p_value into their ranges")
    void shouldClipValues() {
        CorrelationRecord record = new CorrelationRecord("value_a", CorrelationMethod.LINEAR, 1.0000001, -1e-18);

        assertThat(record.getR()).isEqualTo(1.0);
        assertThat(record.getPValue()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should replace NaN with the neutral pair")
    void shouldReplaceNaN() {
        CorrelationRecord record = new CorrelationRecord("value_a", CorrelationMethod.RANK_BASED, Double.NaN, 0.2);

        assertThat(record.getR()).isEqualTo(0.0);
        assertThat(record.getPValue()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Neutral record should use the linear method")
    void neutralRecord() {
        CorrelationRecord record = CorrelationRecord.neutral("value_a");

        assertThat(record.getMethod()).isEqualTo(CorrelationMethod.LINEAR);
        assertThat(record.getR()).isZero();
        assertThat(record.getPValue()).isEqualTo(1.0);
    }
}
