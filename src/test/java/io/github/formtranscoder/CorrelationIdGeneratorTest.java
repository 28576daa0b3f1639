package io.github.formtranscoder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class CorrelationIdGeneratorTest {

    @Test
    @DisplayName("instant is truncated to seconds and colons become hyphens")
    void format() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-09T07:05:03.999Z"), ZoneOffset.UTC);

        assertThat(new CorrelationIdGenerator("test", clock).generateId()).isEqualTo("test-2025-03-09T07-05-03Z");
    }

    @Test
    @DisplayName("output is UTC regardless of the clock zone")
    void utcRegardlessOfZone() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-09T23:30:00Z"), ZoneId.of("Asia/Tokyo"));

        assertThat(new CorrelationIdGenerator("test", clock).generateId()).isEqualTo("test-2025-03-09T23-30-00Z");
    }

    @Test
    @DisplayName("prefix and clock come from the configuration")
    void fromConfig() {
        TranscoderConfig config = TranscoderConfig.builder()
                .identifierPrefix("run")
                .clock(Clock.fixed(Instant.parse("2024-12-31T00:00:00Z"), ZoneOffset.UTC))
                .build();

        assertThat(new CorrelationIdGenerator(config).generateId()).isEqualTo("run-2024-12-31T00-00-00Z");
    }

    @Test
    @DisplayName("default generator matches the documented shape")
    void shape() {
        assertThat(new CorrelationIdGenerator().generateId())
                .matches("test-\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}Z");
    }
}
