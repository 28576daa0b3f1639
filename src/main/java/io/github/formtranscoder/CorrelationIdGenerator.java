package io.github.formtranscoder;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Generates compact, sortable identifiers such as {@code test-2025-01-01T12-30-45Z}.
 *
 * <p>Second resolution: two calls within the same second yield the same identifier.</p>
 */
public class CorrelationIdGenerator {

    private final String prefix;
    private final Clock clock;

    public CorrelationIdGenerator() {
        this(TranscoderConfig.defaults());
    }

    public CorrelationIdGenerator(TranscoderConfig config) {
        this(config.getIdentifierPrefix(), config.getClock());
    }

    public CorrelationIdGenerator(String prefix, Clock clock) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String generateId() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return prefix + "-" + DateTimeFormatter.ISO_INSTANT.format(now).replace(':', '-');
    }
}
