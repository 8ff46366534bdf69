package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One {@code (timestamp, value)} point of a metric series.
 *
 * @since 1.0.0
 */
public final class SeriesPoint {

    private final Instant timestamp;
    private final double value;

    @JsonCreator
    public SeriesPoint(@JsonProperty("timestamp") Instant timestamp, @JsonProperty("value") double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "SeriesPoint{" + timestamp + "=" + value + '}';
    }
}
