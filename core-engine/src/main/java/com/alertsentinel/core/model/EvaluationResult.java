package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of evaluating one alert against its series.
 *
 * <p>
 * {@code value} is the decision statistic: the checked value for threshold
 * detectors, the score for z-score and MAD detectors. {@code rawValue} is the
 * underlying metric point under evaluation. Errored results carry an
 * {@link ErrorKind}, no value and no breaches.
 * </p>
 *
 * <p>
 * Instances are immutable; breaches and metadata are copied on construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationResult {

    private final Double value;
    private final Double rawValue;
    private final List<String> breaches;
    private final Map<String, Object> metadata;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private EvaluationResult(Builder builder) {
        this.value = builder.value;
        this.rawValue = builder.rawValue;
        this.breaches = Collections.unmodifiableList(new ArrayList<>(builder.breaches));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.errorKind = builder.errorKind;
        this.errorMessage = builder.errorMessage;
    }

    /**
     * Create a breach-free result describing a failed evaluation.
     *
     * @param kind     failure classification; must not be {@code null}
     * @param message  human-readable description
     * @param rawValue current raw point, if one was fetched
     * @return errored result
     */
    public static EvaluationResult errored(ErrorKind kind, String message, Double rawValue) {
        Objects.requireNonNull(kind, "ErrorKind must not be null");
        return builder()
                .rawValue(rawValue)
                .errorKind(kind)
                .errorMessage(message)
                .metadata("error", kind.name())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param rawValue the raw point under evaluation
     * @return a copy of this result carrying {@code rawValue}
     */
    public EvaluationResult withRawValue(Double rawValue) {
        Builder builder = builder()
                .value(value)
                .rawValue(rawValue)
                .errorKind(errorKind)
                .errorMessage(errorMessage);
        breaches.forEach(builder::breach);
        metadata.forEach(builder::metadata);
        return builder.build();
    }

    public Double getValue() {
        return value;
    }

    public Double getRawValue() {
        return rawValue;
    }

    public List<String> getBreaches() {
        return breaches;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isErrored() {
        return errorKind != null;
    }

    public boolean isBreached() {
        return errorKind == null && !breaches.isEmpty();
    }

    /**
     * Fluent builder for {@link EvaluationResult}.
     */
    public static class Builder {
        private Double value;
        private Double rawValue;
        private final List<String> breaches = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private ErrorKind errorKind;
        private String errorMessage;

        public Builder value(Double value) {
            this.value = value;
            return this;
        }

        public Builder rawValue(Double rawValue) {
            this.rawValue = rawValue;
            return this;
        }

        public Builder breach(String message) {
            this.breaches.add(Objects.requireNonNull(message, "breach message must not be null"));
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder errorKind(ErrorKind errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public EvaluationResult build() {
            return new EvaluationResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationResult that))
            return false;
        return Objects.equals(value, that.value)
                && Objects.equals(rawValue, that.rawValue)
                && breaches.equals(that.breaches)
                && metadata.equals(that.metadata)
                && errorKind == that.errorKind
                && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, rawValue, breaches, metadata, errorKind, errorMessage);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "value=" + value +
                ", rawValue=" + rawValue +
                ", breaches=" + breaches +
                ", metadata=" + metadata +
                (errorKind != null ? ", error=" + errorKind + ": " + errorMessage : "") +
                '}';
    }
}
