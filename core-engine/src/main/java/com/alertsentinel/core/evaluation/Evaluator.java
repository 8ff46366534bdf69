package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.detection.DetectorConfig;
import com.alertsentinel.core.detection.DetectorRegistry;
import com.alertsentinel.core.detection.SeriesPreprocessor;
import com.alertsentinel.core.error.AlertEngineException;
import com.alertsentinel.core.error.ErrorKind;
import com.alertsentinel.core.error.SourceUnavailableException;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.EvaluationResult;
import com.alertsentinel.core.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Evaluates one alert: fetch, preprocess, detect.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Request {@link DetectorConfig#requiredPoints()} points from the
 * {@link SeriesSource} on the fetch executor, bounded by the fetch
 * timeout.</li>
 * <li>Transform the values with {@link SeriesPreprocessor}.</li>
 * <li>Score the series with the detector from {@link DetectorRegistry}.</li>
 * </ol>
 *
 * <h3>Failure handling</h3>
 * <p>
 * {@link #evaluate(AlertConfiguration)} never throws for data or source
 * problems: every failure is returned as an errored
 * {@link EvaluationResult}. Evaluation is a pure function of the fetched
 * series and the configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final SeriesSource source;
    private final ExecutorService fetchExecutor;
    private final Duration fetchTimeout;

    public Evaluator(SeriesSource source, ExecutorService fetchExecutor, Duration fetchTimeout) {
        this.source = Objects.requireNonNull(source, "SeriesSource must not be null");
        this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetch executor must not be null");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetch timeout must not be null");
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetch timeout must be positive, got: " + fetchTimeout);
        }
    }

    /**
     * Evaluate {@code alert} against the latest points of its series.
     *
     * @param alert validated alert; must not be {@code null}
     * @return the result, errored on any failure
     */
    public EvaluationResult evaluate(AlertConfiguration alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        DetectorConfig config = alert.effectiveDetectorConfig();

        Double rawValue = null;
        try {
            SeriesRequest request = SeriesRequest.forAlert(alert);
            List<SeriesPoint> points = fetch(request);
            if (points.size() > request.getNumPoints()) {
                points = points.subList(points.size() - request.getNumPoints(), points.size());
            }
            List<Double> values = points.stream().map(SeriesPoint::getValue).toList();
            if (!values.isEmpty()) {
                rawValue = values.get(values.size() - 1);
            }
            return evaluate(values, config).withRawValue(rawValue);
        } catch (AlertEngineException e) {
            LOG.debug("Evaluation of alert '{}' failed: {}", alert.getId(), e.getMessage());
            return EvaluationResult.errored(e.getKind(), e.getMessage(), rawValue);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure evaluating alert '{}'", alert.getId(), e);
            return EvaluationResult.errored(ErrorKind.EVALUATION_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), rawValue);
        }
    }

    /**
     * Preprocess and score raw values without fetching.
     *
     * @param values raw values, oldest first
     * @param config detector configuration
     * @return the detector result
     * @throws AlertEngineException if the series is too short for the detector
     */
    public static EvaluationResult evaluate(List<Double> values, DetectorConfig config) {
        List<Double> series = SeriesPreprocessor.transform(values, config.getOn(), config.minimumPoints());
        return DetectorRegistry.evaluate(series, config);
    }

    private List<SeriesPoint> fetch(SeriesRequest request) {
        Future<List<SeriesPoint>> future;
        try {
            future = fetchExecutor.submit(() -> source.fetch(request));
        } catch (RejectedExecutionException e) {
            throw new SourceUnavailableException("Fetch executor rejected request for " + request.getInsightRef(), e);
        }
        try {
            List<SeriesPoint> points = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return points != null ? points : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SourceUnavailableException(
                    "Series fetch for '" + request.getInsightRef() + "' timed out after " + fetchTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while fetching '" + request.getInsightRef() + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AlertEngineException engineException) {
                throw engineException;
            }
            throw new SourceUnavailableException(
                    "Series fetch for '" + request.getInsightRef() + "' failed: " + cause, cause);
        }
    }
}
