package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.error.ErrorKind;
import com.alertsentinel.core.error.SourceUnavailableException;
import com.alertsentinel.core.model.AlertCondition;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.CalculationInterval;
import com.alertsentinel.core.model.EvaluationResult;
import com.alertsentinel.core.support.FakeSeriesSource;
import com.alertsentinel.core.support.TestAlerts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Evaluator}.
 */
class EvaluatorTest {

    private final ExecutorService fetchPool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        fetchPool.shutdownNow();
    }

    @Test
    @DisplayName("Should request window + 1 points and breach on a spike")
    void breachesOnSpike() {
        FakeSeriesSource source = FakeSeriesSource.of(10, 10, 10, 10, 10, 40);
        AlertConfiguration alert = TestAlerts.zscore("z1").build();

        EvaluationResult result = evaluator(source).evaluate(alert);

        assertThat(result.isBreached()).isTrue();
        assertThat(result.getRawValue()).isEqualTo(40.0);
        assertThat(source.getRequests()).containsExactly(
                new SeriesRequest("insight-z1", 0, CalculationInterval.HOURLY, 6, false));
    }

    @Test
    @DisplayName("Evaluating the same series twice yields equal results")
    void idempotent() {
        FakeSeriesSource source = FakeSeriesSource.of(3, 5, 4, 6, 5, 9);
        Evaluator evaluator = evaluator(source);
        AlertConfiguration alert = TestAlerts.zscore("z1").build();

        assertThat(evaluator.evaluate(alert)).isEqualTo(evaluator.evaluate(alert));
    }

    @Test
    @DisplayName("Only the most recent requested points are evaluated")
    void trimsExtraPoints() {
        FakeSeriesSource source = FakeSeriesSource.of(1_000, 1_000, 1_000, 50);
        AlertConfiguration alert = TestAlerts.upperThreshold("t1", 100).build();

        EvaluationResult result = evaluator(source).evaluate(alert);

        assertThat(result.isBreached()).isFalse();
        assertThat(result.getValue()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Legacy relative increase evaluates the delta of the last two points")
    void legacyRelativeIncrease() {
        FakeSeriesSource source = FakeSeriesSource.of(100, 130);
        AlertConfiguration alert = TestAlerts.upperThreshold("t1", 20)
                .condition(AlertCondition.RELATIVE_INCREASE)
                .build();

        EvaluationResult result = evaluator(source).evaluate(alert);

        assertThat(result.getValue()).isEqualTo(30.0);
        assertThat(result.getRawValue()).isEqualTo(130.0);
        assertThat(result.getBreaches()).containsExactly("The increase (30.00) is above the upper threshold (20.00)");
        assertThat(source.getRequests().get(0).getNumPoints()).isEqualTo(2);
    }

    @Test
    @DisplayName("A short fetch is accepted while min_points is met")
    void shortFetchAccepted() {
        // window 5, min_points 3: baseline of 3 suffices
        FakeSeriesSource source = FakeSeriesSource.of(10, 11, 9, 10);

        EvaluationResult result = evaluator(source).evaluate(TestAlerts.zscore("z1").build());

        assertThat(result.isErrored()).isFalse();
        assertThat(result.getMetadata()).containsEntry("window", 3);
    }

    @Test
    @DisplayName("Too few points become an INSUFFICIENT_DATA result")
    void insufficientData() {
        FakeSeriesSource source = FakeSeriesSource.of(10, 11);

        EvaluationResult result = evaluator(source).evaluate(TestAlerts.zscore("z1").build());

        assertThat(result.isErrored()).isTrue();
        assertThat(result.isBreached()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.INSUFFICIENT_DATA);
        assertThat(result.getRawValue()).isEqualTo(11.0);
        assertThat(result.getValue()).isNull();
    }

    @Test
    @DisplayName("Source failures become a SOURCE_UNAVAILABLE result")
    void sourceFailure() {
        FakeSeriesSource source = FakeSeriesSource.of();
        source.failWith(new SourceUnavailableException("query layer down"));

        EvaluationResult result = evaluator(source).evaluate(TestAlerts.zscore("z1").build());

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.SOURCE_UNAVAILABLE);
        assertThat(result.getErrorMessage()).isEqualTo("query layer down");
    }

    @Test
    @DisplayName("Unexpected source exceptions are classified as SOURCE_UNAVAILABLE")
    void unexpectedSourceException() {
        FakeSeriesSource source = FakeSeriesSource.of();
        source.failWith(new IllegalStateException("boom"));

        EvaluationResult result = evaluator(source).evaluate(TestAlerts.zscore("z1").build());

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.SOURCE_UNAVAILABLE);
        assertThat(result.getErrorMessage()).contains("boom");
    }

    @Test
    @DisplayName("A slow fetch times out as SOURCE_UNAVAILABLE instead of hanging")
    void fetchTimeout() {
        CountDownLatch never = new CountDownLatch(1);
        FakeSeriesSource source = new FakeSeriesSource.Blocking(never, 10, 10, 10, 10, 10, 40);
        Evaluator evaluator = new Evaluator(source, fetchPool, Duration.ofMillis(100));

        EvaluationResult result = evaluator.evaluate(TestAlerts.zscore("z1").build());

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.SOURCE_UNAVAILABLE);
        assertThat(result.getErrorMessage()).contains("timed out after 100 ms");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Evaluator evaluator(FakeSeriesSource source) {
        return new Evaluator(source, fetchPool, Duration.ofSeconds(5));
    }
}
