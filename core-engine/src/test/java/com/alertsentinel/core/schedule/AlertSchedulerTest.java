package com.alertsentinel.core.schedule;

import com.alertsentinel.core.evaluation.Evaluator;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.CalculationInterval;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.state.AlertStateMachine;
import com.alertsentinel.core.store.InMemoryAlertStore;
import com.alertsentinel.core.support.FakeSeriesSource;
import com.alertsentinel.core.support.MutableClock;
import com.alertsentinel.core.support.RecordingListener;
import com.alertsentinel.core.support.RecordingNotifier;
import com.alertsentinel.core.support.TestAlerts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertScheduler}.
 */
class AlertSchedulerTest {

    private final ExecutorService fetchPool = Executors.newCachedThreadPool();
    private final ExecutorService workerPool = Executors.newFixedThreadPool(2);
    private final AtomicReference<Runnable> afterSnapshot = new AtomicReference<>();
    private final InMemoryAlertStore store = new InMemoryAlertStore() {
        @Override
        public List<AlertConfiguration> findAll() {
            List<AlertConfiguration> snapshot = super.findAll();
            Runnable hook = afterSnapshot.getAndSet(null);
            if (hook != null) {
                hook.run();
            }
            return snapshot;
        }
    };
    private final AlertLeases leases = new AlertLeases();
    private final RecordingListener listener = new RecordingListener();

    @AfterEach
    void tearDown() {
        fetchPool.shutdownNow();
        workerPool.shutdownNow();
    }

    @Test
    @DisplayName("Daily skip-weekend alert runs Friday and Monday but not over the weekend")
    void skipsWeekend() {
        MutableClock clock = MutableClock.at("2024-05-03T09:00:00Z");
        store.save(TestAlerts.upperThreshold("a1", 10)
                .calculationInterval(CalculationInterval.DAILY)
                .skipWeekend(true)
                .build());
        AlertScheduler scheduler = scheduler(FakeSeriesSource.of(5), clock, Runnable::run);

        assertThat(scheduler.tick()).isEqualTo(1);
        clock.set(Instant.parse("2024-05-04T09:00:00Z"));
        assertThat(scheduler.tick()).isZero();
        clock.set(Instant.parse("2024-05-05T09:00:00Z"));
        assertThat(scheduler.tick()).isZero();
        clock.set(Instant.parse("2024-05-06T09:00:00Z"));
        assertThat(scheduler.tick()).isEqualTo(1);
        assertThat(scheduler.tick()).isZero();

        assertThat(store.recentChecks("a1", 10)).hasSize(2);
    }

    @Test
    @DisplayName("Snoozed alert is not checked until the snooze expires, then once")
    void snoozeDefersChecks() {
        MutableClock clock = MutableClock.at("2024-05-06T09:00:00Z");
        store.save(TestAlerts.upperThreshold("a1", 10)
                .state(AlertState.SNOOZED)
                .snoozedUntil(Instant.parse("2024-05-06T10:00:00Z"))
                .build());
        AlertScheduler scheduler = scheduler(FakeSeriesSource.of(50), clock, Runnable::run);

        for (int i = 0; i < 6; i++) {
            assertThat(scheduler.tick()).isZero();
            clock.advance(Duration.ofMinutes(10));
        }
        assertThat(store.recentChecks("a1", 10)).isEmpty();

        assertThat(scheduler.tick()).isEqualTo(1);
        assertThat(scheduler.tick()).isZero();

        AlertConfiguration stored = store.find("a1").orElseThrow();
        assertThat(stored.getState()).isEqualTo(AlertState.FIRING);
        assertThat(stored.getSnoozedUntil()).isNull();
        assertThat(store.recentChecks("a1", 10)).hasSize(1);
    }

    @Test
    @DisplayName("A due trigger for a still-running alert is dropped, not queued")
    void dropsOverlappingTrigger() throws Exception {
        MutableClock clock = MutableClock.at("2024-05-06T09:00:00Z");
        store.save(TestAlerts.upperThreshold("a1", 10).build());
        CountDownLatch gate = new CountDownLatch(1);
        AlertScheduler scheduler = scheduler(new FakeSeriesSource.Blocking(gate, 5), clock, workerPool);

        assertThat(scheduler.tick()).isEqualTo(1);
        assertThat(leases.isHeld("a1")).isTrue();
        assertThat(scheduler.tick()).isZero();

        gate.countDown();
        awaitTrue(() -> listener.getOutcomes().size() == 1);
        awaitTrue(() -> !leases.isHeld("a1"));

        assertThat(listener.getDropped()).containsExactly("a1");
        assertThat(store.recentChecks("a1", 10)).hasSize(1);
    }

    @Test
    @DisplayName("A cycle finishing between the due snapshot and the lease is not run again")
    void rechecksDuenessUnderLease() {
        MutableClock clock = MutableClock.at("2024-05-06T09:00:00Z");
        store.save(TestAlerts.upperThreshold("a1", 10).build());
        AlertCycleRunner runner = runner(FakeSeriesSource.of(5), clock);
        AlertScheduler scheduler = new AlertScheduler(store, runner, leases,
                new DuePolicy(ZoneOffset.UTC), Runnable::run, listener, clock);

        // a cycle is in flight and completes right after the tick reads the store
        assertThat(leases.tryAcquire("a1")).isTrue();
        afterSnapshot.set(() -> {
            runner.run("a1", CycleTrigger.SCHEDULED);
            leases.release("a1");
        });

        assertThat(scheduler.tick()).isZero();

        assertThat(store.recentChecks("a1", 10)).hasSize(1);
        assertThat(leases.isHeld("a1")).isFalse();
        assertThat(listener.getDropped()).isEmpty();
    }

    @Test
    @DisplayName("Started scheduler ticks on its own and cannot be started twice")
    void startAndClose() throws Exception {
        MutableClock clock = MutableClock.at("2024-05-06T09:00:00Z");
        store.save(TestAlerts.upperThreshold("a1", 10).build());

        try (AlertScheduler scheduler = scheduler(FakeSeriesSource.of(5), clock, workerPool)) {
            scheduler.start(Duration.ofMillis(20));
            assertThatThrownBy(() -> scheduler.start(Duration.ofMillis(20)))
                    .isInstanceOf(IllegalStateException.class);
            awaitTrue(() -> !store.recentChecks("a1", 1).isEmpty());
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private AlertScheduler scheduler(FakeSeriesSource source, MutableClock clock, Executor workers) {
        return new AlertScheduler(store, runner(source, clock), leases, new DuePolicy(ZoneOffset.UTC),
                workers, listener, clock);
    }

    private AlertCycleRunner runner(FakeSeriesSource source, MutableClock clock) {
        return new AlertCycleRunner(store,
                new Evaluator(source, fetchPool, Duration.ofSeconds(5)),
                new AlertStateMachine(),
                new NotificationDispatcher(new RecordingNotifier()),
                listener,
                clock);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }
}
