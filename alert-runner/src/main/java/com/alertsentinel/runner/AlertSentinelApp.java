package com.alertsentinel.runner;

import com.alertsentinel.core.config.AlertsLoader;
import com.alertsentinel.core.config.DetectorConfigParser;
import com.alertsentinel.core.evaluation.Evaluator;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.notify.Notifier;
import com.alertsentinel.core.schedule.AlertCycleRunner;
import com.alertsentinel.core.schedule.AlertLeases;
import com.alertsentinel.core.schedule.AlertScheduler;
import com.alertsentinel.core.schedule.DuePolicy;
import com.alertsentinel.core.state.AlertStateMachine;
import com.alertsentinel.core.state.NotificationPolicy;
import com.alertsentinel.core.store.AlertStore;
import com.alertsentinel.core.store.InMemoryAlertStore;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point of the alert runner.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   alerts.yml → AlertsLoader → InMemoryAlertStore
 *   AlertScheduler (tick) → worker pool → AlertCycleRunner
 *     → Evaluator (HttpSeriesSource, fetch pool)
 *     → AlertStateMachine
 *     → NotificationDispatcher → KafkaNotifier | LoggingNotifier
 *   HealthServer: /health, /readiness, /metrics
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All settings are resolved from environment variables via
 * {@link RunnerConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(AlertSentinelApp.class);

    private AlertSentinelApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        RunnerConfig config = RunnerConfig.fromEnvironment();
        LOG.info("Starting Alert Sentinel with config: {}", config);

        // 2. Load alerts into the store
        DetectorConfigParser parser = new DetectorConfigParser(config.isDetectorsEnabled());
        List<AlertConfiguration> alerts = loadAlerts(config, parser);
        AlertStore store = new InMemoryAlertStore();
        alerts.forEach(store::save);
        LOG.info("Seeded store with {} alert(s)", alerts.size());

        // 3. Metrics and health
        SentinelMetrics metrics = new SentinelMetrics(CollectorRegistry.defaultRegistry);
        AtomicBoolean ready = new AtomicBoolean(false);
        HealthServer healthServer = new HealthServer(metrics.getRegistry(), ready::get);
        healthServer.start(config.getHealthPort());

        // 4. Engine
        ExecutorService fetchPool = Executors.newCachedThreadPool(daemonThreads("series-fetch"));
        ExecutorService workers = Executors.newFixedThreadPool(config.getWorkerThreads(), daemonThreads("alert-worker"));
        Notifier notifier = config.isKafkaEnabled() ? KafkaNotifier.create(config) : new LoggingNotifier();
        Clock clock = Clock.systemUTC();

        Evaluator evaluator = new Evaluator(
                new HttpSeriesSource(config.getSeriesSourceUrl(), config.getFetchTimeout()),
                fetchPool,
                config.getFetchTimeout());
        AlertCycleRunner runner = new AlertCycleRunner(
                store,
                evaluator,
                new AlertStateMachine(new NotificationPolicy(config.isNotifyOnRecovery())),
                new NotificationDispatcher(notifier),
                metrics,
                clock);
        AlertScheduler scheduler = new AlertScheduler(
                store, runner, new AlertLeases(), new DuePolicy(config.getSchedulerZone()), workers, metrics, clock);

        // 5. Shutdown hook
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ready.set(false);
            scheduler.close();
            shutdown(workers, "worker pool");
            shutdown(fetchPool, "fetch pool");
            if (notifier instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    LOG.warn("Failed to close notifier: {}", e.getMessage(), e);
                }
            }
            healthServer.stop();
            stopped.countDown();
        }, "alert-sentinel-shutdown"));

        // 6. Run
        scheduler.start(config.getTickInterval());
        ready.set(true);
        LOG.info("Alert Sentinel running, notifications via {}",
                config.isKafkaEnabled() ? "Kafka topic " + config.getKafkaNotificationTopic() : "log");
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<AlertConfiguration> loadAlerts(RunnerConfig config, DetectorConfigParser parser) {
        String path = config.getAlertsConfigPath();
        if (path != null && !path.isBlank()) {
            return AlertsLoader.fromFile(path, parser);
        }
        return AlertsLoader.load(parser);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("{} did not terminate in time, interrupting", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
