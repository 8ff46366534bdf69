package com.alertsentinel.core.schedule;

import com.alertsentinel.core.evaluation.Evaluator;
import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.EvaluationResult;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.state.AlertStateMachine;
import com.alertsentinel.core.state.Transition;
import com.alertsentinel.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one evaluation cycle of one alert: evaluate, transition, persist,
 * notify.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>The caller holds the alert's lease for the whole call.</li>
 * <li>An evaluated cycle appends exactly one {@link AlertCheck}.</li>
 * <li>{@link #run(String, CycleTrigger)} never throws; a failing cycle
 * still advances {@code lastCheckedAt}.</li>
 * <li>State and {@code lastCheckedAt} are written onto the latest stored
 * configuration, so an alert disabled during the cycle stays disabled.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AlertCycleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(AlertCycleRunner.class);

    /** Consecutive errored checks after which an alert is reported as degraded. */
    public static final int DEGRADED_THRESHOLD = 3;

    private final AlertStore store;
    private final Evaluator evaluator;
    private final AlertStateMachine stateMachine;
    private final NotificationDispatcher dispatcher;
    private final CycleListener listener;
    private final Clock clock;

    public AlertCycleRunner(AlertStore store, Evaluator evaluator, AlertStateMachine stateMachine,
            NotificationDispatcher dispatcher, CycleListener listener, Clock clock) {
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "AlertStateMachine must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "NotificationDispatcher must not be null");
        this.listener = listener != null ? listener : CycleListener.NO_OP;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Run one cycle.
     *
     * @param alertId alert to evaluate; its lease must be held by the caller
     * @param trigger what started the cycle
     * @return how the cycle ended
     */
    public CycleOutcome run(String alertId, CycleTrigger trigger) {
        long start = System.nanoTime();
        Instant now = clock.instant();
        CycleOutcome outcome;
        try {
            outcome = runCycle(alertId, trigger, now);
        } catch (RuntimeException e) {
            LOG.error("Cycle of alert '{}' failed", alertId, e);
            advanceLastChecked(alertId, now);
            outcome = CycleOutcome.failed(alertId, trigger);
        }
        listener.onCycleCompleted(outcome, System.nanoTime() - start);
        return outcome;
    }

    private CycleOutcome runCycle(String alertId, CycleTrigger trigger, Instant now) {
        Optional<AlertConfiguration> found = store.find(alertId);
        if (found.isEmpty()) {
            LOG.warn("Alert '{}' no longer exists, skipping", alertId);
            return CycleOutcome.skipped(alertId, trigger);
        }
        AlertConfiguration alert = found.get();
        if (!alert.isEnabled()) {
            LOG.debug("Alert '{}' is disabled, skipping", alertId);
            return CycleOutcome.skipped(alertId, trigger);
        }
        if (stateMachine.isSnoozeActive(alert, now)) {
            LOG.debug("Alert '{}' is snoozed until {}, skipping", alertId, alert.getSnoozedUntil());
            return CycleOutcome.skipped(alertId, trigger);
        }
        alert = stateMachine.releaseExpiredSnooze(alert, now);

        EvaluationResult result = evaluator.evaluate(alert);
        Transition transition = stateMachine.advance(alert.getState(), result);
        AlertCheck check = AlertCheck.of(alertId, now, transition.getTo(), result, transition.isNotify());
        store.appendCheck(check);

        AlertConfiguration latest = store.find(alertId).orElse(alert);
        AlertConfiguration updated = latest.toBuilder()
                .state(transition.getTo())
                .snoozedUntil(alert.getSnoozedUntil())
                .lastCheckedAt(now)
                .build();
        store.save(updated);

        if (transition.isChange()) {
            LOG.info("Alert '{}' {} [{}]", alertId, transition, trigger);
        } else {
            LOG.debug("Alert '{}' stays {} value={} [{}]", alertId, transition.getTo(), result.getValue(), trigger);
        }

        boolean notificationFailed = false;
        if (transition.isNotify()) {
            notificationFailed = !dispatcher.dispatch(updated, check);
        }
        if (transition.getTo() == AlertState.ERRORED) {
            checkDegraded(alertId);
        }
        return CycleOutcome.evaluated(alertId, trigger, transition, check, notificationFailed);
    }

    private void checkDegraded(String alertId) {
        List<AlertCheck> recent = store.recentChecks(alertId, DEGRADED_THRESHOLD + 1);
        if (recent.size() < DEGRADED_THRESHOLD) {
            return;
        }
        boolean degraded = recent.subList(0, DEGRADED_THRESHOLD).stream()
                .allMatch(check -> check.getState() == AlertState.ERRORED);
        // report the edge only, not every further errored check
        boolean alreadyDegraded = recent.size() > DEGRADED_THRESHOLD
                && recent.get(DEGRADED_THRESHOLD).getState() == AlertState.ERRORED;
        if (degraded && !alreadyDegraded) {
            LOG.warn("Alert '{}' is degraded: last {} checks errored, latest: {}",
                    alertId, DEGRADED_THRESHOLD, recent.get(0).getErrorMessage());
            listener.onDegraded(alertId);
        }
    }

    private void advanceLastChecked(String alertId, Instant now) {
        try {
            store.find(alertId).ifPresent(alert -> store.save(alert.toBuilder().lastCheckedAt(now).build()));
        } catch (RuntimeException e) {
            LOG.error("Could not advance lastCheckedAt of alert '{}'", alertId, e);
        }
    }
}
