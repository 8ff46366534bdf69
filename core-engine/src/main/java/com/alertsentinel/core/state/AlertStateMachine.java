package com.alertsentinel.core.state;

import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-alert state machine over {@link AlertState}.
 *
 * <h3>Transitions for an evaluated cycle</h3>
 * <ul>
 * <li>errored result: {@code ERRORED}, notify on entering it</li>
 * <li>breach: {@code FIRING}, notify on entering it</li>
 * <li>no breach: {@code NOT_FIRING}, notify on {@code FIRING -> NOT_FIRING}
 * only if the {@link NotificationPolicy} asks for recovery notices</li>
 * </ul>
 *
 * <h3>Snoozing</h3>
 * <p>
 * A snoozed alert is skipped until {@code snoozedUntil}. Once the snooze has
 * expired {@link #releaseExpiredSnooze(AlertConfiguration, Instant)} moves
 * it back to {@code NOT_FIRING} so the same cycle can evaluate it.
 * </p>
 *
 * <p>
 * Stateless apart from the policy; safe to share between workers.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertStateMachine.class);

    private final NotificationPolicy policy;

    public AlertStateMachine(NotificationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "NotificationPolicy must not be null");
    }

    public AlertStateMachine() {
        this(NotificationPolicy.defaults());
    }

    /**
     * @return {@code true} if {@code alert} is snoozed and the snooze has not expired at {@code now}
     */
    public boolean isSnoozeActive(AlertConfiguration alert, Instant now) {
        return alert.getState() == AlertState.SNOOZED
                && alert.getSnoozedUntil() != null
                && now.isBefore(alert.getSnoozedUntil());
    }

    /**
     * Clear an expired snooze.
     *
     * @param alert the alert about to be evaluated
     * @param now   cycle time
     * @return {@code alert} unchanged, or a {@code NOT_FIRING} copy without
     *         {@code snoozedUntil} if its snooze has expired
     */
    public AlertConfiguration releaseExpiredSnooze(AlertConfiguration alert, Instant now) {
        if (alert.getState() != AlertState.SNOOZED || isSnoozeActive(alert, now)) {
            return alert;
        }
        LOG.info("Snooze of alert '{}' expired at {}", alert.getId(), alert.getSnoozedUntil());
        return alert.toBuilder()
                .state(AlertState.NOT_FIRING)
                .snoozedUntil(null)
                .build();
    }

    /**
     * Decide the next state after an evaluation.
     *
     * @param from   state before the cycle
     * @param result evaluation result of the cycle
     * @return the transition, with its notify flag
     */
    public Transition advance(AlertState from, EvaluationResult result) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(result, "result must not be null");

        AlertState to;
        if (result.isErrored()) {
            to = AlertState.ERRORED;
        } else if (result.isBreached()) {
            to = AlertState.FIRING;
        } else {
            to = AlertState.NOT_FIRING;
        }

        boolean notify = switch (to) {
            case ERRORED, FIRING -> from != to;
            case NOT_FIRING -> from == AlertState.FIRING && policy.isNotifyOnRecovery();
            case SNOOZED -> false;
        };
        return new Transition(from, to, notify);
    }

    /**
     * Snooze an alert until {@code until}.
     *
     * @return a {@code SNOOZED} copy of {@code alert}
     * @throws IllegalArgumentException if {@code until} is not after {@code now}
     */
    public AlertConfiguration snooze(AlertConfiguration alert, Instant until, Instant now) {
        Objects.requireNonNull(until, "until must not be null");
        if (!until.isAfter(now)) {
            throw new IllegalArgumentException("Snooze end " + until + " must be after " + now);
        }
        return alert.toBuilder()
                .state(AlertState.SNOOZED)
                .snoozedUntil(until)
                .build();
    }

    /**
     * Lift a snooze.
     *
     * @return a {@code NOT_FIRING} copy of {@code alert} due at the next tick,
     *         or {@code alert} unchanged if it is not snoozed
     */
    public AlertConfiguration clearSnooze(AlertConfiguration alert) {
        if (alert.getState() != AlertState.SNOOZED) {
            return alert;
        }
        return alert.toBuilder()
                .state(AlertState.NOT_FIRING)
                .snoozedUntil(null)
                .lastCheckedAt(null)
                .build();
    }
}
