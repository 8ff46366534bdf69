package com.alertsentinel.core.notify;

import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.NotificationTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves an alert's recipients and hands the notification to the
 * {@link Notifier}.
 *
 * <p>
 * Delivery failures are logged and reported through the return value; they
 * never propagate to the caller, so a failing channel cannot undo a state
 * transition.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier notifier;

    public NotificationDispatcher(Notifier notifier) {
        this.notifier = Objects.requireNonNull(notifier, "Notifier must not be null");
    }

    /**
     * Subscribed users followed by destinations, in configuration order.
     */
    public static Set<NotificationTarget> resolveTargets(AlertConfiguration alert) {
        Set<NotificationTarget> targets = new LinkedHashSet<>();
        alert.getSubscribedUsers().forEach(user -> targets.add(NotificationTarget.user(user)));
        alert.getDestinations().forEach(destination -> targets.add(NotificationTarget.destination(destination)));
        return Collections.unmodifiableSet(targets);
    }

    /**
     * Notify every target of {@code alert} about {@code check}.
     *
     * @return {@code true} if the notifier accepted the notification or
     *         there was nobody to notify
     */
    public boolean dispatch(AlertConfiguration alert, AlertCheck check) {
        Set<NotificationTarget> targets = resolveTargets(alert);
        if (targets.isEmpty()) {
            LOG.debug("Alert '{}' has no targets, skipping notification", alert.getId());
            return true;
        }
        try {
            notifier.notify(targets, alert, check);
            LOG.info("Notified {} target(s) of alert '{}' ({})", targets.size(), alert.getId(), check.getState());
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Failed to notify targets of alert '{}': {}", alert.getId(), e.getMessage(), e);
            return false;
        }
    }
}
