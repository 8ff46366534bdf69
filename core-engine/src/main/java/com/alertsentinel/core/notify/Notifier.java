package com.alertsentinel.core.notify;

import com.alertsentinel.core.error.NotifyFailedException;
import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.NotificationTarget;

import java.util.Set;

/**
 * Delivery channel for alert notifications.
 *
 * @since 1.0.0
 */
public interface Notifier {

    /**
     * Deliver one notification to all {@code targets}.
     *
     * @param targets non-empty set of recipients
     * @param alert   alert in its post-transition state
     * @param check   the check that triggered the notification
     * @throws NotifyFailedException if delivery fails
     */
    void notify(Set<NotificationTarget> targets, AlertConfiguration alert, AlertCheck check);
}
