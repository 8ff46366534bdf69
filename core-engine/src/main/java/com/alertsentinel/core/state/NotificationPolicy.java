package com.alertsentinel.core.state;

/**
 * Which state edges trigger a notification beyond the always-on edges into
 * {@code FIRING} and {@code ERRORED}.
 *
 * @since 1.0.0
 */
public final class NotificationPolicy {

    private static final NotificationPolicy DEFAULTS = new NotificationPolicy(false);

    private final boolean notifyOnRecovery;

    public NotificationPolicy(boolean notifyOnRecovery) {
        this.notifyOnRecovery = notifyOnRecovery;
    }

    /**
     * @return policy with recovery notifications turned off
     */
    public static NotificationPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * @return {@code true} if {@code FIRING -> NOT_FIRING} notifies
     */
    public boolean isNotifyOnRecovery() {
        return notifyOnRecovery;
    }

    @Override
    public String toString() {
        return "NotificationPolicy{notifyOnRecovery=" + notifyOnRecovery + '}';
    }
}
