package com.alertsentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Recipient of an alert notification: either a subscribed user or a
 * configured destination (email list, chat channel, webhook).
 *
 * @since 1.0.0
 */
public final class NotificationTarget {

    public enum Kind {
        USER,
        DESTINATION
    }

    private final Kind kind;
    private final String id;

    private NotificationTarget(Kind kind, String id) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    public static NotificationTarget user(String userId) {
        return new NotificationTarget(Kind.USER, userId);
    }

    public static NotificationTarget destination(String destinationId) {
        return new NotificationTarget(Kind.DESTINATION, destinationId);
    }

    public Kind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NotificationTarget that))
            return false;
        return kind == that.kind && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + id;
    }
}
