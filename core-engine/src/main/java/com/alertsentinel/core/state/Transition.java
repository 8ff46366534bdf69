package com.alertsentinel.core.state;

import com.alertsentinel.core.model.AlertState;

import java.util.Objects;

/**
 * One state change decided by the {@link AlertStateMachine}.
 *
 * @since 1.0.0
 */
public final class Transition {

    private final AlertState from;
    private final AlertState to;
    private final boolean notify;

    public Transition(AlertState from, AlertState to, boolean notify) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.to = Objects.requireNonNull(to, "to must not be null");
        this.notify = notify;
    }

    public AlertState getFrom() {
        return from;
    }

    public AlertState getTo() {
        return to;
    }

    /**
     * @return {@code true} if this edge must be dispatched to the alert's targets
     */
    public boolean isNotify() {
        return notify;
    }

    public boolean isChange() {
        return from != to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Transition that))
            return false;
        return from == that.from && to == that.to && notify == that.notify;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, notify);
    }

    @Override
    public String toString() {
        return from + " -> " + to + (notify ? " (notify)" : "");
    }
}
