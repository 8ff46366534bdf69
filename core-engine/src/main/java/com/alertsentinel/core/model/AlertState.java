package com.alertsentinel.core.model;

/**
 * Runtime state of an alert. Only the state machine changes it.
 */
public enum AlertState {
    NOT_FIRING,
    FIRING,
    SNOOZED,
    ERRORED
}
