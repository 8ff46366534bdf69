package com.alertsentinel.core.schedule;

/**
 * What started an evaluation cycle.
 */
public enum CycleTrigger {
    SCHEDULED,
    MANUAL
}
