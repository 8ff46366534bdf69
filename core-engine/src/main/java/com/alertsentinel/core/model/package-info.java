/**
 * Domain model: alert configurations, checks, evaluation results and series
 * points.
 *
 * <p>
 * All model types are immutable. Configuration changes go through
 * {@link com.alertsentinel.core.model.AlertConfiguration#toBuilder()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.model;
