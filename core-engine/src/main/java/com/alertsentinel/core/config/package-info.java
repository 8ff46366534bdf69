/**
 * Alert configuration loading.
 *
 * <p>
 * {@link com.alertsentinel.core.config.AlertsLoader} reads YAML with
 * SnakeYAML; detector configurations are accepted through
 * {@link com.alertsentinel.core.config.DetectorConfigParser}, which applies
 * the detector feature flag.
 * </p>
 */
package com.alertsentinel.core.config;
