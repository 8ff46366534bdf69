/**
 * Standalone runner: environment configuration, HTTP series source, Kafka
 * and log notifiers, Prometheus metrics and the health server.
 *
 * @since 1.0.0
 */
package com.alertsentinel.runner;
