/**
 * Pluggable detection engine.
 *
 * <p>
 * Detector configurations form a closed union rooted at
 * {@link com.alertsentinel.core.detection.DetectorConfig}; each variant is
 * scored by the matching {@link com.alertsentinel.core.detection.Detector}
 * looked up in {@link com.alertsentinel.core.detection.DetectorRegistry}.
 * Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.alertsentinel.core.detection.ThresholdDetector}: static
 * bounds, also used for legacy threshold alerts</li>
 * <li>{@link com.alertsentinel.core.detection.ZScoreDetector}: mean ± N × σ
 * over a trailing window</li>
 * <li>{@link com.alertsentinel.core.detection.MadDetector}: median ± k × MAD
 * over a trailing window</li>
 * </ul>
 *
 * <p>
 * Series are transformed by
 * {@link com.alertsentinel.core.detection.SeriesPreprocessor} before
 * scoring.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.detection;
