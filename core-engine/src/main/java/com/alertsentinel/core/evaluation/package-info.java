/**
 * Alert evaluation: fetches a series through the
 * {@link com.alertsentinel.core.evaluation.SeriesSource} port and scores it.
 */
package com.alertsentinel.core.evaluation;
