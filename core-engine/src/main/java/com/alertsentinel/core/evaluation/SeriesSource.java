package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.error.SourceUnavailableException;
import com.alertsentinel.core.model.SeriesPoint;

import java.util.List;

/**
 * Port to the query layer that computes insight series.
 *
 * <p>
 * Implementations return points in ascending timestamp order. They may
 * return fewer points than requested, never more than they have.
 * </p>
 *
 * @since 1.0.0
 */
public interface SeriesSource {

    /**
     * Fetch the most recent points of a series.
     *
     * @param request what to fetch
     * @return points, oldest first
     * @throws SourceUnavailableException if the series cannot be computed
     */
    List<SeriesPoint> fetch(SeriesRequest request);
}
