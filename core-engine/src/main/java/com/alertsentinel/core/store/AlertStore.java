package com.alertsentinel.core.store;

import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for alert configurations and their check history.
 *
 * <p>
 * Configurations are last-writer-wins per alert id. Checks are append-only.
 * Implementations must be thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertStore {

    void save(AlertConfiguration alert);

    Optional<AlertConfiguration> find(String alertId);

    List<AlertConfiguration> findAll();

    void appendCheck(AlertCheck check);

    /**
     * @param alertId alert whose history to read
     * @param limit   maximum number of checks to return
     * @return up to {@code limit} checks, newest first
     */
    List<AlertCheck> recentChecks(String alertId, int limit);
}
