package com.alertsentinel.core.store;

import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link AlertStore} kept in memory. Used by the runner and by tests.
 *
 * @since 1.0.0
 */
public class InMemoryAlertStore implements AlertStore {

    private final ConcurrentMap<String, AlertConfiguration> alerts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<AlertCheck>> checks = new ConcurrentHashMap<>();

    @Override
    public void save(AlertConfiguration alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        alerts.put(alert.getId(), alert);
    }

    @Override
    public Optional<AlertConfiguration> find(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    @Override
    public List<AlertConfiguration> findAll() {
        List<AlertConfiguration> all = new ArrayList<>(alerts.values());
        all.sort(Comparator.comparing(AlertConfiguration::getId));
        return all;
    }

    @Override
    public void appendCheck(AlertCheck check) {
        Objects.requireNonNull(check, "check must not be null");
        List<AlertCheck> history = checks.computeIfAbsent(check.getAlertId(), id -> new ArrayList<>());
        synchronized (history) {
            history.add(check);
        }
    }

    @Override
    public List<AlertCheck> recentChecks(String alertId, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        List<AlertCheck> history = checks.get(alertId);
        if (history == null) {
            return List.of();
        }
        List<AlertCheck> recent = new ArrayList<>(limit);
        synchronized (history) {
            for (int i = history.size() - 1; i >= 0 && recent.size() < limit; i--) {
                recent.add(history.get(i));
            }
        }
        return recent;
    }
}
