package com.alertsentinel.runner;

import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.NotificationTarget;
import com.alertsentinel.core.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Notifier that only writes notifications to the log. Used when no Kafka
 * cluster is configured.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotifier.class);

    private final NotificationSerializer serializer = new NotificationSerializer();

    @Override
    public void notify(Set<NotificationTarget> targets, AlertConfiguration alert, AlertCheck check) {
        LOG.info("NOTIFICATION {}", serializer.serialize(AlertNotification.of(targets, alert, check)));
    }
}
