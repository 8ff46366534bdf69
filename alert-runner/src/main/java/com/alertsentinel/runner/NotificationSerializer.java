package com.alertsentinel.runner;

import com.alertsentinel.core.error.NotifyFailedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Converts {@link AlertNotification} to JSON, with ISO-8601 timestamps.
 */
public class NotificationSerializer {

    private final ObjectMapper mapper;

    public NotificationSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @throws NotifyFailedException if the notification cannot be serialized
     */
    public String serialize(AlertNotification notification) {
        try {
            return mapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new NotifyFailedException(
                    "Failed to serialize notification for alert '" + notification.getAlertId() + "'", e);
        }
    }
}
