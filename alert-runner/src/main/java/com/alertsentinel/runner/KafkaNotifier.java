package com.alertsentinel.runner;

import com.alertsentinel.core.error.NotifyFailedException;
import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.NotificationTarget;
import com.alertsentinel.core.notify.Notifier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes notifications as JSON to a Kafka topic, keyed by alert id so
 * that notifications of one alert stay ordered within a partition.
 *
 * <p>
 * Each call waits for the broker acknowledgement; downstream consumers fan
 * the notification out to email, chat and webhook channels.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaNotifier implements Notifier, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaNotifier.class);

    private final Producer<String, String> producer;
    private final String topic;
    private final Duration sendTimeout;
    private final NotificationSerializer serializer = new NotificationSerializer();

    public KafkaNotifier(Producer<String, String> producer, String topic, Duration sendTimeout) {
        this.producer = Objects.requireNonNull(producer, "Producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "send timeout must not be null");
    }

    /**
     * Create a notifier backed by a real {@link KafkaProducer}.
     */
    public static KafkaNotifier create(RunnerConfig config) {
        return new KafkaNotifier(
                new KafkaProducer<>(config.kafkaProducerProperties()),
                config.getKafkaNotificationTopic(),
                config.getFetchTimeout());
    }

    @Override
    public void notify(Set<NotificationTarget> targets, AlertConfiguration alert, AlertCheck check) {
        String payload = serializer.serialize(AlertNotification.of(targets, alert, check));
        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, alert.getId(), payload))
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Published notification for alert '{}' to {}-{}@{}",
                    alert.getId(), metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyFailedException("Interrupted while publishing notification for alert '"
                    + alert.getId() + "'", e);
        } catch (ExecutionException e) {
            throw new NotifyFailedException("Kafka rejected notification for alert '" + alert.getId()
                    + "': " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new NotifyFailedException("Timed out publishing notification for alert '"
                    + alert.getId() + "'", e);
        } catch (RuntimeException e) {
            throw new NotifyFailedException("Failed to publish notification for alert '"
                    + alert.getId() + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(5));
        LOG.info("Kafka notifier closed");
    }
}
