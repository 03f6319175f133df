package com.fenceping.engine.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.TopicPartition;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Kafka topics and listener containers.
 *
 * Topics:
 * - locations (input), events (output), dead letter: same partition count so a device
 *   keeps one partition end to end
 * - geofence changes: low volume, single partition
 *
 * The location container acknowledges manually, record by record, so an offset is only
 * committed after the sample's state and event writes.
 */
@Configuration
@EnableKafka
@Slf4j
public class KafkaConfig {

    private final EngineProperties properties;

    public KafkaConfig(EngineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public NewTopic locationsTopic() {
        return topic(properties.getTopics().getLocations(), properties.getTopics().getPartitions());
    }

    @Bean
    public NewTopic eventsTopic() {
        return topic(properties.getTopics().getEvents(), properties.getTopics().getPartitions());
    }

    @Bean
    public NewTopic deadLetterTopic() {
        return topic(properties.getTopics().getDeadLetter(), properties.getTopics().getPartitions());
    }

    @Bean
    public NewTopic geofenceChangesTopic() {
        return topic(properties.getTopics().getGeofenceChanges(), 1);
    }

    private NewTopic topic(String name, int partitions) {
        return TopicBuilder.name(name)
            .partitions(partitions)
            .replicas(properties.getTopics().getReplicationFactor())
            .build();
    }

    /**
     * Last line of defence for exceptions escaping the location listener (processing
     * failures are reported as outcomes and never get here): two quick retries, then
     * the record goes to the dead-letter topic.
     */
    @Bean
    public DefaultErrorHandler locationErrorHandler(KafkaTemplate<String, String> kafkaTemplate) {
        String deadLetterTopic = properties.getTopics().getDeadLetter();
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
            (record, exception) -> {
                log.error("Unhandled failure on {}-{}@{}, dead-lettering", record.topic(),
                    record.partition(), record.offset(), exception);
                return new TopicPartition(deadLetterTopic, -1);
            });
        return new DefaultErrorHandler(recoverer, new FixedBackOff(1_000L, 2L));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<Object, Object> locationListenerContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            DefaultErrorHandler locationErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> factory = new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(factory, consumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        factory.setCommonErrorHandler(locationErrorHandler);
        return factory;
    }
}
