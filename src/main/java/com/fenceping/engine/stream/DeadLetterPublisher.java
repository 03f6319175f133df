package com.fenceping.engine.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.dto.DeadLetterRecord;
import com.fenceping.engine.service.EngineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes records the engine gave up on to the dead-letter topic.
 *
 * The send is synchronous: the caller only acknowledges the source record once the
 * dead-letter copy is on the broker.
 */
@Component
@Slf4j
public class DeadLetterPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final String deadLetterTopic;
    private final Duration sendTimeout;

    public DeadLetterPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                               EngineMetrics metrics, Clock clock, EngineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.deadLetterTopic = properties.getTopics().getDeadLetter();
        this.sendTimeout = properties.getOutbox().getSendTimeout();
    }

    /**
     * @return true once the dead-letter record is acknowledged by the broker
     */
    public boolean deadLetter(ConsumerRecord<String, String> record, String error, int attempts) {
        DeadLetterRecord envelope = new DeadLetterRecord(
            DeadLetterRecord.VERSION,
            record.topic(),
            record.partition(),
            record.offset(),
            record.key(),
            error,
            attempts,
            record.value(),
            clock.instant()
        );

        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("DeadLetterRecord is not serializable", e);
        }

        String key = record.key() != null ? record.key() : "dlq-" + envelope.timestamp().toEpochMilli();
        try {
            kafkaTemplate.send(deadLetterTopic, key, payload).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("Failed to dead-letter {}-{}@{}: {}", record.topic(), record.partition(),
                record.offset(), error, e);
            return false;
        }

        metrics.sampleDeadLettered();
        log.warn("Dead-lettered {}-{}@{} after {} attempt(s): {}", record.topic(), record.partition(),
            record.offset(), attempts, error);
        return true;
    }
}
