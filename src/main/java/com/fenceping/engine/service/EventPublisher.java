package com.fenceping.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.model.GeofenceEvent;
import com.fenceping.engine.repository.GeofenceEventLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Records geofence events durably and forwards them to the output stream.
 *
 * Flow:
 * 1. INSERT ... ON CONFLICT (event_id) DO NOTHING into geofence_events
 * 2. 0 rows: the transition was already recorded, the publish is a no-op
 * 3. 1 row: send to the events topic keyed by deviceId, mark published on ack
 *
 * The durable row decides whether a transition happened. A failed send leaves the row
 * unpublished and {@link EventOutboxRelay} delivers it later.
 */
@Service
@Slf4j
public class EventPublisher {

    private final GeofenceEventLogRepository eventLogRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Executor callbackExecutor;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final String eventsTopic;

    public EventPublisher(GeofenceEventLogRepository eventLogRepository,
                          KafkaTemplate<String, String> kafkaTemplate,
                          ObjectMapper objectMapper,
                          @Qualifier("eventPublishExecutor") Executor callbackExecutor,
                          EngineProperties properties,
                          EngineMetrics metrics,
                          Clock clock) {
        this.eventLogRepository = eventLogRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.callbackExecutor = callbackExecutor;
        this.metrics = metrics;
        this.clock = clock;
        this.eventsTopic = properties.getTopics().getEvents();
    }

    /**
     * OK once the event is durably recorded (or was already), RETRYABLE when the
     * event log cannot be written.
     */
    public Outcome<Void> publish(GeofenceEvent event) {
        int inserted;
        try {
            inserted = eventLogRepository.insertIfAbsent(
                event.id(),
                event.deviceId(),
                event.geofenceId(),
                event.accountId(),
                event.eventType().value(),
                event.latitude(),
                event.longitude(),
                event.timestamp(),
                event.dwellSeconds(),
                clock.instant()
            );
        } catch (DataAccessException | TransactionException e) {
            metrics.publishFailure();
            log.warn("Event log write failed for {}", event.toLogString(), e);
            return Outcome.retryable("Event log unavailable", e);
        }

        if (inserted == 0) {
            metrics.duplicateEvent();
            log.debug("Duplicate event {} ignored", event.id());
            return Outcome.ok(null);
        }

        metrics.eventEmitted(event.eventType());
        send(event);
        return Outcome.ok(null);
    }

    /**
     * Sends an already recorded event to the output stream and marks it published
     * once the broker acknowledged it.
     */
    public CompletableFuture<Boolean> send(GeofenceEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("GeofenceEvent is not serializable", e);
        }

        CompletableFuture<SendResult<String, String>> future;
        try {
            future = kafkaTemplate.send(eventsTopic, event.deviceId(), payload);
        } catch (RuntimeException e) {
            // Producer errors such as a metadata timeout surface before a future exists
            metrics.publishFailure();
            log.warn("Send of {} rejected, left for the outbox relay: {}", event.toLogString(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }

        return future.handleAsync((result, error) -> {
            if (error != null) {
                metrics.publishFailure();
                log.warn("Send of {} failed, left for the outbox relay: {}",
                    event.toLogString(), error.getMessage());
                return false;
            }
            markPublished(event.id());
            log.debug("Published {} to {}-{}", event.toLogString(), eventsTopic,
                result.getRecordMetadata().partition());
            return true;
        }, callbackExecutor);
    }

    private void markPublished(String eventId) {
        try {
            eventLogRepository.markPublished(eventId);
        } catch (DataAccessException | TransactionException e) {
            // The relay will send it again; consumers dedupe on the event id
            log.warn("Could not mark event {} published", eventId, e);
        }
    }
}
