package com.fenceping.engine.stream;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.exception.MalformedSampleException;
import com.fenceping.engine.model.GeofenceEvent;
import com.fenceping.engine.model.LocationSample;
import com.fenceping.engine.service.EngineMetrics;
import com.fenceping.engine.service.LocationSampleProcessor;
import com.fenceping.engine.service.Outcome;
import com.fenceping.engine.service.RetryBackoff;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.event.ConsumerStartedEvent;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Partition worker for the location stream.
 *
 * The input topic is keyed by deviceId, so every sample of a device lands on the same
 * partition and is handled by one listener thread in offset order. That is the only
 * per-device ordering mechanism; there are no per-device locks.
 *
 * Commit policy (manual acknowledgment, one record at a time):
 * - OK: acknowledge
 * - RETRYABLE: nack with exponential backoff, the same record is redelivered;
 *   once the retry budget is spent the record is dead-lettered and acknowledged
 * - FATAL / malformed: dead-letter and acknowledge
 * A record is never acknowledged while its dead-letter copy is not on the broker.
 */
@Component
@Slf4j
public class LocationStreamConsumer {

    private final LocationSampleParser parser;
    private final LocationSampleProcessor processor;
    private final DeadLetterPublisher deadLetterPublisher;
    private final EngineMetrics metrics;
    private final RetryBackoff retryBackoff;

    // Attempt counts of records currently being redelivered, keyed by topic-partition@offset
    private final Cache<String, Integer> attempts = Caffeine.newBuilder()
        .expireAfterWrite(Duration.ofHours(1))
        .maximumSize(100_000)
        .build();

    public LocationStreamConsumer(LocationSampleParser parser,
                                  LocationSampleProcessor processor,
                                  DeadLetterPublisher deadLetterPublisher,
                                  EngineMetrics metrics,
                                  EngineProperties properties) {
        this.parser = parser;
        this.processor = processor;
        this.deadLetterPublisher = deadLetterPublisher;
        this.metrics = metrics;
        this.retryBackoff = RetryBackoff.from(properties.getConsumer().getRetry());
    }

    @KafkaListener(
        id = "location-stream",
        topics = "${fenceping.engine.topics.locations:raw_events}",
        groupId = "${fenceping.engine.consumer.group-id:geofence-processor}",
        concurrency = "${fenceping.engine.consumer.concurrency:4}",
        containerFactory = "locationListenerContainerFactory"
    )
    public void onLocation(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String position = position(record);

        LocationSample sample;
        try {
            sample = parser.parse(record.value());
        } catch (MalformedSampleException e) {
            metrics.sampleMalformed();
            log.warn("Malformed location record {}: {}", position, e.getMessage());
            deadLetterAndAck(record, e.getMessage(), 1, ack);
            return;
        }

        Outcome<List<GeofenceEvent>> outcome = processor.process(sample);
        switch (outcome.status()) {
            case OK -> {
                attempts.invalidate(position);
                ack.acknowledge();
                if (!outcome.value().isEmpty()) {
                    log.debug("Record {} produced {} event(s)", position, outcome.value().size());
                }
            }
            case RETRYABLE -> retry(record, outcome, ack);
            case FATAL -> deadLetterAndAck(record, outcome.reason(), currentAttempt(position) + 1, ack);
        }
    }

    private void retry(ConsumerRecord<String, String> record, Outcome<?> outcome, Acknowledgment ack) {
        String position = position(record);
        int attempt = attempts.asMap().merge(position, 1, Integer::sum);

        if (retryBackoff.exhausted(attempt)) {
            log.error("Retry budget exhausted for {} after {} attempts: {}", position, attempt, outcome.reason());
            deadLetterAndAck(record, outcome.reason(), attempt, ack);
            return;
        }

        Duration delay = retryBackoff.delayFor(attempt);
        metrics.sampleRetried();
        log.warn("Retryable failure for {} (attempt {}), redelivering in {}ms: {}",
            position, attempt, delay.toMillis(), outcome.reason());
        ack.nack(delay);
    }

    private void deadLetterAndAck(ConsumerRecord<String, String> record, String reason, int attempt,
                                  Acknowledgment ack) {
        String position = position(record);
        if (deadLetterPublisher.deadLetter(record, reason, attempt)) {
            attempts.invalidate(position);
            ack.acknowledge();
            return;
        }
        // Dead-letter topic unreachable: keep the record and try again later
        ack.nack(retryBackoff.maxDelay());
    }

    @EventListener
    public void onConsumerStarted(ConsumerStartedEvent event) {
        log.info("Location consumer started: {}", event.getSource());
    }

    @EventListener
    public void onConsumerStopped(ConsumerStoppedEvent event) {
        log.info("Location consumer stopped: {} ({})", event.getSource(), event.getReason());
    }

    private int currentAttempt(String position) {
        Integer current = attempts.getIfPresent(position);
        return current == null ? 0 : current;
    }

    private static String position(ConsumerRecord<?, ?> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
