package com.fenceping.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.model.GeofenceEvent;
import com.fenceping.engine.model.GeofenceEventType;
import com.fenceping.engine.repository.GeofenceEventLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.fenceping.engine.Fixtures.ACCOUNT;
import static com.fenceping.engine.Fixtures.T0;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventPublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private GeofenceEventLogRepository eventLogRepository;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private SimpleMeterRegistry registry;
    private EventPublisher publisher;

    private final GeofenceEvent enter = new GeofenceEvent(
        GeofenceEvent.deterministicId("device-1", "gf-1", GeofenceEventType.ENTER, T0),
        "device-1", "gf-1", ACCOUNT, GeofenceEventType.ENTER, 52.52, 13.405, T0, null);

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new EventPublisher(eventLogRepository, kafkaTemplate, objectMapper, Runnable::run,
            new EngineProperties(), new EngineMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CompletableFuture<SendResult<String, String>> acked(String topic, String key, String value) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 3), 42L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(topic, key, value), metadata));
    }

    private void stubInsert(int rows) {
        when(eventLogRepository.insertIfAbsent(anyString(), anyString(), anyString(), anyString(), anyString(),
            anyDouble(), anyDouble(), any(), any(), any())).thenReturn(rows);
    }

    @Test
    void shouldRecordThenPublishKeyedByDevice() throws Exception {
        stubInsert(1);
        when(kafkaTemplate.send(eq("gf_events"), eq("device-1"), anyString()))
            .thenAnswer(inv -> acked("gf_events", "device-1", inv.getArgument(2)));

        Outcome<Void> outcome = publisher.publish(enter);

        assertThat(outcome.isOk()).isTrue();
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("gf_events"), eq("device-1"), payload.capture());
        verify(eventLogRepository).insertIfAbsent(enter.id(), "device-1", "gf-1", ACCOUNT, "enter",
            52.52, 13.405, T0, null, NOW);
        verify(eventLogRepository).markPublished(enter.id());

        JsonNode json = objectMapper.readTree(payload.getValue());
        assertThat(json.get("eventType").asText()).isEqualTo("enter");
        assertThat(json.get("id").asText()).isEqualTo(enter.id());
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.has("dwellSeconds")).isFalse();
        assertThat(registry.get("fenceping.events.emitted").tag("type", "enter").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldCarryDwellSecondsInRowAndPayload() throws Exception {
        Instant dwellTime = T0.plusSeconds(300);
        GeofenceEvent dwell = new GeofenceEvent(
            GeofenceEvent.deterministicId("device-1", "gf-1", GeofenceEventType.DWELL, dwellTime),
            "device-1", "gf-1", ACCOUNT, GeofenceEventType.DWELL, 52.52, 13.405, dwellTime, 300L);
        stubInsert(1);
        when(kafkaTemplate.send(eq("gf_events"), eq("device-1"), anyString()))
            .thenAnswer(inv -> acked("gf_events", "device-1", inv.getArgument(2)));

        publisher.publish(dwell);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("gf_events"), eq("device-1"), payload.capture());
        verify(eventLogRepository).insertIfAbsent(dwell.id(), "device-1", "gf-1", ACCOUNT, "dwell",
            52.52, 13.405, dwellTime, 300L, NOW);
        assertThat(objectMapper.readTree(payload.getValue()).get("dwellSeconds").asLong()).isEqualTo(300L);
    }

    @Test
    void shouldTreatDuplicateAsNoOp() {
        stubInsert(0);

        Outcome<Void> outcome = publisher.publish(enter);

        assertThat(outcome.isOk()).isTrue();
        verifyNoInteractions(kafkaTemplate);
        assertThat(registry.get("fenceping.events.duplicate").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldBeRetryableWhenEventLogIsDown() {
        when(eventLogRepository.insertIfAbsent(anyString(), anyString(), anyString(), anyString(), anyString(),
            anyDouble(), anyDouble(), any(), any(), any())).thenThrow(new DataAccessResourceFailureException("db down"));

        Outcome<Void> outcome = publisher.publish(enter);

        assertThat(outcome.isRetryable()).isTrue();
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void shouldBeRetryableWhenNoTransactionCanBeOpened() {
        when(eventLogRepository.insertIfAbsent(anyString(), anyString(), anyString(), anyString(), anyString(),
            anyDouble(), anyDouble(), any(), any(), any())).thenThrow(new CannotCreateTransactionException("db down"));

        Outcome<Void> outcome = publisher.publish(enter);

        assertThat(outcome.isRetryable()).isTrue();
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void shouldLeaveEventUnpublishedWhenSendFails() throws Exception {
        stubInsert(1);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        Outcome<Void> outcome = publisher.publish(enter);

        // Durable write succeeded, so the transition happened; delivery is deferred to the outbox relay
        assertThat(outcome.isOk()).isTrue();
        verify(eventLogRepository, never()).markPublished(anyString());
        assertThat(registry.get("fenceping.events.publish_failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void sendReportsFailureWhenProducerRejectsImmediately() throws Exception {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenThrow(new org.apache.kafka.common.errors.TimeoutException("metadata timeout"));

        assertThat(publisher.send(enter).get(1, TimeUnit.SECONDS)).isFalse();
        verify(eventLogRepository, never()).markPublished(anyString());
    }
}
