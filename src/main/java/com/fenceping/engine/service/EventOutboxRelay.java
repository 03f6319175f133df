package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.entity.GeofenceEventLog;
import com.fenceping.engine.model.GeofenceEvent;
import com.fenceping.engine.model.GeofenceEventType;
import com.fenceping.engine.repository.GeofenceEventLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers recorded events that never reached the output stream.
 *
 * Rows younger than the grace period are skipped: their first send may still be in
 * flight. A batch stops at the first failed send, so a broker outage costs one
 * timeout per run instead of one per row.
 *
 * A republished event can reach downstream consumers after later events of the
 * same device; consumers order by event timestamp and dedupe by event id.
 */
@Component
@Slf4j
public class EventOutboxRelay {

    private final GeofenceEventLogRepository eventLogRepository;
    private final EventPublisher eventPublisher;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final EngineProperties.Outbox outbox;

    public EventOutboxRelay(GeofenceEventLogRepository eventLogRepository, EventPublisher eventPublisher,
                            EngineMetrics metrics, Clock clock, EngineProperties properties) {
        this.eventLogRepository = eventLogRepository;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.outbox = properties.getOutbox();
    }

    @Scheduled(fixedDelayString = "${fenceping.engine.outbox.relay-interval:PT15S}")
    public void relay() {
        Instant cutoff = clock.instant().minus(outbox.getGracePeriod());
        List<GeofenceEventLog> pending;
        try {
            pending = eventLogRepository.findUnpublishedBefore(cutoff, PageRequest.of(0, outbox.getBatchSize()));
        } catch (DataAccessException | TransactionException e) {
            log.warn("Outbox scan failed", e);
            return;
        }

        if (pending.isEmpty()) {
            return;
        }

        int delivered = relay(pending);
        log.info("Outbox relay delivered {}/{} pending events", delivered, pending.size());
    }

    int relay(List<GeofenceEventLog> pending) {
        Duration timeout = outbox.getSendTimeout();
        int delivered = 0;
        for (GeofenceEventLog row : pending) {
            GeofenceEvent event = toEvent(row);
            try {
                if (!eventPublisher.send(event).get(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (TimeoutException | ExecutionException e) {
                log.warn("Outbox send of {} did not complete: {}", event.toLogString(), e.getMessage());
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return delivered;
            }
            metrics.outboxRepublished();
            delivered++;
        }
        return delivered;
    }

    static GeofenceEvent toEvent(GeofenceEventLog row) {
        return new GeofenceEvent(
            row.getEventId(),
            row.getDeviceId(),
            row.getGeofenceId(),
            row.getAccountId(),
            GeofenceEventType.fromValue(row.getEventType()),
            row.getLatitude(),
            row.getLongitude(),
            row.getEventTime(),
            row.getDwellSeconds()
        );
    }
}
