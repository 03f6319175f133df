package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.model.LocationSample;
import com.fenceping.engine.repository.LocationHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;

/**
 * Writes every accepted sample to location_events before it is evaluated.
 *
 * Disabled with {@code fenceping.engine.history.enabled=false} when another system
 * keeps the location history.
 */
@Service
@Slf4j
public class LocationHistoryRecorder {

    private final LocationHistoryRepository historyRepository;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final boolean enabled;

    public LocationHistoryRecorder(LocationHistoryRepository historyRepository,
                                   EngineMetrics metrics,
                                   Clock clock,
                                   EngineProperties properties) {
        this.historyRepository = historyRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.enabled = properties.getHistory().isEnabled();
        if (!enabled) {
            log.info("Location history disabled, samples are evaluated without being recorded");
        }
    }

    /**
     * OK once the sample is recorded, already was, or history is disabled;
     * RETRYABLE when the table cannot be written.
     */
    public Outcome<Void> record(LocationSample sample) {
        if (!enabled) {
            return Outcome.ok(null);
        }

        try {
            int inserted = historyRepository.insertIfAbsent(
                sample.deviceId(),
                sample.accountId(),
                sample.timestamp(),
                sample.latitude(),
                sample.longitude(),
                sample.accuracyMeters(),
                sample.altitude(),
                clock.instant()
            );
            if (inserted == 0) {
                log.debug("Sample of device {} at {} already in history", sample.deviceId(), sample.timestamp());
            }
            return Outcome.ok(null);
        } catch (DataAccessException | TransactionException e) {
            metrics.historyWriteFailure();
            log.warn("Location history write failed for {}", sample.toLogString(), e);
            return Outcome.retryable("Location history unavailable", e);
        }
    }
}
