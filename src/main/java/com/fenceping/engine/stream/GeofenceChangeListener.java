package com.fenceping.engine.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenceping.engine.dto.GeofenceChangeRecord;
import com.fenceping.engine.service.GeofenceIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Invalidates the geofence index when the CRUD system reports a change.
 *
 * Every engine instance holds its own index, so each instance consumes the change topic
 * with its own group id and sees every notification. Missed notifications are covered
 * by the scheduled index refresh.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeofenceChangeListener {

    private final GeofenceIndex geofenceIndex;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        id = "geofence-changes",
        topics = "${fenceping.engine.topics.geofence-changes:geofence_changes}",
        groupId = "${fenceping.engine.consumer.group-id:geofence-processor}-changes-#{T(java.util.UUID).randomUUID()}",
        properties = "auto.offset.reset=latest"
    )
    public void onChange(String payload) {
        GeofenceChangeRecord change;
        try {
            change = objectMapper.readValue(payload, GeofenceChangeRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable geofence change notification: {}", e.getOriginalMessage());
            return;
        }

        if (change.accountId() == null || change.accountId().isBlank()) {
            geofenceIndex.invalidateAll();
            return;
        }

        log.debug("Geofence {} of account {} {}", change.geofenceId(), change.accountId(), change.change());
        geofenceIndex.invalidate(change.accountId());
    }
}
