package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.entity.Geofence;
import com.fenceping.engine.exception.GeofenceLoadException;
import com.fenceping.engine.exception.InvalidCoordinateException;
import com.fenceping.engine.geometry.GeofenceGeometryMapper;
import com.fenceping.engine.model.GeofenceDefinition;
import com.fenceping.engine.model.GeofenceGeometry;
import com.fenceping.engine.model.GeofenceKind;
import com.fenceping.engine.repository.GeofenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Loads geofences from the PostGIS geofences table.
 *
 * A stored geofence whose geometry breaks its kind's invariants is skipped and counted;
 * it does not fail the rest of the account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaGeofenceSource implements GeofenceSource {

    private final GeofenceRepository geofenceRepository;
    private final EngineProperties properties;
    private final EngineMetrics metrics;

    @Override
    public List<GeofenceDefinition> listActiveGeofences(String accountId) {
        UUID account;
        try {
            account = UUID.fromString(accountId);
        } catch (IllegalArgumentException e) {
            log.debug("Account id {} is not a UUID, no geofences", accountId);
            return List.of();
        }

        List<Geofence> rows;
        try {
            rows = geofenceRepository.findByAccountIdAndActiveTrue(account);
        } catch (DataAccessException | TransactionException e) {
            throw new GeofenceLoadException(accountId, e);
        }

        List<GeofenceDefinition> definitions = new ArrayList<>(rows.size());
        for (Geofence row : rows) {
            try {
                definitions.add(toDefinition(row));
            } catch (InvalidCoordinateException | IllegalArgumentException e) {
                metrics.invalidGeometry();
                log.warn("Skipping geofence {} of account {}: {}", row.getId(), accountId, e.getMessage());
            }
        }

        log.debug("Loaded {} active geofences for account {}", definitions.size(), accountId);
        return definitions;
    }

    private GeofenceDefinition toDefinition(Geofence row) {
        GeofenceKind kind = GeofenceKind.fromValue(row.getGeofenceType());
        GeofenceGeometry geometry = GeofenceGeometryMapper.toGeofenceGeometry(
            kind,
            row.getGeometry(),
            row.getRadiusMeters(),
            properties.getGeometry().getDefaultPointRadiusMeters()
        );

        return new GeofenceDefinition(
            row.getId().toString(),
            row.getAccountId().toString(),
            row.getName(),
            geometry,
            Boolean.TRUE.equals(row.getActive()),
            row.getDwellThresholdSeconds()
        );
    }
}
