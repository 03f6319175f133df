package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.entity.Geofence;
import com.fenceping.engine.exception.GeofenceLoadException;
import com.fenceping.engine.model.GeofenceDefinition;
import com.fenceping.engine.model.GeofenceKind;
import com.fenceping.engine.repository.GeofenceRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.UUID;

import static com.fenceping.engine.Fixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaGeofenceSourceTest {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), 4326);
    private static final UUID ACCOUNT_ID = UUID.fromString(ACCOUNT);

    @Mock private GeofenceRepository geofenceRepository;

    private SimpleMeterRegistry registry;
    private JpaGeofenceSource source;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        source = new JpaGeofenceSource(geofenceRepository, new EngineProperties(), new EngineMetrics(registry));
    }

    private static Geofence row(String type, org.locationtech.jts.geom.Geometry geometry, Double radius) {
        return Geofence.builder()
            .id(UUID.randomUUID())
            .accountId(ACCOUNT_ID)
            .name(type + " fence")
            .geofenceType(type)
            .geometry(geometry)
            .radiusMeters(radius)
            .dwellThresholdSeconds(300L)
            .build();
    }

    @Test
    void mapsStoredRowsToDefinitions() {
        Geofence circle = row("circle", GEOMETRY_FACTORY.createPoint(new Coordinate(-74.0, 40.7)), 250.0);
        Geofence square = row("polygon", GEOMETRY_FACTORY.createPolygon(rectangle(0, 0, 1, 1)), null);
        when(geofenceRepository.findByAccountIdAndActiveTrue(ACCOUNT_ID)).thenReturn(List.of(circle, square));

        List<GeofenceDefinition> definitions = source.listActiveGeofences(ACCOUNT);

        assertThat(definitions).extracting(GeofenceDefinition::kind)
            .containsExactly(GeofenceKind.CIRCLE, GeofenceKind.POLYGON);
        GeofenceDefinition mapped = definitions.get(0);
        assertThat(mapped.id()).isEqualTo(circle.getId().toString());
        assertThat(mapped.accountId()).isEqualTo(ACCOUNT);
        assertThat(mapped.geometry().radiusMeters()).isEqualTo(250.0);
        assertThat(mapped.geometry().center().latitude()).isEqualTo(40.7);
        assertThat(mapped.dwellThresholdSeconds()).isEqualTo(300L);
    }

    @Test
    void skipsMalformedGeofenceWithoutFailingTheAccount() {
        Geofence noRadius = row("circle", GEOMETRY_FACTORY.createPoint(new Coordinate(0, 0)), null);
        Geofence unknownType = row("hexagon", GEOMETRY_FACTORY.createPoint(new Coordinate(0, 0)), 10.0);
        Geofence valid = row("point", GEOMETRY_FACTORY.createPoint(new Coordinate(0, 0)), null);
        when(geofenceRepository.findByAccountIdAndActiveTrue(ACCOUNT_ID))
            .thenReturn(List.of(noRadius, unknownType, valid));

        List<GeofenceDefinition> definitions = source.listActiveGeofences(ACCOUNT);

        assertThat(definitions).hasSize(1);
        assertThat(definitions.get(0).geometry().radiusMeters()).isEqualTo(100.0);
        assertThat(registry.get("fenceping.index.invalid_geometries").counter().count()).isEqualTo(2.0);
    }

    @Test
    void nonUuidAccountHasNoGeofences() {
        assertThat(source.listActiveGeofences("not-a-uuid")).isEmpty();
        verifyNoInteractions(geofenceRepository);
    }

    @Test
    void databaseFailureIsALoadFailure() {
        when(geofenceRepository.findByAccountIdAndActiveTrue(any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> source.listActiveGeofences(ACCOUNT))
            .isInstanceOf(GeofenceLoadException.class);
    }

    @Test
    void transactionFailureIsALoadFailure() {
        when(geofenceRepository.findByAccountIdAndActiveTrue(any()))
            .thenThrow(new CannotCreateTransactionException("could not open JPA EntityManager"));

        assertThatThrownBy(() -> source.listActiveGeofences(ACCOUNT))
            .isInstanceOf(GeofenceLoadException.class)
            .hasCauseInstanceOf(CannotCreateTransactionException.class);
    }
}
