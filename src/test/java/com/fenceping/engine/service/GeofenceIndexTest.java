package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.exception.GeofenceLoadException;
import com.fenceping.engine.model.GeoPoint;
import com.fenceping.engine.model.GeofenceDefinition;
import com.fenceping.engine.model.GeofenceGeometry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.fenceping.engine.Fixtures.ACCOUNT;
import static com.fenceping.engine.Fixtures.circle;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GeofenceIndexTest {

    @Mock
    private GeofenceSource geofenceSource;

    private SimpleMeterRegistry registry;
    private GeofenceIndex index;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        index = new GeofenceIndex(geofenceSource, new EngineProperties(), new EngineMetrics(registry));
    }

    @Test
    void shouldLoadThroughOnceAndServeFromCache() {
        when(geofenceSource.listActiveGeofences(ACCOUNT)).thenReturn(List.of(circle("gf-1", 0, 0, 100)));

        Outcome<List<GeofenceDefinition>> first = index.geofencesFor(ACCOUNT);
        Outcome<List<GeofenceDefinition>> second = index.geofencesFor(ACCOUNT);

        assertThat(first.isOk()).isTrue();
        assertThat(second.value()).extracting(GeofenceDefinition::id).containsExactly("gf-1");
        verify(geofenceSource, times(1)).listActiveGeofences(ACCOUNT);
    }

    @Test
    void shouldReturnEmptyListForAccountWithoutGeofences() {
        when(geofenceSource.listActiveGeofences("empty")).thenReturn(List.of());

        Outcome<List<GeofenceDefinition>> outcome = index.geofencesFor("empty");

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.value()).isEmpty();
    }

    @Test
    void shouldDropInactiveGeofences() {
        GeofenceDefinition inactive = new GeofenceDefinition("gf-off", ACCOUNT, "off",
            GeofenceGeometry.circle(GeoPoint.of(0, 0), 100), false, null);
        when(geofenceSource.listActiveGeofences(ACCOUNT))
            .thenReturn(List.of(circle("gf-on", 0, 0, 100), inactive));

        assertThat(index.geofencesFor(ACCOUNT).value()).extracting(GeofenceDefinition::id).containsExactly("gf-on");
    }

    @Test
    @DisplayName("A failed load is RETRYABLE and is not cached")
    void shouldNotCacheFailures() {
        when(geofenceSource.listActiveGeofences(ACCOUNT))
            .thenThrow(new GeofenceLoadException(ACCOUNT, new DataAccessResourceFailureException("db down")))
            .thenReturn(List.of(circle("gf-1", 0, 0, 100)));

        Outcome<List<GeofenceDefinition>> failed = index.geofencesFor(ACCOUNT);
        Outcome<List<GeofenceDefinition>> recovered = index.geofencesFor(ACCOUNT);

        assertThat(failed.isRetryable()).isTrue();
        assertThat(failed.cause()).isInstanceOf(GeofenceLoadException.class);
        assertThat(recovered.isOk()).isTrue();
        assertThat(recovered.value()).hasSize(1);
        assertThat(registry.get("fenceping.index.load_failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Concurrent misses for one account share a single load")
    void shouldSingleFlightConcurrentMisses() throws Exception {
        CountDownLatch loadStarted = new CountDownLatch(1);
        CountDownLatch releaseLoad = new CountDownLatch(1);
        when(geofenceSource.listActiveGeofences(ACCOUNT)).thenAnswer(invocation -> {
            loadStarted.countDown();
            releaseLoad.await(5, TimeUnit.SECONDS);
            return List.of(circle("gf-1", 0, 0, 100));
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Outcome<List<GeofenceDefinition>>>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> index.geofencesFor(ACCOUNT)));
            }
            assertThat(loadStarted.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(100);
            releaseLoad.countDown();

            for (Future<Outcome<List<GeofenceDefinition>>> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS).value()).hasSize(1);
            }
        } finally {
            pool.shutdownNow();
        }

        verify(geofenceSource, times(1)).listActiveGeofences(ACCOUNT);
    }

    @Test
    void shouldReloadAfterInvalidation() {
        when(geofenceSource.listActiveGeofences(ACCOUNT))
            .thenReturn(List.of(circle("gf-1", 0, 0, 100)))
            .thenReturn(List.of(circle("gf-1", 0, 0, 100), circle("gf-2", 1, 1, 100)));

        index.geofencesFor(ACCOUNT);
        index.invalidate(ACCOUNT);

        assertThat(index.geofencesFor(ACCOUNT).value()).hasSize(2);
        verify(geofenceSource, times(2)).listActiveGeofences(ACCOUNT);
    }

    @Test
    void scheduledRefreshKeepsCachedGeofencesWhenSourceFails() {
        when(geofenceSource.listActiveGeofences(ACCOUNT))
            .thenReturn(List.of(circle("gf-1", 0, 0, 100)))
            .thenThrow(new GeofenceLoadException(ACCOUNT, new DataAccessResourceFailureException("db down")));

        index.geofencesFor(ACCOUNT);
        index.scheduledRefresh();

        assertThat(index.geofencesFor(ACCOUNT).value()).extracting(GeofenceDefinition::id).containsExactly("gf-1");
        assertThat(index.stats().cachedAccounts()).isEqualTo(1);
        assertThat(index.stats().cachedGeofences()).isEqualTo(1);
    }

    @Test
    void scheduledRefreshPicksUpChangedGeofences() {
        when(geofenceSource.listActiveGeofences(ACCOUNT))
            .thenReturn(List.of(circle("gf-1", 0, 0, 100)))
            .thenReturn(List.of(circle("gf-1", 0, 0, 100), circle("gf-2", 1, 1, 100)));

        index.geofencesFor(ACCOUNT);
        index.scheduledRefresh();

        assertThat(index.geofencesFor(ACCOUNT).value()).extracting(GeofenceDefinition::id)
            .containsExactly("gf-1", "gf-2");
    }

    @Test
    @DisplayName("An invalidation racing a scheduled refresh is not overwritten by the refresh")
    void invalidationDuringRefreshWins() throws Exception {
        CountDownLatch refreshLoading = new CountDownLatch(1);
        CountDownLatch releaseRefresh = new CountDownLatch(1);
        when(geofenceSource.listActiveGeofences(ACCOUNT))
            .thenReturn(List.of(circle("gf-1", 0, 0, 100)))
            .thenAnswer(inv -> {
                refreshLoading.countDown();
                releaseRefresh.await(5, TimeUnit.SECONDS);
                return List.of(circle("gf-1", 0, 0, 100));
            })
            .thenReturn(List.of(circle("gf-2", 0, 0, 100)));

        index.geofencesFor(ACCOUNT);

        ExecutorService workers = Executors.newFixedThreadPool(2);
        try {
            Future<?> refresh = workers.submit(index::scheduledRefresh);
            assertThat(refreshLoading.await(5, TimeUnit.SECONDS)).isTrue();
            Future<?> invalidation = workers.submit(() -> index.invalidate(ACCOUNT));
            Thread.sleep(100);
            releaseRefresh.countDown();
            refresh.get(5, TimeUnit.SECONDS);
            invalidation.get(5, TimeUnit.SECONDS);
        } finally {
            workers.shutdownNow();
        }

        assertThat(index.stats().cachedAccounts()).isZero();
        assertThat(index.geofencesFor(ACCOUNT).value()).extracting(GeofenceDefinition::id).containsExactly("gf-2");
    }
}
