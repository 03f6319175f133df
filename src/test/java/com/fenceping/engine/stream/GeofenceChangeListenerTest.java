package com.fenceping.engine.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenceping.engine.service.GeofenceIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GeofenceChangeListenerTest {

    @Mock private GeofenceIndex geofenceIndex;

    @Test
    void invalidatesTheChangedAccount() {
        new GeofenceChangeListener(geofenceIndex, new ObjectMapper())
            .onChange("{\"accountId\":\"acc-1\",\"geofenceId\":\"gf-1\",\"change\":\"updated\"}");

        verify(geofenceIndex).invalidate("acc-1");
        verifyNoMoreInteractions(geofenceIndex);
    }

    @Test
    void notificationWithoutAccountInvalidatesEverything() {
        new GeofenceChangeListener(geofenceIndex, new ObjectMapper()).onChange("{\"change\":\"bulk-import\"}");

        verify(geofenceIndex).invalidateAll();
    }

    @Test
    void ignoresUnreadableNotification() {
        new GeofenceChangeListener(geofenceIndex, new ObjectMapper()).onChange("}{");

        verifyNoInteractions(geofenceIndex);
    }
}
