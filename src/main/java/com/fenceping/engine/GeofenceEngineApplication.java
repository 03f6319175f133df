package com.fenceping.engine;

import com.fenceping.engine.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main entry point for the FencePing Geofence Event Detection Engine.
 *
 * Flow:
 * 1. Location samples arrive on the input topic, partitioned by device
 * 2. Each partition worker resolves the account's geofences from the index
 * 3. The state tracker decides enter / exit / dwell per (device, geofence)
 * 4. Events are written to the durable event log, then to the output topic
 * 5. Offsets are committed only after state and event writes succeeded
 *
 * Scheduling and async executors are enabled in {@code AsyncConfig}.
 */
@SpringBootApplication
@EnableConfigurationProperties(EngineProperties.class)
public class GeofenceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeofenceEngineApplication.class, args);
    }
}
