package com.fenceping.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the detection engine, bound from {@code fenceping.engine.*}.
 */
@Data
@ConfigurationProperties(prefix = "fenceping.engine")
public class EngineProperties {

    private Topics topics = new Topics();
    private Consumer consumer = new Consumer();
    private Index index = new Index();
    private State state = new State();
    private Accuracy accuracy = new Accuracy();
    private Sample sample = new Sample();
    private Geometry geometry = new Geometry();
    private Outbox outbox = new Outbox();
    private History history = new History();

    @Data
    public static class Topics {
        private String locations = "raw_events";
        private String events = "gf_events";
        private String deadLetter = "dlq";
        private String geofenceChanges = "geofence_changes";
        private int partitions = 12;
        private short replicationFactor = 1;
    }

    @Data
    public static class Consumer {
        private String groupId = "geofence-processor";
        private int concurrency = 4;
        /**
         * Redelivery budget for samples whose processing keeps failing with a retryable error.
         */
        private Backoff retry = new Backoff(Duration.ofMillis(500), 2.0, Duration.ofSeconds(30), 8);
    }

    @Data
    public static class Index {
        private Duration refreshInterval = Duration.ofMinutes(5);
        private Duration idleExpiry = Duration.ofHours(1);
        private long maxAccounts = 10_000;
    }

    @Data
    public static class State {
        /**
         * caffeine (in-process) or redis (shared between engine instances)
         */
        private String cacheType = "caffeine";
        private Duration idleTtl = Duration.ofHours(1);
        private long maxEntries = 1_000_000;
        private String redisKeyPrefix = "containment:";
        private Backoff persistRetry = new Backoff(Duration.ofMillis(200), 2.0, Duration.ofSeconds(10), 6);
        /**
         * Interval at which states whose write exhausted persistRetry are written again.
         */
        private Duration unpersistedRetryInterval = Duration.ofMinutes(1);
    }

    /**
     * Hysteresis applied to low-accuracy samples near a boundary.
     */
    @Data
    public static class Accuracy {
        /**
         * Accuracy above which a sample is considered noisy for polygon geofences.
         */
        private double maxAccuracyMeters = 50.0;
        /**
         * For circles, a sample is noisy when its accuracy exceeds radius times this ratio.
         */
        private double circleRadiusRatio = 0.5;
        /**
         * Noisy samples closer to the boundary than accuracy times this factor are held.
         */
        private double boundaryMarginFactor = 1.0;
    }

    @Data
    public static class Sample {
        private Duration futureTolerance = Duration.ofMinutes(5);
    }

    @Data
    public static class Geometry {
        private double defaultPointRadiusMeters = 100.0;
    }

    @Data
    public static class Outbox {
        private Duration relayInterval = Duration.ofSeconds(15);
        private Duration gracePeriod = Duration.ofSeconds(30);
        private int batchSize = 500;
        private Duration sendTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class History {
        /**
         * Record every accepted sample in location_events before evaluating it.
         */
        private boolean enabled = true;
    }

    @Data
    public static class Backoff {
        private Duration initialDelay;
        private double multiplier;
        private Duration maxDelay;
        private int maxAttempts;

        public Backoff() {
        }

        public Backoff(Duration initialDelay, double multiplier, Duration maxDelay, int maxAttempts) {
            this.initialDelay = initialDelay;
            this.multiplier = multiplier;
            this.maxDelay = maxDelay;
            this.maxAttempts = maxAttempts;
        }
    }
}
