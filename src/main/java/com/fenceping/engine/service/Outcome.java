package com.fenceping.engine.service;

/**
 * Result of one engine step.
 *
 * The stream consumer decides commit, redelivery or dead-letter purely from {@link Status};
 * components translate their exceptions into an outcome at their boundary.
 *
 * @param status outcome status
 * @param value  result, only meaningful when {@code OK}
 * @param reason human-readable failure reason, {@code null} when {@code OK}
 * @param cause  underlying exception, if any
 */
public record Outcome<T>(Status status, T value, String reason, Throwable cause) {

    public enum Status {
        /** Step succeeded. */
        OK,
        /** Transient failure: the same input may succeed later. */
        RETRYABLE,
        /** Permanent failure: retrying the same input can never succeed. */
        FATAL
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Status.OK, value, null, null);
    }

    public static <T> Outcome<T> retryable(String reason, Throwable cause) {
        return new Outcome<>(Status.RETRYABLE, null, reason, cause);
    }

    public static <T> Outcome<T> fatal(String reason, Throwable cause) {
        return new Outcome<>(Status.FATAL, null, reason, cause);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE;
    }

    public boolean isFatal() {
        return status == Status.FATAL;
    }

    /**
     * Re-types a failed outcome, keeping status, reason and cause.
     */
    @SuppressWarnings("unchecked")
    public <U> Outcome<U> failure() {
        if (isOk()) {
            throw new IllegalStateException("Outcome is OK");
        }
        return (Outcome<U>) this;
    }
}
