package com.fenceping.engine.dto;

import java.time.Instant;

/**
 * Envelope written to the dead-letter topic.
 *
 * @param v         envelope version
 * @param topic     topic the record was consumed from
 * @param partition source partition
 * @param offset    source offset
 * @param key       source record key (the device id for location records)
 * @param error     why the record was given up on
 * @param attempts  processing attempts made
 * @param data      original record value, unmodified
 * @param timestamp when the record was dead-lettered
 */
public record DeadLetterRecord(
    int v,
    String topic,
    int partition,
    long offset,
    String key,
    String error,
    int attempts,
    String data,
    Instant timestamp
) {

    public static final int VERSION = 1;
}
