package com.fenceping.engine.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenceping.engine.exception.MalformedSampleException;
import com.fenceping.engine.model.LocationSample;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class LocationSampleParserTest {

    private final LocationSampleParser parser = new LocationSampleParser(new ObjectMapper());

    @Test
    void parsesCanonicalRecord() {
        LocationSample sample = parser.parse("""
            {"deviceId":"device-1","accountId":"acc-1","latitude":40.7128,"longitude":-74.006,
             "accuracy":12.5,"altitude":10,"timestamp":"2024-05-01T10:00:00Z"}
            """);

        assertThat(sample.deviceId()).isEqualTo("device-1");
        assertThat(sample.accountId()).isEqualTo("acc-1");
        assertThat(sample.latitude()).isEqualTo(40.7128);
        assertThat(sample.longitude()).isEqualTo(-74.006);
        assertThat(sample.accuracyMeters()).isEqualTo(12.5);
        assertThat(sample.altitude()).isEqualTo(10.0);
        assertThat(sample.timestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void acceptsShortAliasesAndEpochMillis() {
        LocationSample sample = parser.parse("""
            {"deviceId":"device-1","lat":1.5,"lng":2.5,"accuracyM":30,"ts":1714557600000}
            """);

        assertThat(sample.accountId()).isNull();
        assertThat(sample.latitude()).isEqualTo(1.5);
        assertThat(sample.longitude()).isEqualTo(2.5);
        assertThat(sample.accuracyMeters()).isEqualTo(30.0);
        assertThat(sample.altitude()).isNull();
        assertThat(sample.timestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void acceptsNumericStrings() {
        LocationSample sample = parser.parse("""
            {"deviceId":"device-1","lat":"1.5","lon":" 2.5 ","ts":"1714557600000"}
            """);

        assertThat(sample.latitude()).isEqualTo(1.5);
        assertThat(sample.longitude()).isEqualTo(2.5);
        assertThat(sample.timestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void acceptsOffsetTimestamps() {
        LocationSample sample = parser.parse("""
            {"deviceId":"device-1","lat":1,"lon":2,"timestamp":"2024-05-01T12:00:00+02:00"}
            """);

        assertThat(sample.timestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void leavesRangeChecksToTheProcessor() {
        LocationSample sample = parser.parse("""
            {"deviceId":"device-1","lat":123,"lon":2,"ts":1714557600000}
            """);

        assertThat(sample.latitude()).isEqualTo(123.0);
    }

    @Test
    void rejectsMalformedRecords() {
        assertThatThrownBy(() -> parser.parse("not json"))
            .isInstanceOf(MalformedSampleException.class);
        assertThatThrownBy(() -> parser.parse("[1,2,3]"))
            .isInstanceOf(MalformedSampleException.class);
        assertThatThrownBy(() -> parser.parse(""))
            .isInstanceOf(MalformedSampleException.class);
        assertThatThrownBy(() -> parser.parse("{\"lat\":1,\"lon\":2,\"ts\":1}"))
            .isInstanceOf(MalformedSampleException.class)
            .hasMessageContaining("deviceId");
        assertThatThrownBy(() -> parser.parse("{\"deviceId\":\"d\",\"lon\":2,\"ts\":1}"))
            .isInstanceOf(MalformedSampleException.class)
            .hasMessageContaining("latitude");
        assertThatThrownBy(() -> parser.parse("{\"deviceId\":\"d\",\"lat\":\"north\",\"lon\":2,\"ts\":1}"))
            .isInstanceOf(MalformedSampleException.class)
            .hasMessageContaining("not a number");
    }

    @Test
    void rejectsBadTimestamps() {
        assertThatThrownBy(() -> parser.parse("{\"deviceId\":\"d\",\"lat\":1,\"lon\":2}"))
            .isInstanceOf(MalformedSampleException.class)
            .hasMessageContaining("timestamp");
        assertThatThrownBy(() -> parser.parse("{\"deviceId\":\"d\",\"lat\":1,\"lon\":2,\"ts\":\"yesterday\"}"))
            .isInstanceOf(MalformedSampleException.class);
        assertThatThrownBy(() -> parser.parse("{\"deviceId\":\"d\",\"lat\":1,\"lon\":2,\"ts\":\"99999999999999999999999\"}"))
            .isInstanceOf(MalformedSampleException.class)
            .hasMessageContaining("out of range");
        assertThatThrownBy(() -> parser.parse("{\"deviceId\":\"d\",\"lat\":1,\"lon\":2,\"ts\":true}"))
            .isInstanceOf(MalformedSampleException.class);
    }
}
