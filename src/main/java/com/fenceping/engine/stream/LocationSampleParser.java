package com.fenceping.engine.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenceping.engine.exception.MalformedSampleException;
import com.fenceping.engine.model.LocationSample;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Parses location records from the input stream.
 *
 * Accepted fields (aliases in brackets):
 * - deviceId (required)
 * - accountId (optional, resolved from the device registry when absent)
 * - latitude [lat], longitude [lon, lng] (required, numeric)
 * - timestamp [ts] (required): ISO-8601 string, epoch millis number or numeric string
 * - accuracy [accuracyMeters, accuracyM], altitude [alt] (optional)
 *
 * Range checks on the coordinates are left to the processor.
 */
@Component
public class LocationSampleParser {

    private final ObjectMapper objectMapper;

    public LocationSampleParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MalformedSampleException if the record is not JSON or misses a required field
     */
    public LocationSample parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedSampleException("Empty location record");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedSampleException("Location record is not valid JSON", e);
        }
        if (!root.isObject()) {
            throw new MalformedSampleException("Location record is not a JSON object");
        }

        String deviceId = text(root, "deviceId");
        if (deviceId == null || deviceId.isBlank()) {
            throw new MalformedSampleException("deviceId is required");
        }

        return new LocationSample(
            deviceId,
            text(root, "accountId"),
            requiredNumber(root, "latitude", "lat"),
            requiredNumber(root, "longitude", "lon", "lng"),
            optionalNumber(root, "accuracy", "accuracyMeters", "accuracyM"),
            optionalNumber(root, "altitude", "alt"),
            timestamp(field(root, "timestamp", "ts"))
        );
    }

    private static JsonNode field(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String text(JsonNode root, String name) {
        JsonNode node = field(root, name);
        return node == null ? null : node.asText();
    }

    private static double requiredNumber(JsonNode root, String... names) {
        Double value = optionalNumber(root, names);
        if (value == null) {
            throw new MalformedSampleException(names[0] + " is required");
        }
        return value;
    }

    private static Double optionalNumber(JsonNode root, String... names) {
        JsonNode node = field(root, names);
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedSampleException(names[0] + " is not a number: " + node.asText(), e);
            }
        }
        throw new MalformedSampleException(names[0] + " is not a number");
    }

    static Instant timestamp(JsonNode node) {
        if (node == null) {
            throw new MalformedSampleException("timestamp is required");
        }
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.longValue());
        }
        if (!node.isTextual()) {
            throw new MalformedSampleException("timestamp must be ISO-8601 or epoch millis");
        }

        String text = node.asText().trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new MalformedSampleException("timestamp out of range: " + text, e);
            }
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw new MalformedSampleException("Unparseable timestamp: " + text, e);
        }
    }
}
