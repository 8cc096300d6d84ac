package io.eventrelay.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.ValidationException;
import io.eventrelay.util.Jsons;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Field readers for request payloads. Unknown fields are ignored; wrong types for known
 * fields raise {@link ValidationException}.
 */
public final class Payloads {
    private Payloads() {
    }

    public static String text(ObjectNode data, String field) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ValidationException("field '" + field + "' must be a string");
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    public static String requireText(ObjectNode data, String field) {
        String value = text(data, field);
        if (value == null) {
            throw new ValidationException("field '" + field + "' is required");
        }
        return value;
    }

    /** Accepts either a single string or an array of strings. */
    public static List<String> stringList(ObjectNode data, String field) {
        JsonNode node = data == null ? null : data.get(field);
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isTextual()) {
            out.add(node.asText());
            return out;
        }
        if (!node.isArray()) {
            throw new ValidationException("field '" + field + "' must be a string or an array of strings");
        }
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ValidationException("field '" + field + "' must contain only strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    public static int intValue(ObjectNode data, String field, int fallback, int min, int max) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ValidationException("field '" + field + "' must be an integer");
        }
        int value = node.asInt();
        if (value < min || value > max) {
            throw new ValidationException("field '" + field + "' must be between " + min + " and " + max);
        }
        return value;
    }

    public static long longValue(ObjectNode data, String field, long fallback) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new ValidationException("field '" + field + "' must be an integer");
        }
        return node.asLong();
    }

    public static double doubleValue(ObjectNode data, String field, double fallback) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new ValidationException("field '" + field + "' must be a number");
        }
        return node.asDouble();
    }

    public static boolean boolValue(ObjectNode data, String field, boolean fallback) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw new ValidationException("field '" + field + "' must be a boolean");
        }
        return node.asBoolean();
    }

    public static ObjectNode object(ObjectNode data, String field) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) {
            return Jsons.object();
        }
        if (!node.isObject()) {
            throw new ValidationException("field '" + field + "' must be an object");
        }
        return (ObjectNode) node;
    }

    /**
     * Reads a point in time given either as epoch milliseconds or as an ISO-8601 instant.
     * Returns {@code null} when the field is absent.
     */
    public static Long instantMs(ObjectNode data, String field) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return (long) (node.asDouble() * 1000.0d);
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText().trim()).toEpochMilli();
            } catch (DateTimeParseException e) {
                throw new ValidationException("field '" + field + "' must be epoch millis or an ISO-8601 instant");
            }
        }
        throw new ValidationException("field '" + field + "' must be epoch millis or an ISO-8601 instant");
    }
}
