package io.eventrelay.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.ErrorKind;
import io.eventrelay.error.ValidationException;
import io.eventrelay.util.Jsons;

/**
 * Newline-delimited JSON framing shared by every transport.
 */
public final class WireProtocol {
    private WireProtocol() {
    }

    public static WireRequest parse(String line) {
        JsonNode node;
        try {
            node = Jsons.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed JSON request: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new ValidationException("request must be a JSON object");
        }
        JsonNode event = node.get("event");
        if (event == null || !event.isTextual() || event.asText().isBlank()) {
            throw new ValidationException("field 'event' is required");
        }
        JsonNode data = node.get("data");
        if (data != null && !data.isNull() && !data.isObject()) {
            throw new ValidationException("field 'data' must be an object");
        }
        return new WireRequest(
                event.asText().trim(),
                data == null || data.isNull() ? Jsons.object() : (ObjectNode) data,
                textOrNull(node.get("origin")),
                textOrNull(node.get("correlation_id"))
        );
    }

    public static ObjectNode response(String event, String correlationId, ObjectNode data) {
        ObjectNode frame = envelope(event, correlationId);
        frame.set("data", data == null ? Jsons.object() : data);
        return frame;
    }

    public static ObjectNode error(String event, String correlationId, ErrorKind kind, String message) {
        ObjectNode frame = envelope(event, correlationId);
        ObjectNode error = frame.putObject("error");
        error.put("type", kind.wireName());
        error.put("message", message == null ? kind.wireName() : message);
        return frame;
    }

    public static String encode(ObjectNode frame) {
        return Jsons.toCompactJson(frame) + "\n";
    }

    public static boolean isError(JsonNode frame) {
        return frame != null && frame.has("error");
    }

    private static ObjectNode envelope(String event, String correlationId) {
        ObjectNode frame = Jsons.object();
        if (event != null) {
            frame.put("event", event);
        }
        if (correlationId != null) {
            frame.put("correlation_id", correlationId);
        }
        return frame;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
