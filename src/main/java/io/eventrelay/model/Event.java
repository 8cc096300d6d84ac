package io.eventrelay.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.util.Jsons;

import java.time.Instant;

/**
 * One entry of the event log. The payload is copied on the way in and on the way out,
 * so an appended event never changes.
 */
public record Event(
        long sequenceNo,
        String name,
        ObjectNode data,
        Instant timestamp,
        String origin
) {
    public static final String REPLAY_TAG = "_replay";

    public Event {
        data = data == null ? Jsons.object() : data.deepCopy();
    }

    @Override
    public ObjectNode data() {
        return data.deepCopy();
    }

    public String namespace() {
        int idx = name.indexOf(':');
        return idx < 0 ? name : name.substring(0, idx);
    }

    public long timestampMs() {
        return timestamp.toEpochMilli();
    }

    public boolean replayed() {
        return data.has(REPLAY_TAG);
    }

    /** Reads a top-level text field of the payload without copying it. */
    public String dataText(String field) {
        return data.hasNonNull(field) ? data.get(field).asText() : null;
    }

    public ObjectNode toWire() {
        ObjectNode node = Jsons.object();
        node.put("event", name);
        node.put("sequence_no", sequenceNo);
        node.put("timestamp", timestamp.toString());
        if (origin == null) {
            node.putNull("origin");
        } else {
            node.put("origin", origin);
        }
        node.set("data", data.deepCopy());
        return node;
    }
}
