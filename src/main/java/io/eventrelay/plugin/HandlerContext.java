package io.eventrelay.plugin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.model.Event;

import java.util.Optional;

public record HandlerContext(
        Event event,
        EventSink sink
) {
    public ObjectNode data() {
        return event.data();
    }

    public String origin() {
        return event.origin();
    }

    public Optional<EventSink> replyChannel() {
        return Optional.ofNullable(sink);
    }
}
