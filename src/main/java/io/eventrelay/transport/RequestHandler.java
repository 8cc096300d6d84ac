package io.eventrelay.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;

/**
 * Entry point a transport calls for every decoded request. The sink is {@code null} for
 * transports that cannot push (HTTP).
 */
public interface RequestHandler {
    ObjectNode handle(WireRequest request, EventSink sink);

    default void onDisconnect(EventSink sink) {
    }
}
