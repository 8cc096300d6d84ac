package io.eventrelay.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record WireRequest(
        String event,
        ObjectNode data,
        String origin,
        String correlationId
) {
}
