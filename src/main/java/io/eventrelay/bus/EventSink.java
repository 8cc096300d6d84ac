package io.eventrelay.bus;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.TransportException;

/**
 * Outbound channel to one connected client. Implementations must accept calls from any
 * thread and must not block for long.
 */
public interface EventSink {
    String id();

    void send(ObjectNode message) throws TransportException;

    boolean isOpen();
}
