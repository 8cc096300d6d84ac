package io.eventrelay.log;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.model.Event;

/**
 * Sink for events produced inside the daemon (job notifications, replay markers).
 */
@FunctionalInterface
public interface EventEmitter {
    Event emit(String name, ObjectNode data, String origin);
}
