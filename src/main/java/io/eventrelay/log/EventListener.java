package io.eventrelay.log;

import io.eventrelay.model.Event;

@FunctionalInterface
public interface EventListener {
    void onEvent(Event event);
}
