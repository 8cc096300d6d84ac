package io.eventrelay.plugin;

import java.util.Set;

public interface EventPlugin {
    String id();

    void register(HandlerRegistry registry);

    /**
     * Event names this plugin only ever emits itself. Inbound requests under these names are
     * still dispatched, but never logged, so subscribers only see real notifications.
     */
    default Set<String> notifications() {
        return Set.of();
    }
}
