package io.eventrelay.plugin;

import io.eventrelay.log.EventPatterns;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public final class HandlerRegistry {
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Set<String> notifications = ConcurrentHashMap.newKeySet();

    public void register(String pattern, EventHandler handler) {
        register("anonymous", pattern, handler);
    }

    public void register(String pluginId, String pattern, EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        registrations.add(new Registration(pluginId, EventPatterns.validate(pattern), handler));
    }

    public void install(EventPlugin plugin) {
        HandlerRegistry scoped = new HandlerRegistry();
        plugin.register(scoped);
        for (Registration registration : scoped.registrations) {
            registrations.add(new Registration(plugin.id(), registration.pattern(), registration.handler()));
        }
        for (String name : plugin.notifications()) {
            notifications.add(EventPatterns.validateEventName(name));
        }
    }

    public boolean isNotification(String eventName) {
        return notifications.contains(eventName);
    }

    public List<Registration> matching(String eventName) {
        List<Registration> out = new ArrayList<>();
        for (Registration registration : registrations) {
            if (EventPatterns.matches(registration.pattern(), eventName)) {
                out.add(registration);
            }
        }
        return out;
    }

    public List<Registration> registrations() {
        return List.copyOf(registrations);
    }

    public record Registration(
            String pluginId,
            String pattern,
            EventHandler handler
    ) {
    }
}
