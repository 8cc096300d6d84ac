package io.eventrelay.plugin.builtin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.plugin.EventPlugin;
import io.eventrelay.plugin.HandlerRegistry;
import io.eventrelay.plugin.HandlerResult;
import io.eventrelay.util.Jsons;

import java.util.function.Supplier;

public final class SystemPlugin implements EventPlugin {
    private final Supplier<Object> health;
    private final Runnable shutdown;

    public SystemPlugin(Supplier<Object> health, Runnable shutdown) {
        this.health = health;
        this.shutdown = shutdown;
    }

    @Override
    public String id() {
        return "system";
    }

    @Override
    public void register(HandlerRegistry registry) {
        registry.register("system:health", ctx -> HandlerResult.respond(Jsons.wire(health.get())));
        registry.register("system:shutdown", ctx -> {
            shutdown.run();
            ObjectNode data = Jsons.object();
            data.put("status", "shutting_down");
            return HandlerResult.respond(data);
        });
    }
}
