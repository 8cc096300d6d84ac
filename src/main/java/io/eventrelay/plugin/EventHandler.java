package io.eventrelay.plugin;

@FunctionalInterface
public interface EventHandler {
    HandlerResult handle(HandlerContext context) throws Exception;
}
