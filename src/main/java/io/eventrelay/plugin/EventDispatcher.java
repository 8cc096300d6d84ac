package io.eventrelay.plugin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.error.EventRelayError;
import io.eventrelay.error.HandlerFailureException;
import io.eventrelay.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs every handler whose pattern matches the event, in registration order, on the
 * calling thread. The first handler that responds (or reports an error) decides the
 * reply; the remaining handlers still run for their side effects.
 */
public final class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final HandlerRegistry registry;
    private final AtomicLong handlerFailures = new AtomicLong();

    public EventDispatcher(HandlerRegistry registry) {
        this.registry = registry;
    }

    public DispatchOutcome dispatch(Event event, EventSink sink) {
        List<HandlerRegistry.Registration> matching = registry.matching(event.name());
        HandlerContext context = new HandlerContext(event, sink);
        HandlerResult authoritative = null;
        int failures = 0;
        for (HandlerRegistry.Registration registration : matching) {
            HandlerResult result;
            try {
                result = registration.handler().handle(context);
            } catch (Exception e) {
                if (e instanceof EventRelayError) {
                    EventRelayError error = (EventRelayError) e;
                    result = HandlerResult.error(error.kind(), error.getMessage());
                } else {
                    failures++;
                    handlerFailures.incrementAndGet();
                    HandlerFailureException failure = new HandlerFailureException(
                            "handler " + registration.pluginId() + " failed on " + event.name(), e);
                    log.warn("{} (#{})", failure.getMessage(), event.sequenceNo(), e);
                    continue;
                }
            }
            if (result == null || !result.contributes()) {
                continue;
            }
            if (authoritative == null) {
                authoritative = result;
            } else {
                log.debug("Ignoring later response from {} for {} #{}",
                        registration.pluginId(), event.name(), event.sequenceNo());
            }
        }
        if (authoritative == null) {
            return new DispatchOutcome(!matching.isEmpty(), matching.size(), failures, null, null, null);
        }
        if (authoritative.kind() == HandlerResult.Kind.ERROR) {
            return new DispatchOutcome(true, matching.size(), failures, null,
                    authoritative.errorKind(), authoritative.error());
        }
        ObjectNode response = authoritative.data();
        return new DispatchOutcome(true, matching.size(), failures, response, null, null);
    }

    public long handlerFailures() {
        return handlerFailures.get();
    }

    public HandlerRegistry registry() {
        return registry;
    }
}
