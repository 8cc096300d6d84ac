package io.eventrelay.plugin.builtin;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.bus.SubscriptionBroker;
import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventLog;
import io.eventrelay.log.EventPatterns;
import io.eventrelay.model.Event;
import io.eventrelay.model.Subscription;
import io.eventrelay.plugin.EventPlugin;
import io.eventrelay.plugin.HandlerContext;
import io.eventrelay.plugin.HandlerRegistry;
import io.eventrelay.plugin.HandlerResult;
import io.eventrelay.plugin.Payloads;
import io.eventrelay.util.Jsons;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

public final class MonitorPlugin implements EventPlugin {
    private static final int DEFAULT_EVENT_LIMIT = 100;
    private static final int MAX_EVENT_LIMIT = 10_000;

    private final EventLog eventLog;
    private final SubscriptionBroker broker;

    public MonitorPlugin(EventLog eventLog, SubscriptionBroker broker) {
        this.eventLog = eventLog;
        this.broker = broker;
    }

    @Override
    public String id() {
        return "monitor";
    }

    @Override
    public void register(HandlerRegistry registry) {
        registry.register("monitor:subscribe", this::subscribe);
        registry.register("monitor:unsubscribe", ctx -> {
            String clientId = clientId(ctx);
            List<String> patterns = Payloads.stringList(ctx.data(), "event_patterns");
            Optional<Subscription> remaining = broker.unsubscribe(clientId, patterns);
            ObjectNode data = Jsons.object();
            data.put("client_id", clientId);
            data.put("status", remaining.isPresent() ? "updated" : "unsubscribed");
            ArrayNode left = data.putArray("patterns");
            remaining.ifPresent(sub -> sub.patterns().stream().sorted().forEach(left::add));
            return HandlerResult.respond(data);
        });
        registry.register("monitor:get_subscriptions", ctx -> {
            ObjectNode data = Jsons.object();
            ArrayNode items = data.putArray("subscriptions");
            for (Subscription subscription : broker.list()) {
                items.add(Jsons.wire(subscription));
            }
            data.put("count", items.size());
            return HandlerResult.respond(data);
        });
        registry.register("monitor:get_events", this::getEvents);
        registry.register("monitor:get_stats", ctx -> {
            ObjectNode data = Jsons.object();
            data.put("last_sequence", eventLog.lastSequence());
            data.put("first_retained_sequence", eventLog.firstRetainedSequence());
            data.put("retained_events", eventLog.size());
            data.set("counts_by_namespace", Jsons.valueToTree(eventLog.countsByNamespace()));
            data.put("subscribers", broker.size());
            data.put("delivered", broker.delivered());
            data.put("dropped", broker.dropped());
            data.set("journal", Jsons.wire(eventLog.journalHealth()));
            return HandlerResult.respond(data);
        });
    }

    private HandlerResult subscribe(HandlerContext ctx) {
        EventSink sink = ctx.replyChannel()
                .orElseThrow(() -> new ValidationException("monitor:subscribe needs a push-capable connection"));
        String clientId = clientId(ctx);
        List<String> patterns = Payloads.stringList(ctx.data(), "event_patterns");
        Subscription subscription = broker.subscribe(clientId, patterns, sink);
        ObjectNode data = Jsons.object();
        data.put("client_id", clientId);
        data.put("status", "subscribed");
        ArrayNode items = data.putArray("patterns");
        subscription.patterns().stream().sorted().forEach(items::add);
        data.put("last_sequence", eventLog.lastSequence());
        return HandlerResult.respond(data);
    }

    private HandlerResult getEvents(HandlerContext ctx) {
        ObjectNode request = ctx.data();
        Set<String> patterns = EventPatterns.normalize(Payloads.stringList(request, "event_patterns"));
        String originator = Payloads.text(request, "originator_id");
        Long sinceTime = Payloads.instantMs(request, "since_time");
        Long untilTime = Payloads.instantMs(request, "until_time");
        int limit = Payloads.intValue(request, "limit", DEFAULT_EVENT_LIMIT, 1, MAX_EVENT_LIMIT);
        Predicate<Event> filter = event ->
                EventPatterns.matchesAny(patterns, event.name())
                        && (originator == null || originator.equals(event.origin()))
                        && (sinceTime == null || event.timestampMs() >= sinceTime)
                        && (untilTime == null || event.timestampMs() <= untilTime);
        List<Event> events = request.hasNonNull("since")
                ? eventLog.scan(Payloads.longValue(request, "since", 0L), filter, limit)
                : eventLog.latest(filter, limit);
        ObjectNode data = Jsons.object();
        ArrayNode items = data.putArray("events");
        for (Event event : events) {
            items.add(event.toWire());
        }
        data.put("count", items.size());
        data.put("last_sequence", events.isEmpty() ? eventLog.lastSequence()
                : events.get(events.size() - 1).sequenceNo());
        return HandlerResult.respond(data);
    }

    private static String clientId(HandlerContext ctx) {
        String clientId = Payloads.text(ctx.data(), "client_id");
        if (clientId == null) {
            clientId = ctx.origin();
        }
        if (clientId == null && ctx.sink() != null) {
            clientId = ctx.sink().id();
        }
        if (clientId == null) {
            throw new ValidationException("field 'client_id' is required");
        }
        return clientId;
    }
}
