package io.eventrelay.plugin.builtin;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.ValidationException;
import io.eventrelay.model.Event;
import io.eventrelay.model.ObservationSubscription;
import io.eventrelay.model.ReplaySession;
import io.eventrelay.observation.ObservationManager;
import io.eventrelay.observation.PatternAnalyzer;
import io.eventrelay.observation.ReplayEngine;
import io.eventrelay.observation.ReplayRequest;
import io.eventrelay.plugin.EventPlugin;
import io.eventrelay.plugin.HandlerContext;
import io.eventrelay.plugin.HandlerRegistry;
import io.eventrelay.plugin.HandlerResult;
import io.eventrelay.plugin.Payloads;
import io.eventrelay.util.Jsons;

import java.util.List;

public final class ObservationPlugin implements EventPlugin {
    private static final int DEFAULT_HISTORY_LIMIT = 100;
    private static final int MAX_LIMIT = 100_000;

    private final ObservationManager observations;
    private final PatternAnalyzer analyzer;
    private final ReplayEngine replays;

    public ObservationPlugin(ObservationManager observations, PatternAnalyzer analyzer, ReplayEngine replays) {
        this.observations = observations;
        this.analyzer = analyzer;
        this.replays = replays;
    }

    @Override
    public String id() {
        return "observation";
    }

    @Override
    public void register(HandlerRegistry registry) {
        registry.register("observation:subscribe", ctx -> {
            String observer = observer(ctx);
            String target = Payloads.requireText(ctx.data(), "target");
            List<String> patterns = Payloads.stringList(ctx.data(), "events");
            ObservationSubscription subscription =
                    observations.subscribe(observer, target, patterns, ctx.sink());
            ObjectNode data = Jsons.wire(subscription);
            data.put("status", "subscribed");
            return HandlerResult.respond(data);
        });
        registry.register("observation:unsubscribe", ctx -> {
            String subscriptionId = Payloads.text(ctx.data(), "subscription_id");
            ObjectNode data = Jsons.object();
            ArrayNode removed = data.putArray("removed");
            if (subscriptionId != null) {
                removed.add(observations.unsubscribe(subscriptionId).subscriptionId());
            } else {
                String target = Payloads.requireText(ctx.data(), "target");
                for (ObservationSubscription sub : observations.unsubscribe(observer(ctx), target)) {
                    removed.add(sub.subscriptionId());
                }
            }
            data.put("count", removed.size());
            return HandlerResult.respond(data);
        });
        registry.register("observation:list", ctx -> {
            List<ObservationSubscription> subs = observations.list(
                    Payloads.text(ctx.data(), "observer"),
                    Payloads.text(ctx.data(), "target"));
            ObjectNode data = Jsons.object();
            ArrayNode items = data.putArray("subscriptions");
            subs.forEach(sub -> items.add(Jsons.wire(sub)));
            data.put("count", items.size());
            return HandlerResult.respond(data);
        });
        registry.register("observation:query_history", ctx -> {
            ObjectNode request = ctx.data();
            ObservationManager.HistoryResult history = observations.queryHistory(
                    Payloads.text(request, "target"),
                    Payloads.stringList(request, "events"),
                    Payloads.instantMs(request, "since"),
                    Payloads.instantMs(request, "until"),
                    Payloads.intValue(request, "limit", DEFAULT_HISTORY_LIMIT, 1, MAX_LIMIT));
            ObjectNode data = Jsons.object();
            ArrayNode records = data.putArray("records");
            for (Event event : history.events()) {
                records.add(event.toWire());
            }
            data.put("count", history.count());
            data.set("stats", Jsons.valueToTree(history.stats()));
            return HandlerResult.respond(data);
        });
        registry.register("observation:analyze_patterns", ctx -> {
            ObjectNode request = ctx.data();
            PatternAnalyzer.Analysis analysis = analyzer.analyze(
                    Payloads.stringList(request, "events"),
                    Payloads.text(request, "target"),
                    Payloads.text(request, "analysis_type"),
                    Payloads.intValue(request, "limit", PatternAnalyzer.DEFAULT_LIMIT, 1, MAX_LIMIT));
            return HandlerResult.respond(Jsons.wire(analysis));
        });
        registry.register("observation:replay", this::replay);
        registry.register("observation:replay_status", ctx -> {
            String sessionId = Payloads.text(ctx.data(), "session_id");
            if (sessionId != null) {
                return HandlerResult.respond(Jsons.wire(replays.status(sessionId)));
            }
            ObjectNode data = Jsons.object();
            ArrayNode items = data.putArray("sessions");
            replays.list().forEach(session -> items.add(Jsons.wire(session)));
            data.put("active", replays.active());
            return HandlerResult.respond(data);
        });
        registry.register("observation:replay_cancel", ctx ->
                HandlerResult.respond(Jsons.wire(replays.cancel(Payloads.requireText(ctx.data(), "session_id")))));
    }

    private HandlerResult replay(HandlerContext ctx) {
        ObjectNode request = ctx.data();
        ObjectNode filter = Payloads.object(request, "filter");
        ReplayRequest replayRequest = new ReplayRequest(
                Payloads.stringList(request, "events"),
                Payloads.text(filter, "target"),
                Payloads.instantMs(filter, "since"),
                Payloads.instantMs(filter, "until"),
                Payloads.intValue(filter, "limit", 0, 0, MAX_LIMIT),
                Payloads.doubleValue(request, "speed", 1.0d),
                Payloads.boolValue(request, "as_new_events", false),
                ctx.origin()
        );
        ReplaySession session = replays.replay(replayRequest, ctx.sink());
        return HandlerResult.respond(Jsons.wire(session));
    }

    private static String observer(HandlerContext ctx) {
        String observer = Payloads.text(ctx.data(), "observer");
        if (observer == null) {
            observer = ctx.origin();
        }
        if (observer == null) {
            throw new ValidationException("field 'observer' is required");
        }
        return observer;
    }
}
