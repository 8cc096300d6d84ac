package io.eventrelay.observation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.error.NotFoundException;
import io.eventrelay.error.TransportException;
import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventListener;
import io.eventrelay.log.EventLog;
import io.eventrelay.log.EventPatterns;
import io.eventrelay.model.Event;
import io.eventrelay.model.ObservationSubscription;
import io.eventrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observer-to-target subscriptions. Any logged event whose origin is an observed target
 * is forwarded to the observer as {@code observe:event}.
 */
public final class ObservationManager implements EventListener {
    private static final Logger log = LoggerFactory.getLogger(ObservationManager.class);

    public static final String EVENT_OBSERVED = "observe:event";
    public static final String EVENT_AGENT_TERMINATED = "agent:terminated";

    private final EventLog eventLog;
    private final Map<String, ObservationSubscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, EventSink> observerSinks = new ConcurrentHashMap<>();

    public ObservationManager(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    public ObservationSubscription subscribe(String observerId, String targetId, Collection<String> patterns,
                                             EventSink sink) {
        String observer = requireId(observerId, "observer");
        String target = requireId(targetId, "target");
        Set<String> validated = EventPatterns.normalize(patterns);
        ObservationSubscription subscription = new ObservationSubscription(
                "sub_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8),
                observer,
                target,
                new ArrayList<>(validated),
                eventLog.clock().millis()
        );
        subscriptions.put(subscription.subscriptionId(), subscription);
        if (sink != null) {
            observerSinks.put(observer, sink);
        }
        log.debug("Observer {} watching {} for {}", observer, target, validated);
        return subscription;
    }

    public ObservationSubscription unsubscribe(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new ValidationException("field 'subscription_id' is required");
        }
        ObservationSubscription removed = subscriptions.remove(subscriptionId.trim());
        if (removed == null) {
            throw new NotFoundException("unknown subscription_id: " + subscriptionId);
        }
        releaseSinkIfIdle(removed.observerId());
        return removed;
    }

    public List<ObservationSubscription> unsubscribe(String observerId, String targetId) {
        String observer = requireId(observerId, "observer");
        String target = requireId(targetId, "target");
        List<ObservationSubscription> removed = new ArrayList<>();
        for (ObservationSubscription subscription : subscriptions.values()) {
            if (subscription.observerId().equals(observer) && subscription.targetId().equals(target)
                    && subscriptions.remove(subscription.subscriptionId(), subscription)) {
                removed.add(subscription);
            }
        }
        releaseSinkIfIdle(observer);
        return removed;
    }

    public List<ObservationSubscription> list(String observerId, String targetId) {
        List<ObservationSubscription> out = new ArrayList<>();
        for (ObservationSubscription subscription : subscriptions.values()) {
            if (observerId != null && !observerId.equals(subscription.observerId())) {
                continue;
            }
            if (targetId != null && !targetId.equals(subscription.targetId())) {
                continue;
            }
            out.add(subscription);
        }
        out.sort(Comparator.comparingLong(ObservationSubscription::createdAtMs)
                .thenComparing(ObservationSubscription::subscriptionId));
        return out;
    }

    /** Removes every subscription where the agent is either the observer or the target. */
    public int removeAgent(String agentId) {
        if (agentId == null) {
            return 0;
        }
        int removed = 0;
        for (ObservationSubscription subscription : subscriptions.values()) {
            if ((agentId.equals(subscription.observerId()) || agentId.equals(subscription.targetId()))
                    && subscriptions.remove(subscription.subscriptionId(), subscription)) {
                removed++;
            }
        }
        observerSinks.remove(agentId);
        if (removed > 0) {
            log.info("Removed {} observation subscriptions for terminated agent {}", removed, agentId);
        }
        return removed;
    }

    public int disconnectSink(EventSink sink) {
        int removed = 0;
        for (Map.Entry<String, EventSink> entry : observerSinks.entrySet()) {
            if (entry.getValue() == sink && observerSinks.remove(entry.getKey(), sink)) {
                removed++;
            }
        }
        return removed;
    }

    public HistoryResult queryHistory(String targetId, Collection<String> patterns, Long sinceMs, Long untilMs,
                                      int limit) {
        Set<String> validated = EventPatterns.normalize(patterns);
        List<Event> events = eventLog.latest(event ->
                        (targetId == null || targetId.equals(event.origin()))
                                && (sinceMs == null || event.timestampMs() >= sinceMs)
                                && (untilMs == null || event.timestampMs() <= untilMs)
                                && EventPatterns.matchesAny(validated, event.name()),
                Math.max(1, limit));
        Map<String, Long> stats = new TreeMap<>();
        for (Event event : events) {
            stats.merge(event.name(), 1L, Long::sum);
        }
        return new HistoryResult(events, events.size(), stats);
    }

    public int size() {
        return subscriptions.size();
    }

    @Override
    public void onEvent(Event event) {
        if (EVENT_AGENT_TERMINATED.equals(event.name())) {
            String agentId = event.dataText("agent_id");
            if (agentId != null) {
                removeAgent(agentId);
            }
        }
        String origin = event.origin();
        if (origin == null || subscriptions.isEmpty()) {
            return;
        }
        for (ObservationSubscription subscription : subscriptions.values()) {
            if (!origin.equals(subscription.targetId())
                    || !EventPatterns.matchesAny(subscription.patterns(), event.name())) {
                continue;
            }
            EventSink sink = observerSinks.get(subscription.observerId());
            if (sink == null) {
                continue;
            }
            try {
                sink.send(notification(subscription, event));
            } catch (TransportException e) {
                observerSinks.remove(subscription.observerId(), sink);
                log.info("Dropped observer channel for {}: {}", subscription.observerId(), e.getMessage());
            }
        }
    }

    private ObjectNode notification(ObservationSubscription subscription, Event event) {
        ObjectNode data = Jsons.object();
        data.put("subscription_id", subscription.subscriptionId());
        data.put("observer", subscription.observerId());
        data.put("target", subscription.targetId());
        data.set("observed", event.toWire());
        ObjectNode frame = Jsons.object();
        frame.put("event", EVENT_OBSERVED);
        frame.put("push", true);
        frame.put("sequence_no", event.sequenceNo());
        frame.put("timestamp", event.timestamp().toString());
        frame.put("origin", event.origin());
        frame.set("data", data);
        return frame;
    }

    private void releaseSinkIfIdle(String observerId) {
        for (ObservationSubscription subscription : subscriptions.values()) {
            if (subscription.observerId().equals(observerId)) {
                return;
            }
        }
        observerSinks.remove(observerId);
    }

    private static String requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("field '" + field + "' is required");
        }
        return value.trim();
    }

    public record HistoryResult(
            List<Event> events,
            int count,
            Map<String, Long> stats
    ) {
    }
}
