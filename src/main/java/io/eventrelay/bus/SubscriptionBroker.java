package io.eventrelay.bus;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.TransportException;
import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventListener;
import io.eventrelay.log.EventPatterns;
import io.eventrelay.model.Event;
import io.eventrelay.model.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pattern subscriptions keyed by subscriber id. Registered as a log listener, so pushes
 * happen on the log's single fan-out thread and every subscriber sees events in
 * sequence order.
 */
public final class SubscriptionBroker implements EventListener {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionBroker.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public SubscriptionBroker(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Subscription subscribe(String subscriberId, Collection<String> patterns, EventSink sink) {
        String id = requireSubscriber(subscriberId);
        if (sink == null) {
            throw new ValidationException("subscription requires a push-capable connection");
        }
        Set<String> validated = EventPatterns.normalize(patterns);
        long nowMs = clock.millis();
        Entry entry = entries.compute(id, (key, current) -> {
            if (current == null) {
                return new Entry(new Subscription(key, validated, nowMs, nowMs), sink);
            }
            Set<String> merged = new LinkedHashSet<>(current.subscription().patterns());
            merged.addAll(validated);
            Subscription updated = new Subscription(key, merged, current.subscription().createdAtMs(), nowMs);
            return new Entry(updated, sink);
        });
        log.debug("Subscriber {} now has patterns {}", id, entry.subscription().patterns());
        return entry.subscription();
    }

    /**
     * Removes the given patterns, or every pattern when none are given. Returns what is
     * left of the subscription, empty when it is gone.
     */
    public Optional<Subscription> unsubscribe(String subscriberId, Collection<String> patterns) {
        String id = requireSubscriber(subscriberId);
        if (patterns == null || patterns.isEmpty()) {
            entries.remove(id);
            return Optional.empty();
        }
        Set<String> toRemove = new LinkedHashSet<>();
        for (String pattern : patterns) {
            toRemove.add(EventPatterns.validate(pattern));
        }
        long nowMs = clock.millis();
        Entry entry = entries.computeIfPresent(id, (key, current) -> {
            Set<String> remaining = new LinkedHashSet<>(current.subscription().patterns());
            remaining.removeAll(toRemove);
            if (remaining.isEmpty()) {
                return null;
            }
            return new Entry(new Subscription(key, remaining, current.subscription().createdAtMs(), nowMs),
                    current.sink());
        });
        return entry == null ? Optional.empty() : Optional.of(entry.subscription());
    }

    public boolean disconnect(String subscriberId) {
        return subscriberId != null && entries.remove(subscriberId) != null;
    }

    /** Drops every subscription bound to the given connection. */
    public int disconnectSink(EventSink sink) {
        int removed = 0;
        for (Map.Entry<String, Entry> item : entries.entrySet()) {
            if (item.getValue().sink() == sink && entries.remove(item.getKey(), item.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public List<Subscription> list() {
        List<Subscription> out = new ArrayList<>();
        for (Entry entry : entries.values()) {
            out.add(entry.subscription());
        }
        out.sort(Comparator.comparing(Subscription::subscriberId));
        return out;
    }

    public Optional<Subscription> find(String subscriberId) {
        Entry entry = subscriberId == null ? null : entries.get(subscriberId);
        return entry == null ? Optional.empty() : Optional.of(entry.subscription());
    }

    public int size() {
        return entries.size();
    }

    public long delivered() {
        return delivered.get();
    }

    public long dropped() {
        return dropped.get();
    }

    @Override
    public void onEvent(Event event) {
        ObjectNode frame = null;
        for (Map.Entry<String, Entry> item : entries.entrySet()) {
            Entry entry = item.getValue();
            if (!EventPatterns.matchesAny(entry.subscription().patterns(), event.name())) {
                continue;
            }
            if (frame == null) {
                frame = event.toWire();
                frame.put("push", true);
            }
            try {
                entry.sink().send(frame.deepCopy());
                delivered.incrementAndGet();
            } catch (TransportException e) {
                dropped.incrementAndGet();
                entries.remove(item.getKey(), entry);
                log.info("Unsubscribed {} after push failure: {}", item.getKey(), e.getMessage());
            }
        }
    }

    private static String requireSubscriber(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new ValidationException("field 'client_id' is required");
        }
        return subscriberId.trim();
    }

    private record Entry(
            Subscription subscription,
            EventSink sink
    ) {
    }
}
