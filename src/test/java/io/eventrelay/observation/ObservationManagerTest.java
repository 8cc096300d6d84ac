package io.eventrelay.observation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.NotFoundException;
import io.eventrelay.log.EventLog;
import io.eventrelay.model.Event;
import io.eventrelay.model.ObservationSubscription;
import io.eventrelay.support.MutableClock;
import io.eventrelay.support.RecordingSink;
import io.eventrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class ObservationManagerTest {
    @Test
    void forwardsMatchingEventsFromTarget() throws Exception {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 100)) {
            ObservationManager observations = new ObservationManager(log);
            log.addListener(observations);
            RecordingSink observerSink = new RecordingSink("conn-obs");
            ObservationSubscription subscription = observations.subscribe("observer-1", "agent-7",
                    List.of("task:*"), observerSink);
            Assertions.assertTrue(subscription.subscriptionId().startsWith("sub_"));

            log.append("task:started", Jsons.object().put("step", 1), "agent-7");
            log.append("chat:message", null, "agent-7");
            log.append("task:started", null, "agent-8");
            Assertions.assertTrue(log.flush(Duration.ofSeconds(5)));

            List<ObjectNode> frames = observerSink.drain();
            Assertions.assertEquals(1, frames.size());
            ObjectNode frame = frames.get(0);
            Assertions.assertEquals("observe:event", frame.get("event").asText());
            Assertions.assertTrue(frame.get("push").asBoolean());
            Assertions.assertEquals(subscription.subscriptionId(), frame.path("data").path("subscription_id").asText());
            Assertions.assertEquals("agent-7", frame.path("data").path("target").asText());
            ObjectNode observed = (ObjectNode) frame.path("data").path("observed");
            Assertions.assertEquals("task:started", observed.get("event").asText());
            Assertions.assertEquals(1, observed.path("data").path("step").asInt());
        }
    }

    @Test
    void unsubscribeByIdOrPair() {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 100)) {
            ObservationManager observations = new ObservationManager(log);
            ObservationSubscription first = observations.subscribe("obs", "t1", List.of(), null);
            observations.subscribe("obs", "t2", List.of("a:*"), null);
            observations.subscribe("obs", "t2", List.of("b:*"), null);
            Assertions.assertEquals(3, observations.size());

            Assertions.assertEquals(first, observations.unsubscribe(first.subscriptionId()));
            Assertions.assertThrows(NotFoundException.class, () -> observations.unsubscribe(first.subscriptionId()));
            Assertions.assertEquals(2, observations.unsubscribe("obs", "t2").size());
            Assertions.assertEquals(0, observations.size());
        }
    }

    @Test
    void terminatedAgentLosesItsSubscriptions() throws Exception {
        try (EventLog log = EventLog.inMemory(Clock.systemUTC(), 100)) {
            ObservationManager observations = new ObservationManager(log);
            log.addListener(observations);
            observations.subscribe("obs-1", "agent-x", List.of(), new RecordingSink("c1"));
            observations.subscribe("agent-x", "agent-y", List.of(), new RecordingSink("c2"));
            observations.subscribe("obs-2", "agent-y", List.of(), new RecordingSink("c3"));

            log.append("agent:terminated", Jsons.object().put("agent_id", "agent-x"), "orchestrator");
            Assertions.assertTrue(log.flush(Duration.ofSeconds(5)));

            List<ObservationSubscription> left = observations.list(null, null);
            Assertions.assertEquals(1, left.size());
            Assertions.assertEquals("obs-2", left.get(0).observerId());
        }
    }

    @Test
    void historyReturnsMostRecentMatches() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        try (EventLog log = EventLog.inMemory(clock, 100)) {
            ObservationManager observations = new ObservationManager(log);
            for (int i = 1; i <= 6; i++) {
                log.append(i % 3 == 0 ? "tool:call" : "task:step", Jsons.object().put("i", i), "agent-1");
                log.append("task:step", null, "agent-2");
                clock.advance(Duration.ofSeconds(1));
            }

            ObservationManager.HistoryResult history = observations.queryHistory("agent-1", List.of(), null, null, 3);
            Assertions.assertEquals(3, history.count());
            Assertions.assertEquals(List.of(4, 5, 6),
                    history.events().stream().map(event -> event.data().get("i").asInt()).toList());
            Assertions.assertEquals(2L, history.stats().get("task:step"));
            Assertions.assertEquals(1L, history.stats().get("tool:call"));

            long since = Instant.parse("2026-03-01T10:00:04Z").toEpochMilli();
            ObservationManager.HistoryResult recent = observations.queryHistory("agent-1", List.of("task:*"),
                    since, null, 100);
            Assertions.assertEquals(List.of(5),
                    recent.events().stream().map(event -> event.data().get("i").asInt()).toList());
            for (Event event : recent.events()) {
                Assertions.assertTrue(event.timestampMs() >= since);
            }
        }
    }
}
