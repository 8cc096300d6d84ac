package io.eventrelay.completion;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One lane per conversation session: at most one job of a session holds the lane, later
 * jobs of the same session wait in arrival order. Jobs of different sessions do not wait
 * on each other.
 */
final class CompletionSessions {
    private final Map<String, Lane> lanes = new HashMap<>();
    private final Map<String, String> agentSessions = new ConcurrentHashMap<>();

    /**
     * Session a new job belongs to. An explicit id wins and becomes the agent's current
     * session; without one, an agent continues the session it used last.
     */
    String resolve(String requestedSessionId, String agentId) {
        if (requestedSessionId != null) {
            if (agentId != null) {
                agentSessions.put(agentId, requestedSessionId);
            }
            return requestedSessionId;
        }
        return agentId == null ? null : agentSessions.get(agentId);
    }

    void remember(String agentId, String sessionId) {
        if (agentId != null && sessionId != null && !sessionId.isBlank()) {
            agentSessions.put(agentId, sessionId);
        }
    }

    String currentSession(String agentId) {
        return agentId == null ? null : agentSessions.get(agentId);
    }

    /** Returns {@code true} when the job takes the lane now, {@code false} when it has to wait. */
    synchronized boolean admit(String sessionId, CompletionJob job) {
        Lane lane = lanes.computeIfAbsent(sessionId, key -> new Lane());
        if (lane.active == null) {
            lane.active = job.requestId();
            return true;
        }
        lane.pending.addLast(job);
        return false;
    }

    /**
     * Gives up whatever {@code requestId} holds in the session. Returns the job that takes
     * the lane next, or {@code null} when nothing is waiting.
     */
    synchronized CompletionJob release(String sessionId, String requestId) {
        Lane lane = lanes.get(sessionId);
        if (lane == null) {
            return null;
        }
        if (!requestId.equals(lane.active)) {
            lane.pending.removeIf(job -> job.requestId().equals(requestId));
            return null;
        }
        CompletionJob next = lane.pending.pollFirst();
        while (next != null && next.status().isTerminal()) {
            next = lane.pending.pollFirst();
        }
        if (next == null) {
            lanes.remove(sessionId);
            return null;
        }
        lane.active = next.requestId();
        return next;
    }

    synchronized LaneStatus status(String sessionId) {
        Lane lane = lanes.get(sessionId);
        if (lane == null) {
            return new LaneStatus(null, List.of());
        }
        List<String> waiting = new ArrayList<>();
        for (CompletionJob job : lane.pending) {
            waiting.add(job.requestId());
        }
        return new LaneStatus(lane.active, waiting);
    }

    synchronized int activeSessions() {
        return lanes.size();
    }

    record LaneStatus(
            String activeRequestId,
            List<String> waitingRequestIds
    ) {
    }

    private static final class Lane {
        private final Deque<CompletionJob> pending = new ArrayDeque<>();
        private String active;
    }
}
