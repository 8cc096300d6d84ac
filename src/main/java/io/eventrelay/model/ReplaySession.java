package io.eventrelay.model;

import java.util.List;

public record ReplaySession(
        String sessionId,
        List<String> patterns,
        String target,
        double speed,
        boolean asNewEvents,
        ReplayStatus status,
        int eventCount,
        int emitted,
        double estimatedDurationSeconds,
        long startedAtMs
) {
    public ReplaySession {
        patterns = List.copyOf(patterns);
    }
}
