package io.eventrelay.observation;

import java.util.List;

public record ReplayRequest(
        List<String> patterns,
        String target,
        Long sinceMs,
        Long untilMs,
        int limit,
        double speed,
        boolean asNewEvents,
        String requesterId
) {
    public ReplayRequest {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
}
