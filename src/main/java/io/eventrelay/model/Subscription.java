package io.eventrelay.model;

import java.util.Set;

public record Subscription(
        String subscriberId,
        Set<String> patterns,
        long createdAtMs,
        long updatedAtMs
) {
    public Subscription {
        patterns = Set.copyOf(patterns);
    }
}
