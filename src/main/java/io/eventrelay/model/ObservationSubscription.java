package io.eventrelay.model;

import java.util.List;

public record ObservationSubscription(
        String subscriptionId,
        String observerId,
        String targetId,
        List<String> patterns,
        long createdAtMs
) {
    public ObservationSubscription {
        patterns = List.copyOf(patterns);
    }
}
