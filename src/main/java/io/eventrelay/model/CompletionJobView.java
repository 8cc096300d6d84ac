package io.eventrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

public record CompletionJobView(
        String requestId,
        CompletionStatus status,
        String origin,
        String sessionId,
        JsonNode params,
        JsonNode result,
        String error,
        long submittedAtMs,
        Long startedAtMs,
        Long completedAtMs
) {
    public Long durationMs() {
        return completedAtMs == null ? null : completedAtMs - submittedAtMs;
    }
}
