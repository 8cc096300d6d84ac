package io.eventrelay.completion;

import com.fasterxml.jackson.databind.JsonNode;
import io.eventrelay.model.CompletionStatus;

public record CompletionResult(
        String requestId,
        CompletionStatus status,
        boolean pending,
        JsonNode result,
        String error,
        Long completedAtMs,
        Long durationMs
) {
}
