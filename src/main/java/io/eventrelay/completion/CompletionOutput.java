package io.eventrelay.completion;

import com.fasterxml.jackson.databind.JsonNode;

public record CompletionOutput(
        boolean success,
        JsonNode result,
        String error
) {
    public static CompletionOutput ok(JsonNode result) {
        return new CompletionOutput(true, result, null);
    }

    public static CompletionOutput fail(String error) {
        return new CompletionOutput(false, null, error);
    }
}
