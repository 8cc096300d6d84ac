package io.eventrelay.plugin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.error.ErrorKind;

public record DispatchOutcome(
        boolean handled,
        int handlerCount,
        int failures,
        ObjectNode response,
        ErrorKind errorKind,
        String error
) {
    public boolean failed() {
        return error != null;
    }
}
