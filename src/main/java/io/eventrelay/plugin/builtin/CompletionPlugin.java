package io.eventrelay.plugin.builtin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.completion.CompletionRegistry;
import io.eventrelay.plugin.EventPlugin;
import io.eventrelay.plugin.HandlerRegistry;
import io.eventrelay.plugin.HandlerResult;
import io.eventrelay.plugin.Payloads;
import io.eventrelay.util.Jsons;

import java.util.Set;

public final class CompletionPlugin implements EventPlugin {
    private final CompletionRegistry completions;

    public CompletionPlugin(CompletionRegistry completions) {
        this.completions = completions;
    }

    @Override
    public String id() {
        return "completion";
    }

    @Override
    public Set<String> notifications() {
        return Set.of(CompletionRegistry.EVENT_QUEUED, CompletionRegistry.EVENT_STARTED, CompletionRegistry.EVENT_RESULT);
    }

    @Override
    public void register(HandlerRegistry registry) {
        registry.register("completion:async", ctx -> {
            CompletionRegistry.SubmitOutcome out = completions.submit(ctx.data(), ctx.origin());
            ObjectNode data = Jsons.object();
            data.put("request_id", out.requestId());
            data.put("status", out.status().wireName());
            if (out.sessionId() != null) {
                data.put("session_id", out.sessionId());
            }
            return HandlerResult.respond(data);
        });
        registry.register("completion:status", ctx -> {
            String requestId = Payloads.text(ctx.data(), "request_id");
            if (requestId != null) {
                return HandlerResult.respond(Jsons.wire(completions.status(requestId)));
            }
            CompletionRegistry.StatusSummary summary = completions.statusSummary();
            ObjectNode data = Jsons.wire(summary);
            data.put("active_count", summary.activeRequestIds().size());
            return HandlerResult.respond(data);
        });
        registry.register("completion:result", ctx -> {
            String requestId = Payloads.requireText(ctx.data(), "request_id");
            return HandlerResult.respond(Jsons.wire(completions.result(requestId)));
        });
        registry.register("completion:session_status", ctx -> {
            String sessionId = Payloads.text(ctx.data(), "session_id");
            String agentId = Payloads.text(ctx.data(), "agent_id");
            CompletionRegistry.SessionStatus status = completions.sessionStatus(sessionId, agentId);
            ObjectNode data = Jsons.wire(status);
            data.put("active", status.activeRequestId() != null);
            return HandlerResult.respond(data);
        });
        registry.register("completion:cancel", ctx -> {
            String requestId = Payloads.requireText(ctx.data(), "request_id");
            String reason = Payloads.text(ctx.data(), "reason");
            return HandlerResult.respond(Jsons.wire(completions.cancel(requestId, reason)));
        });
    }
}
