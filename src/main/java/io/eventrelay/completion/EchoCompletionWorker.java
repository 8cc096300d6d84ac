package io.eventrelay.completion;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.model.CompletionJobView;
import io.eventrelay.util.Jsons;

import java.time.Instant;

public final class EchoCompletionWorker implements CompletionWorker {
    @Override
    public String id() {
        return "echo";
    }

    @Override
    public CompletionOutput run(CompletionJobView job) {
        ObjectNode output = Jsons.object();
        output.put("worker", "echo");
        output.put("request_id", job.requestId());
        if (job.sessionId() != null) {
            output.put("session_id", job.sessionId());
        }
        output.put("timestamp", Instant.now().toString());
        output.put("response", job.params().path("prompt").asText(""));
        output.set("received", job.params().deepCopy());
        return CompletionOutput.ok(output);
    }
}
