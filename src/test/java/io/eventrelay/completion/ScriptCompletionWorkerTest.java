package io.eventrelay.completion;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.model.CompletionJobView;
import io.eventrelay.model.CompletionStatus;
import io.eventrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ScriptCompletionWorkerTest {
    @Test
    void jsonOutputIsKeptAsJson() throws Exception {
        ScriptCompletionWorker worker = new ScriptCompletionWorker(List.of("sh", "-c", "cat"), 10_000L);
        ObjectNode params = Jsons.object().put("prompt", "summarize").put("temperature", 0.2);

        CompletionOutput output = worker.run(job("req_json", params));

        Assertions.assertTrue(output.success(), output.error());
        Assertions.assertEquals(params, output.result());
        Assertions.assertEquals("script:sh", worker.id());
    }

    @Test
    void plainOutputIsWrapped() throws Exception {
        ScriptCompletionWorker worker = new ScriptCompletionWorker(
                List.of("sh", "-c", "cat >/dev/null; echo \"reply for $EVENTRELAY_REQUEST_ID\""), 10_000L);

        CompletionOutput output = worker.run(job("req_plain", Jsons.object().put("prompt", "hi")));

        Assertions.assertTrue(output.success(), output.error());
        Assertions.assertEquals("reply for req_plain", output.result().get("response").asText());
    }

    @Test
    void nonZeroExitFails() throws Exception {
        ScriptCompletionWorker worker = new ScriptCompletionWorker(
                List.of("sh", "-c", "cat >/dev/null; echo boom; exit 3"), 10_000L);

        CompletionOutput output = worker.run(job("req_fail", Jsons.object().put("prompt", "hi")));

        Assertions.assertFalse(output.success());
        Assertions.assertTrue(output.error().contains("exit=3"), output.error());
        Assertions.assertTrue(output.error().contains("boom"), output.error());
    }

    @Test
    void emptyCommandIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptCompletionWorker(List.of(), 1_000L));
    }

    private static CompletionJobView job(String requestId, ObjectNode params) {
        return new CompletionJobView(requestId, CompletionStatus.IN_PROGRESS, null, null, params, null, null,
                System.currentTimeMillis(), System.currentTimeMillis(), null);
    }
}
