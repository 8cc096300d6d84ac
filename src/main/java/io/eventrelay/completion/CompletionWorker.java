package io.eventrelay.completion;

import io.eventrelay.model.CompletionJobView;

/**
 * Produces the outcome of one completion job. Called on a completion executor thread;
 * cancellation arrives as a thread interrupt.
 */
public interface CompletionWorker {
    String id();

    CompletionOutput run(CompletionJobView job) throws Exception;
}
