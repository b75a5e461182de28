package com.docview.gate;

import java.util.concurrent.CompletionStage;

/**
 * A unit of work run by a {@link TaskGate}. The gate calls {@link #start()} on its own
 * thread when the task reaches the head of the queue; the task is finished when the
 * returned stage completes.
 */
@FunctionalInterface
public interface AsyncTask {

    CompletionStage<Object> start() throws Exception;
}
