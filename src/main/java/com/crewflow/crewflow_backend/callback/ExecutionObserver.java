package com.crewflow.crewflow_backend.callback;

import com.crewflow.crewflow_backend.model.event.ExecutionEvent;

/**
 * Receives the events of one execution. Calls arrive on a thread owned by the
 * observer's delivery lane, one at a time, in the order the events were raised.
 */
public interface ExecutionObserver {

    String name();

    void onEvent(ExecutionEvent event);

    default void cleanup() {
    }
}
