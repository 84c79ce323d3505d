package com.crewflow.crewflow_backend.callback;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live observers of one execution, as returned by {@link CallbackManager#init}.
 */
public final class ObserverHandles {

    private final String jobId;
    private final List<ObserverLane> lanes;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private long sequence;

    ObserverHandles(String jobId, List<ObserverLane> lanes) {
        this.jobId = jobId;
        this.lanes = List.copyOf(lanes);
    }

    public String jobId() {
        return jobId;
    }

    public List<String> observerNames() {
        return lanes.stream().map(l -> l.getObserver().name()).toList();
    }

    public boolean isClosed() {
        return closed.get();
    }

    List<ObserverLane> lanes() {
        return lanes;
    }

    // Callers hold the handles monitor
    long nextSequence() {
        return ++sequence;
    }

    boolean close() {
        return closed.compareAndSet(false, true);
    }
}
