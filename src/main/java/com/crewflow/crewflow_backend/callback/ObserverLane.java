package com.crewflow.crewflow_backend.callback;

import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded delivery queue in front of one observer.
 */
@Slf4j
class ObserverLane {

    @Getter
    private final ExecutionObserver observer;
    private final ExecutorService executor;

    ObserverLane(String jobId, ExecutionObserver observer) {
        this.observer = observer;
        String threadName = "observer-" + observer.name() + "-" + jobId;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    void offer(ExecutionEvent event) {
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("[CALLBACKS] {} closed, dropping {} #{}", observer.name(), event.type(), event.sequence());
        }
    }

    private void deliver(ExecutionEvent event) {
        try {
            observer.onEvent(event);
        } catch (Exception e) {
            log.warn("[CALLBACKS] Observer {} failed on {} #{} for {}: {}",
                    observer.name(), event.type(), event.sequence(), event.jobId(), e.getMessage());
        }
    }

    /** Stops accepting events and waits for queued ones; false when the wait timed out. */
    boolean drain(long timeoutMillis) {
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor.shutdownNow();
        return false;
    }
}
