package com.crewflow.crewflow_backend.callback;

import com.crewflow.crewflow_backend.config.ExecutionProperties;
import com.crewflow.crewflow_backend.model.event.ExecutionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Fans execution events out to every registered observer.
 * <p>
 * Each observer gets its own single-threaded lane, so a slow or failing observer
 * neither blocks nor breaks the others, and each one sees the events in raise order.
 */
@Slf4j
@Component
public class CallbackManager {

    private final List<ExecutionObserverFactory> factories;
    private final ExecutionProperties properties;

    public CallbackManager(List<ExecutionObserverFactory> factories, ExecutionProperties properties) {
        this.factories = factories;
        this.properties = properties;
    }

    public ObserverHandles init(String jobId, Map<String, Object> config) {
        Map<String, Object> cfg = config != null ? config : Map.of();
        Collection<?> disabled = cfg.get("disabled_observers") instanceof Collection<?> c ? c : List.of();

        List<ObserverLane> lanes = new ArrayList<>();
        for (ExecutionObserverFactory factory : factories) {
            if (disabled.contains(factory.name())) {
                log.debug("[CALLBACKS] Observer {} disabled for {}", factory.name(), jobId);
                continue;
            }
            try {
                ExecutionObserver observer = factory.init(jobId, cfg);
                if (observer != null) {
                    lanes.add(new ObserverLane(jobId, observer));
                }
            } catch (Exception e) {
                log.warn("[CALLBACKS] Could not initialise observer {} for {}: {}", factory.name(), jobId, e.getMessage());
            }
        }
        ObserverHandles handles = new ObserverHandles(jobId, lanes);
        log.info("[CALLBACKS] {} observer(s) active for {}: {}", lanes.size(), jobId, handles.observerNames());
        return handles;
    }

    /**
     * Stamps the event with the next sequence number of its execution and queues it on every lane.
     * Returns the stamped event.
     */
    public ExecutionEvent dispatch(ObserverHandles handles, ExecutionEvent event) {
        synchronized (handles) {
            ExecutionEvent stamped = event.withSequence(handles.nextSequence());
            if (handles.isClosed()) {
                log.debug("[CALLBACKS] Handles for {} already cleaned up, dropping {}", handles.jobId(), event.type());
                return stamped;
            }
            for (ObserverLane lane : handles.lanes()) {
                lane.offer(stamped);
            }
            return stamped;
        }
    }

    /** Drains every lane within the configured bound, then lets each observer release its resources. */
    public void cleanup(ObserverHandles handles) {
        synchronized (handles) {
            if (!handles.close()) return;
        }
        long timeout = properties.getCallbackDrainTimeoutMs();
        for (ObserverLane lane : handles.lanes()) {
            if (!lane.drain(timeout)) {
                log.warn("[CALLBACKS] Observer {} for {} did not drain within {} ms",
                        lane.getObserver().name(), handles.jobId(), timeout);
            }
            try {
                lane.getObserver().cleanup();
            } catch (Exception e) {
                log.warn("[CALLBACKS] Cleanup of observer {} for {} failed: {}",
                        lane.getObserver().name(), handles.jobId(), e.getMessage());
            }
        }
    }
}
