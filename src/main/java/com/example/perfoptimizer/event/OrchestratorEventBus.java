package com.example.perfoptimizer.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Explicit listener registry for orchestrator events.
 *
 * Delivery is asynchronous on the eventExecutor pool; publishers never wait for listeners
 * and a failing listener does not affect the others. Events are dropped when the queue is full.
 */
@Slf4j
@Component
public class OrchestratorEventBus {

    private final Executor eventExecutor;
    private final List<OrchestratorEventListener> listeners = new CopyOnWriteArrayList<>();

    public OrchestratorEventBus(@Qualifier("eventExecutor") Executor eventExecutor,
                                List<OrchestratorEventListener> listeners) {
        this.eventExecutor = eventExecutor;
        this.listeners.addAll(listeners);
        log.info("Event bus initialized with {} listeners", listeners.size());
    }

    public void register(OrchestratorEventListener listener) {
        listeners.add(listener);
    }

    public void unregister(OrchestratorEventListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void publish(OrchestratorEvent event) {
        for (OrchestratorEventListener listener : listeners) {
            if (!listener.supports(event.getType())) {
                continue;
            }
            try {
                eventExecutor.execute(() -> deliver(listener, event));
            } catch (RejectedExecutionException e) {
                log.warn("Dropped {} event for {}: event queue full",
                        event.getType().getValue(), listener.getClass().getSimpleName());
            }
        }
    }

    private void deliver(OrchestratorEventListener listener, OrchestratorEvent event) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            log.error("Event listener {} failed on {}: {}",
                    listener.getClass().getSimpleName(), event.getType().getValue(), e.getMessage());
        }
    }
}
