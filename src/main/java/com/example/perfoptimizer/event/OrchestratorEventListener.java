package com.example.perfoptimizer.event;

/**
 * Consumer of orchestrator events. Called on the event executor, never on the thread that published.
 */
public interface OrchestratorEventListener {

    void onEvent(OrchestratorEvent event);

    /** Narrow the event types delivered to this listener. */
    default boolean supports(OrchestratorEvent.Type type) {
        return true;
    }
}
