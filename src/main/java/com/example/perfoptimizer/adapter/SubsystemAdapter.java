package com.example.perfoptimizer.adapter;

import java.util.Map;

/**
 * Capability interface to one external subsystem.
 *
 * Every adapter follows the same contract:
 * - snapshot: read-only view of the subsystem, must not mutate it
 * - command: write path, only invoked by the automated implementer and rule action dispatch
 *
 * Adapters never hold orchestrator state.
 */
public interface SubsystemAdapter<S extends AdapterSnapshot> {

    /**
     * Which subsystem this adapter fronts.
     */
    AdapterName getName();

    /**
     * Read the current state of the subsystem.
     *
     * @throws AdapterException when the subsystem is unreachable or returns garbage
     */
    S snapshot() throws AdapterException;

    /**
     * Issue a command to the subsystem.
     *
     * @param actionType command name, e.g. "warm_cache", "scale_up"
     * @param target     what the command applies to (service, pool, cache region)
     * @param parameters command arguments
     */
    CommandResult command(String actionType, String target, Map<String, Object> parameters);
}
