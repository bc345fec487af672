package com.example.perfoptimizer.adapter;

/**
 * Marker for the read-only payload an adapter returns from {@link SubsystemAdapter#snapshot()}.
 * Implementations are immutable values.
 */
public interface AdapterSnapshot {
}
