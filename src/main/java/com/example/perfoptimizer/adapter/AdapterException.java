package com.example.perfoptimizer.adapter;

/**
 * Raised when a subsystem adapter cannot produce a snapshot or reach its subsystem.
 */
public class AdapterException extends Exception {

    private final AdapterName adapter;

    public AdapterException(AdapterName adapter, String message) {
        super(message);
        this.adapter = adapter;
    }

    public AdapterException(AdapterName adapter, String message, Throwable cause) {
        super(message, cause);
        this.adapter = adapter;
    }

    public AdapterName getAdapter() {
        return adapter;
    }
}
