package com.example.perfoptimizer.config;

/**
 * Fatal configuration problem, e.g. an enabled adapter that cannot be constructed.
 */
public class OptimizerConfigurationException extends RuntimeException {

    public OptimizerConfigurationException(String message) {
        super(message);
    }

    public OptimizerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
