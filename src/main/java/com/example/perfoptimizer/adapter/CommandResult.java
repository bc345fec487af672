package com.example.perfoptimizer.adapter;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of an adapter command.
 */
@Value
@Builder
@Jacksonized
public class CommandResult {

    boolean success;
    String detail;

    public static CommandResult success(String detail) {
        return CommandResult.builder().success(true).detail(detail).build();
    }

    public static CommandResult failure(String detail) {
        return CommandResult.builder().success(false).detail(detail).build();
    }
}
