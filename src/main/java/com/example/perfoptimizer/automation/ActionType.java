package com.example.perfoptimizer.automation;

import com.example.perfoptimizer.adapter.AdapterName;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Rule action types and the adapter each one is routed to. Alert and incident actions
 * are events, not adapter commands.
 */
public enum ActionType {
    SCALE_UP(AdapterName.LOAD_BALANCER),
    SCALE_DOWN(AdapterName.LOAD_BALANCER),
    RESTART_SERVICE(AdapterName.LOAD_BALANCER),
    CLEAR_CACHE(AdapterName.CACHE),
    OPTIMIZE_DATABASE(AdapterName.DATABASE),
    SEND_ALERT(null),
    CREATE_INCIDENT(null);

    private final AdapterName adapter;

    ActionType(AdapterName adapter) {
        this.adapter = adapter;
    }

    public Optional<AdapterName> getAdapter() {
        return Optional.ofNullable(adapter);
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionType from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
