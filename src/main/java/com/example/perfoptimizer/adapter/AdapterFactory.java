package com.example.perfoptimizer.adapter;

import com.example.perfoptimizer.config.OptimizerConfigurationException;
import com.example.perfoptimizer.config.OptimizerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Builds the HTTP adapters declared under perf-optimizer.adapters.
 */
@Component
@RequiredArgsConstructor
public class AdapterFactory {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SubsystemAdapter<?> create(AdapterName name, OptimizerProperties.AdapterEndpoint endpoint) {
        if (endpoint == null || endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
            throw new OptimizerConfigurationException(
                    "Adapter '" + name.getKey() + "' is enabled but has no base-url configured");
        }
        HttpUrl baseUrl = HttpUrl.parse(endpoint.getBaseUrl());
        if (baseUrl == null) {
            throw new OptimizerConfigurationException(
                    "Adapter '" + name.getKey() + "' has an invalid base-url: " + endpoint.getBaseUrl());
        }
        return build(name, baseUrl, endpoint, name.getSnapshotType());
    }

    private <S extends AdapterSnapshot> SubsystemAdapter<S> build(AdapterName name, HttpUrl baseUrl,
                                                                  OptimizerProperties.AdapterEndpoint endpoint,
                                                                  Class<S> type) {
        return new HttpSubsystemAdapter<>(name, baseUrl, endpoint.getHeaders(), type, httpClient, objectMapper);
    }
}
