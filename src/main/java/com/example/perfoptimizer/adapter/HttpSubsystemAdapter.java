package com.example.perfoptimizer.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adapter that talks to a subsystem over HTTP.
 *
 * - GET  {baseUrl}/snapshot  returns the snapshot JSON
 * - POST {baseUrl}/commands  accepts {actionType, target, parameters} and returns {success, detail}
 */
@Slf4j
public class HttpSubsystemAdapter<S extends AdapterSnapshot> implements SubsystemAdapter<S> {

    private static final MediaType JSON = MediaType.get("application/json");

    private final AdapterName name;
    private final HttpUrl baseUrl;
    private final Map<String, String> headers;
    private final Class<S> snapshotType;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpSubsystemAdapter(AdapterName name, HttpUrl baseUrl, Map<String, String> headers,
                                Class<S> snapshotType, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.name = name;
        this.baseUrl = baseUrl;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.snapshotType = snapshotType;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public AdapterName getName() {
        return name;
    }

    @Override
    public S snapshot() throws AdapterException {
        Request request = newRequest("snapshot").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new AdapterException(name, "Snapshot request failed: HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new AdapterException(name, "Snapshot response had no body");
            }
            return objectMapper.readValue(body.string(), snapshotType);
        } catch (IOException e) {
            throw new AdapterException(name, "Snapshot request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public CommandResult command(String actionType, String target, Map<String, Object> parameters) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actionType", actionType);
        payload.put("target", target);
        payload.put("parameters", parameters != null ? parameters : Map.of());

        try {
            String json = objectMapper.writeValueAsString(payload);
            Request request = newRequest("commands").post(RequestBody.create(json, JSON)).build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful()) {
                    return CommandResult.failure(String.format("HTTP %d for %s", response.code(), actionType));
                }
                if (body == null) {
                    return CommandResult.failure("Empty response for " + actionType);
                }
                return objectMapper.readValue(body.string(), CommandResult.class);
            }
        } catch (IOException e) {
            log.error("Command {} on {} adapter failed: {}", actionType, name.getKey(), e.getMessage());
            return CommandResult.failure(e.getMessage());
        }
    }

    private Request.Builder newRequest(String path) {
        Request.Builder builder = new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegment(path).build());
        headers.forEach(builder::header);
        return builder;
    }
}
