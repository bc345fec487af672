package com.example.perfoptimizer.adapter;

import com.example.perfoptimizer.config.AppConfig;
import com.example.perfoptimizer.config.OptimizerConfigurationException;
import com.example.perfoptimizer.config.OptimizerProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpSubsystemAdapterTest {

    private MockWebServer server;
    private ObjectMapper objectMapper;
    private AdapterFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        objectMapper = new AppConfig().objectMapper();
        factory = new AdapterFactory(new OkHttpClient.Builder().readTimeout(2, TimeUnit.SECONDS).build(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void readsSnapshotFromSnapshotEndpoint() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"hitRate": 0.72, "layerHitRates": {"l1": 0.9, "l2": 0.5}, "evictions": 12, "unknownField": true}
                        """));

        SubsystemAdapter<?> adapter = factory.create(AdapterName.CACHE, endpoint(Map.of("X-Api-Key", "secret")));
        AdapterSnapshot snapshot = adapter.snapshot();

        assertThat(snapshot).isInstanceOfSatisfying(CacheSnapshot.class, cache -> {
            assertThat(cache.getHitRate()).isEqualTo(0.72);
            assertThat(cache.getLayerHitRates()).containsEntry("l2", 0.5);
            assertThat(cache.getEvictions()).isEqualTo(12);
        });
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/v1/snapshot");
        assertThat(request.getHeader("X-Api-Key")).isEqualTo("secret");
    }

    @Test
    void explicitNullCollectionsReadAsEmpty() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"slowQueries\": null, \"averageQueryTimeMs\": 42.0}"));
        server.enqueue(new MockResponse().setBody("{\"averageResponseTime\": 310, \"anomalies\": null, \"trends\": null}"));

        AdapterSnapshot database = factory.create(AdapterName.DATABASE, endpoint(Map.of())).snapshot();
        AdapterSnapshot performance = factory.create(AdapterName.PERFORMANCE, endpoint(Map.of())).snapshot();

        assertThat(database).isInstanceOfSatisfying(DatabaseSnapshot.class, db -> {
            assertThat(db.getSlowQueries()).isEmpty();
            assertThat(db.getAverageQueryTimeMs()).isEqualTo(42.0);
        });
        assertThat(performance).isInstanceOfSatisfying(PerformanceSnapshot.class, perf -> {
            assertThat(perf.getAnomalies()).isEmpty();
            assertThat(perf.getTrends()).isEmpty();
        });
    }

    @Test
    void serverErrorBecomesAdapterException() {
        server.enqueue(new MockResponse().setResponseCode(503));

        SubsystemAdapter<?> adapter = factory.create(AdapterName.DATABASE, endpoint(Map.of()));

        assertThatThrownBy(adapter::snapshot)
                .isInstanceOf(AdapterException.class)
                .hasMessageContaining("503")
                .satisfies(e -> assertThat(((AdapterException) e).getAdapter()).isEqualTo(AdapterName.DATABASE));
    }

    @Test
    void malformedBodyBecomesAdapterException() {
        server.enqueue(new MockResponse().setBody("not json"));

        SubsystemAdapter<?> adapter = factory.create(AdapterName.PERFORMANCE, endpoint(Map.of()));

        assertThatThrownBy(adapter::snapshot).isInstanceOf(AdapterException.class);
    }

    @Test
    void postsCommandAndReadsResult() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"success\": true, \"detail\": \"pool resized to 40\"}"));

        SubsystemAdapter<?> adapter = factory.create(AdapterName.DATABASE, endpoint(Map.of()));
        CommandResult result = adapter.command("tune_connection_pool", "database.connection-pool",
                Map.of("priority", "medium"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDetail()).isEqualTo("pool resized to 40");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/v1/commands");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("actionType").asText()).isEqualTo("tune_connection_pool");
        assertThat(body.get("target").asText()).isEqualTo("database.connection-pool");
        assertThat(body.get("parameters").get("priority").asText()).isEqualTo("medium");
    }

    @Test
    void rejectedCommandIsFailureNotException() {
        server.enqueue(new MockResponse().setResponseCode(409));

        CommandResult result = factory.create(AdapterName.LOAD_BALANCER, endpoint(Map.of()))
                .command("scale_up", "api", Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDetail()).contains("409");
    }

    @Test
    void missingOrInvalidBaseUrlIsConfigurationError() {
        OptimizerProperties.AdapterEndpoint invalid = new OptimizerProperties.AdapterEndpoint();
        invalid.setBaseUrl("not a url");

        assertThatThrownBy(() -> factory.create(AdapterName.CACHE, null))
                .isInstanceOf(OptimizerConfigurationException.class)
                .hasMessageContaining("cache");
        assertThatThrownBy(() -> factory.create(AdapterName.CACHE, invalid))
                .isInstanceOf(OptimizerConfigurationException.class)
                .hasMessageContaining("invalid base-url");
    }

    private OptimizerProperties.AdapterEndpoint endpoint(Map<String, String> headers) {
        OptimizerProperties.AdapterEndpoint endpoint = new OptimizerProperties.AdapterEndpoint();
        endpoint.setBaseUrl(server.url("/api/v1").toString());
        endpoint.getHeaders().putAll(headers);
        return endpoint;
    }
}
