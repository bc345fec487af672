package com.example.perfoptimizer.adapter;

import com.example.perfoptimizer.config.AppConfig;
import com.example.perfoptimizer.config.OptimizerConfigurationException;
import com.example.perfoptimizer.config.OptimizerProperties;
import com.example.perfoptimizer.support.StubAdapter;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static com.example.perfoptimizer.support.Snapshots.performance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterRegistryTest {

    private final OptimizerProperties properties = new OptimizerProperties();
    private final StubAdapter performanceBean = new StubAdapter(AdapterName.PERFORMANCE, performance(0, 0));
    private AdapterRegistry registry;

    @BeforeEach
    void setUp() {
        AdapterFactory factory = new AdapterFactory(new OkHttpClient(), new AppConfig().objectMapper());
        registry = new AdapterRegistry(factory, List.of(performanceBean));
        OptimizerProperties.AdapterEndpoint cache = new OptimizerProperties.AdapterEndpoint();
        cache.setBaseUrl("http://cache.internal:8080/api");
        properties.getAdapters().put(AdapterName.CACHE, cache);
    }

    @Test
    void beanAdapterWinsOverConfiguredEndpoint() {
        OptimizerProperties.AdapterEndpoint perf = new OptimizerProperties.AdapterEndpoint();
        perf.setBaseUrl("http://perf.internal");
        properties.getAdapters().put(AdapterName.PERFORMANCE, perf);

        registry.registerAll(EnumSet.of(AdapterName.PERFORMANCE, AdapterName.CACHE), properties);

        assertThat(registry.get(AdapterName.PERFORMANCE)).containsSame(performanceBean);
        assertThat(registry.get(AdapterName.CACHE)).get().isInstanceOf(HttpSubsystemAdapter.class);
        assertThat(registry.getAdapterCount()).isEqualTo(2);
    }

    @Test
    void onlyRequiredAdaptersAreRegistered() {
        registry.registerAll(EnumSet.of(AdapterName.CACHE), properties);

        assertThat(registry.isRegistered(AdapterName.CACHE)).isTrue();
        assertThat(registry.isRegistered(AdapterName.PERFORMANCE)).isFalse();
        assertThat(registry.get(AdapterName.DATABASE)).isEmpty();
    }

    @Test
    void failedRegistrationKeepsPreviousSet() {
        registry.registerAll(EnumSet.of(AdapterName.PERFORMANCE), properties);

        assertThatThrownBy(() -> registry.registerAll(EnumSet.of(AdapterName.CACHE, AdapterName.DATABASE), properties))
                .isInstanceOf(OptimizerConfigurationException.class)
                .hasMessageContaining("database");

        assertThat(registry.getAdapters()).containsOnlyKeys(AdapterName.PERFORMANCE);
    }
}
