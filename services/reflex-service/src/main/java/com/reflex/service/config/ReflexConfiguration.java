package com.reflex.service.config;

import com.reflex.eventmodel.SchemaRegistry;
import com.reflex.mesh.EventMesh;
import com.reflex.observability.HealthCheckRegistry;
import com.reflex.observability.MetricFactory;
import com.reflex.observability.SpanHelper;
import com.reflex.store.BackingStoreAdapter;
import com.reflex.store.inmemory.InMemoryBackingStore;
import com.reflex.supervisor.ConnectionSupervisor;
import com.reflex.views.MaterializedViewManager;
import com.reflex.views.ViewDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root: one supervisor per process, injected into the mesh and the view manager.
 *
 * <p>A real store client is plugged in by declaring a {@link BackingStoreAdapter} bean; without one
 * the in-memory store is used.
 */
@Configuration
public class ReflexConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReflexConfiguration.class);

    static final String SERVICE_COMPONENT = "reflex-service";

    @Bean
    @ConditionalOnMissingBean(BackingStoreAdapter.class)
    public BackingStoreAdapter backingStoreAdapter() {
        log.warn("No BackingStoreAdapter bean configured, events are kept in memory only");
        return new InMemoryBackingStore();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry) {
        return new MetricFactory(registry, SERVICE_COMPONENT);
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("com.reflex"));
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public ConnectionSupervisor connectionSupervisor(
            BackingStoreAdapter adapter, ReflexProperties properties, MetricFactory metrics) {
        log.info("Supervising store session for project '{}' with credentials at {}",
                properties.projectIdentifier(), properties.credentialsPath());
        return new ConnectionSupervisor(
                adapter, properties.credentials(), properties.supervisorSettings(), metrics);
    }

    @Bean
    public SchemaRegistry schemaRegistry(ReflexProperties properties) {
        return properties.schemaRegistry();
    }

    @Bean
    public EventMesh eventMesh(
            ConnectionSupervisor supervisor,
            SchemaRegistry schemas,
            ReflexProperties properties,
            MetricFactory metrics,
            SpanHelper spans) {
        return new EventMesh(supervisor, schemas, properties.meshSettings(), metrics, spans);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public MaterializedViewManager materializedViewManager(
            ConnectionSupervisor supervisor,
            EventMesh mesh,
            ReflexProperties properties,
            MetricFactory metrics,
            SpanHelper spans) {
        MaterializedViewManager manager =
                new MaterializedViewManager(supervisor, properties.viewSettings(), metrics, spans);
        for (ViewDefinition view : properties.viewDefinitions()) {
            manager.register(view);
        }
        manager.attach(mesh);
        return manager;
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(ConnectionSupervisor supervisor) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(ConnectionSupervisor.COMPONENT, supervisor.asHealthCheck());
        return registry;
    }
}
