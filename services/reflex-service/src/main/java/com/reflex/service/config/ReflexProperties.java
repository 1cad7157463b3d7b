package com.reflex.service.config;

import com.reflex.eventmodel.FieldType;
import com.reflex.eventmodel.SchemaRegistry;
import com.reflex.eventmodel.ValidationSchema;
import com.reflex.mesh.MeshSettings;
import com.reflex.mesh.SequenceMode;
import com.reflex.store.Credentials;
import com.reflex.supervisor.SupervisorSettings;
import com.reflex.views.Folds;
import com.reflex.views.ViewDefinition;
import com.reflex.views.ViewSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the event mesh, bound from the {@code reflex.*} prefix.
 *
 * <p>Spring Boot binds YAML and environment variables to this record at startup and validates it.
 * Missing credentials fail the startup with a clear message instead of a failing first publish.
 *
 * <pre>
 * reflex:
 *   credentials-path: /etc/reflex/service-account.json
 *   project-identifier: reflex-prod
 *   sequence-mode: AUTO
 *   schemas:
 *     "[user.action]":
 *       required-fields: [user_id, action]
 *   views:
 *     event-counts:
 *       topics: ["*"]
 *       fold: count-by-type
 * </pre>
 *
 * <p>Non-positive numbers fall back to the defaults listed below.
 *
 * @param credentialsPath path to the store's service-account file. Required.
 * @param projectIdentifier store project identifier, optional
 * @param maxReconnectAttempts failed reconnects before the supervisor gives up (default 5)
 * @param baseReconnectDelayMs first reconnect delay (default 2000)
 * @param maxReconnectDelayMs reconnect delay ceiling (default 60000)
 * @param healthCheckIntervalMs interval between health probes (default 30000)
 * @param connectTimeoutMs how long a publish waits for a session (default 10000)
 * @param sequenceGapTimeoutMs how long a view waits for a missing sequence (default 30000)
 * @param viewBufferCapacity out-of-order events held per source and view (default 1000)
 * @param rebuildTimeoutMs time budget of a view rebuild (default 60000)
 * @param sequenceMode who assigns sequences (default AUTO)
 * @param schemas validation schema per event type
 * @param views materialized views by name
 */
@ConfigurationProperties(prefix = "reflex")
@Validated
public record ReflexProperties(
        @NotBlank(message = "reflex.credentials-path (or FIREBASE_CREDENTIALS_PATH) must be set")
                String credentialsPath,
        String projectIdentifier,
        int maxReconnectAttempts,
        long baseReconnectDelayMs,
        long maxReconnectDelayMs,
        long healthCheckIntervalMs,
        long connectTimeoutMs,
        long sequenceGapTimeoutMs,
        int viewBufferCapacity,
        long rebuildTimeoutMs,
        SequenceMode sequenceMode,
        Map<String, @Valid SchemaProperties> schemas,
        Map<String, @Valid ViewProperties> views) {

    public ReflexProperties {
        if (maxReconnectAttempts <= 0) {
            maxReconnectAttempts = SupervisorSettings.DEFAULT_MAX_RECONNECT_ATTEMPTS;
        }
        if (baseReconnectDelayMs <= 0) {
            baseReconnectDelayMs = SupervisorSettings.DEFAULT_BASE_RECONNECT_DELAY.toMillis();
        }
        if (maxReconnectDelayMs <= 0) {
            maxReconnectDelayMs = SupervisorSettings.DEFAULT_MAX_RECONNECT_DELAY.toMillis();
        }
        if (healthCheckIntervalMs <= 0) {
            healthCheckIntervalMs = SupervisorSettings.DEFAULT_HEALTH_CHECK_INTERVAL.toMillis();
        }
        if (connectTimeoutMs <= 0) {
            connectTimeoutMs = MeshSettings.DEFAULT_CONNECT_TIMEOUT.toMillis();
        }
        if (sequenceGapTimeoutMs <= 0) {
            sequenceGapTimeoutMs = ViewSettings.DEFAULT_SEQUENCE_GAP_TIMEOUT.toMillis();
        }
        if (viewBufferCapacity <= 0) {
            viewBufferCapacity = ViewSettings.DEFAULT_BUFFER_CAPACITY;
        }
        if (rebuildTimeoutMs <= 0) {
            rebuildTimeoutMs = 60_000;
        }
        if (sequenceMode == null) {
            sequenceMode = SequenceMode.AUTO;
        }
        schemas = schemas == null ? Map.of() : new LinkedHashMap<>(schemas);
        views = views == null ? Map.of() : new LinkedHashMap<>(views);
    }

    /**
     * Validation rules for one event type.
     *
     * @param requiredFields fields that must be present and non-null
     * @param fieldTypes optional type constraint per field
     */
    public record SchemaProperties(List<String> requiredFields, Map<String, FieldType> fieldTypes) {

        public SchemaProperties {
            requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
            fieldTypes = fieldTypes == null ? Map.of() : new LinkedHashMap<>(fieldTypes);
        }
    }

    /**
     * A materialized view declared in configuration.
     *
     * @param schemaVersion state layout version (default 1)
     * @param topics event types folded by the view, {@code "*"} for all
     * @param fold {@code count-by-type} or {@code latest-by}
     * @param keyField key field for {@code latest-by}
     */
    public record ViewProperties(
            int schemaVersion, @NotEmpty List<String> topics, @NotBlank String fold, String keyField) {

        public ViewProperties {
            if (schemaVersion <= 0) {
                schemaVersion = 1;
            }
        }
    }

    public Credentials credentials() {
        return Credentials.fromPath(credentialsPath, projectIdentifier);
    }

    public SupervisorSettings supervisorSettings() {
        return new SupervisorSettings(
                maxReconnectAttempts,
                Duration.ofMillis(baseReconnectDelayMs),
                Duration.ofMillis(maxReconnectDelayMs),
                Duration.ofMillis(healthCheckIntervalMs));
    }

    public MeshSettings meshSettings() {
        return new MeshSettings(Duration.ofMillis(connectTimeoutMs), sequenceMode);
    }

    public ViewSettings viewSettings() {
        return new ViewSettings(Duration.ofMillis(sequenceGapTimeoutMs), viewBufferCapacity);
    }

    public Duration rebuildTimeout() {
        return Duration.ofMillis(rebuildTimeoutMs);
    }

    /** Freezes the configured schemas into a registry. */
    public SchemaRegistry schemaRegistry() {
        SchemaRegistry.Builder builder = SchemaRegistry.builder();
        schemas.forEach((type, schema) ->
                builder.register(new ValidationSchema(type, schema.requiredFields(), schema.fieldTypes())));
        return builder.build();
    }

    /**
     * Resolves the configured views.
     *
     * @throws IllegalArgumentException if a view names an unknown fold
     */
    public List<ViewDefinition> viewDefinitions() {
        List<ViewDefinition> definitions = new ArrayList<>();
        views.forEach((name, view) ->
                definitions.add(new ViewDefinition(
                        name,
                        view.schemaVersion(),
                        new LinkedHashSet<>(view.topics()),
                        Folds.named(view.fold(), view.keyField()))));
        return definitions;
    }
}
