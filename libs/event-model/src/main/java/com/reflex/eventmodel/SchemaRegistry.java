package com.reflex.eventmodel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of {@link ValidationSchema}s keyed by event type.
 *
 * <p>Built once from configuration and only read afterwards, so lookups need no locking.
 */
public final class SchemaRegistry {

    private final Map<String, ValidationSchema> schemas;

    private SchemaRegistry(Map<String, ValidationSchema> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the schema for a type, if one is registered. */
    public Optional<ValidationSchema> find(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(schemas.get(type));
    }

    /**
     * Validates a payload against the schema for its type. An unregistered type is itself a
     * violation.
     */
    public ValidationResult validate(String type, Map<String, Object> payload) {
        return find(type)
                .map(schema -> EventValidator.validate(schema, payload))
                .orElseGet(() -> EventValidator.unknownType(type));
    }

    /** Registered event types. */
    public Set<String> types() {
        return schemas.keySet();
    }

    public int size() {
        return schemas.size();
    }

    /** Collects schemas before freezing them into a registry. */
    public static final class Builder {

        private final Map<String, ValidationSchema> schemas = new LinkedHashMap<>();

        private Builder() {}

        /** Adds a schema. Fails if the type is already registered. */
        public Builder register(ValidationSchema schema) {
            if (schema == null) {
                throw new IllegalArgumentException("schema must not be null");
            }
            if (schemas.putIfAbsent(schema.type(), schema) != null) {
                throw new IllegalArgumentException("duplicate schema for type '" + schema.type() + "'");
            }
            return this;
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(schemas);
        }
    }
}
