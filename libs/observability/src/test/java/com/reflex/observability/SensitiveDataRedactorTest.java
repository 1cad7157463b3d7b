package com.reflex.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("should redact sensitive keys case-insensitively")
    void shouldRedactSensitiveKeys() {
        var result = redactor.redact(Map.of("Password", "p", "accessToken", "t", "source", "s1"));

        assertThat(result)
                .containsEntry("Password", SensitiveDataRedactor.REDACTED)
                .containsEntry("accessToken", SensitiveDataRedactor.REDACTED)
                .containsEntry("source", "s1");
    }

    @Test
    @DisplayName("should redact inside nested payloads")
    void shouldRedactNested() {
        var result =
                redactor.redact(Map.of("payload", Map.of("user_id", "u1", "private_key_id", "k")));

        @SuppressWarnings("unchecked")
        var payload = (Map<String, Object>) result.get("payload");
        assertThat(payload)
                .containsEntry("user_id", "u1")
                .containsEntry("private_key_id", SensitiveDataRedactor.REDACTED);
    }

    @Test
    @DisplayName("should return an empty map for null input")
    void shouldHandleNull() {
        assertThat(redactor.redact(null)).isEmpty();
        assertThat(redactor.isSensitive(null)).isFalse();
    }

    @Test
    @DisplayName("should accept custom patterns and reject empty ones")
    void shouldAcceptCustomPatterns() {
        var custom = new SensitiveDataRedactor(Set.of("ssn"));

        assertThat(custom.isSensitive("customer_ssn")).isTrue();
        assertThat(custom.isSensitive("password")).isFalse();
        assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
