package com.reflex.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventSerializer")
class EventSerializerTest {

    private final Event event =
            new Event(
                    "e-1",
                    "user.action",
                    "s1",
                    7,
                    Map.of("user_id", "u1", "tags", List.of("a", "b")),
                    Instant.parse("2026-01-02T03:04:05.678Z"));

    @Test
    @DisplayName("document carries every field with an ISO-8601 timestamp")
    void documentCarriesEveryField() {
        Map<String, Object> doc = EventSerializer.toDocument(event);

        assertThat(doc)
                .containsEntry("id", "e-1")
                .containsEntry("type", "user.action")
                .containsEntry("source", "s1")
                .containsEntry("createdAt", "2026-01-02T03:04:05.678Z");
        assertThat(((Number) doc.get("sequence")).longValue()).isEqualTo(7L);
    }

    @Test
    @DisplayName("document converts back to an equal event")
    void documentConvertsBack() {
        assertThat(EventSerializer.fromDocument(EventSerializer.toDocument(event))).isEqualTo(event);
    }

    @Test
    @DisplayName("malformed document is rejected")
    void malformedDocumentIsRejected() {
        Map<String, Object> doc = new LinkedHashMap<>(EventSerializer.toDocument(event));
        doc.put("sequence", 0);

        assertThatThrownBy(() -> EventSerializer.fromDocument(doc))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
    }

    @Test
    @DisplayName("store keys sort numerically within a source")
    void storeKeysSortNumerically() {
        assertThat(EventSerializer.storeKey("s1", 9)).isLessThan(EventSerializer.storeKey("s1", 10));
        assertThat(EventSerializer.storeKey("s1", 1)).isEqualTo("s1:00000000000000000001");
    }

    @Test
    @DisplayName("canonical JSON does not depend on insertion order")
    void canonicalJsonIgnoresInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 1);
        first.put("a", Map.of("y", 2, "x", 3));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", Map.of("x", 3, "y", 2));
        second.put("b", 1);

        assertThat(EventSerializer.toCanonicalJson(first))
                .isEqualTo(EventSerializer.toCanonicalJson(second))
                .isEqualTo("{\"a\":{\"x\":3,\"y\":2},\"b\":1}");
    }
}
