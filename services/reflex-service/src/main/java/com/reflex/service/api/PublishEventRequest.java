package com.reflex.service.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/events}.
 *
 * @param type event type
 * @param source producing module
 * @param sequence caller-assigned sequence, only accepted when the mesh runs in {@code CALLER} mode
 * @param payload event fields
 */
public record PublishEventRequest(
        @NotBlank String type,
        @NotBlank String source,
        @Positive Long sequence,
        Map<String, Object> payload) {

    public PublishEventRequest {
        payload = payload == null ? Map.of() : payload;
    }
}
