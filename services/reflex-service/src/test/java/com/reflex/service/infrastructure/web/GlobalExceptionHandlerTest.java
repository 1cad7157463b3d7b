package com.reflex.service.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.reflex.common.ConnectionException;
import com.reflex.common.EventValidationException;
import com.reflex.common.ViewException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("maps a rejected event to 400 with every violation")
    void handlesEventValidation() {
        ProblemDetail result = handler.handleEventValidation(new EventValidationException(
                "event-mesh", "user.action", List.of("missing field 'user_id'", "missing field 'action'"),
                List.of("user_id", "action"), List.of(), Map.of()));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Invalid Event");
        assertThat(result.getProperties())
                .containsEntry("eventType", "user.action")
                .containsEntry("violations", List.of("missing field 'user_id'", "missing field 'action'"))
                .containsEntry("missingFields", List.of("user_id", "action"))
                .containsEntry("mismatchedFields", List.of())
                .containsEntry("component", "event-mesh")
                .containsEntry("retryable", false);
    }

    @Test
    @DisplayName("maps an unavailable store to 503")
    void handlesConnection() {
        ProblemDetail result = handler.handleConnection(new ConnectionException(
                "connection-supervisor", "timed out waiting for a session", Map.of()));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getDetail()).contains("timed out waiting for a session");
        assertThat(result.getProperties()).containsEntry("component", "connection-supervisor");
    }

    @Test
    @DisplayName("maps an unknown view to 404")
    void handlesUnknownView() {
        ProblemDetail result = handler.handleView(new ViewException(
                ViewException.Kind.UNKNOWN_VIEW, "nope", "no view named 'nope'", Map.of()));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getProperties())
                .containsEntry("view", "nope")
                .containsEntry("kind", "UNKNOWN_VIEW");
    }

    @Test
    @DisplayName("maps other view failures to 409")
    void handlesViewFailure() {
        ProblemDetail result = handler.handleView(new ViewException(
                ViewException.Kind.REBUILD_TIMEOUT, "event-counts", "rebuild timed out", Map.of()));

        assertThat(result.getStatus()).isEqualTo(409);
        assertThat(result.getProperties()).containsEntry("kind", "REBUILD_TIMEOUT");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result =
                handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps generic Exception to 500 without leaking its message")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("something broke");
        assertThat(result.getProperties()).containsKey("timestamp");
    }
}
