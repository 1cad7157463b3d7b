package com.reflex.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for the mesh's own operations.
 *
 * <p>It does not configure the SDK. Without one the no-op tracer is used and spans cost nothing.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** A helper whose spans are discarded. */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("reflex"));
    }

    /**
     * Runs {@code work} inside a new span. Runtime exceptions are recorded on the span and rethrown
     * unchanged.
     *
     * @param spanName name for the span (e.g. "mesh.publish")
     * @param kind span kind
     * @param attributes span attributes
     * @param work the work to execute
     */
    public <T> T inSpan(
            String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** {@link SpanKind#INTERNAL} variant. */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, attributes, work);
    }

    /** Sets an attribute on the span current on this thread, if any. */
    public static void annotate(String key, long value) {
        Span.current().setAttribute(key, value);
    }

    public Tracer tracer() {
        return tracer;
    }
}
