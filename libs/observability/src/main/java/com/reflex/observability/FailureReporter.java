package com.reflex.observability;

import com.reflex.common.ConnectionException;
import com.reflex.common.EventValidationException;
import com.reflex.common.ReflexException;
import com.reflex.common.ViewException;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs failures once, with their structured context, at the boundary where they are surfaced or
 * handled.
 *
 * <p>Context is redacted before logging. Each report also increments {@code reflex.failures},
 * tagged with the originating component and the failure type.
 */
public final class FailureReporter {

    private static final Logger log = LoggerFactory.getLogger(FailureReporter.class);

    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;

    public FailureReporter(MetricFactory metrics) {
        this(metrics, new SensitiveDataRedactor());
    }

    public FailureReporter(MetricFactory metrics, SensitiveDataRedactor redactor) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.metrics = metrics;
        this.redactor = redactor;
    }

    /**
     * Logs a failure that is about to be thrown to a caller or was absorbed by its handler.
     *
     * @param action what was being attempted (e.g. "publish", "rebuild")
     * @param failure the failure, logged with its redacted context
     * @return the same failure, so callers can write {@code throw reporter.report(...)}
     */
    public <E extends ReflexException> E report(String action, E failure) {
        var context = redactor.redact(failure.context());
        if (failure instanceof EventValidationException) {
            log.warn("{} rejected by {}: {} context={}",
                    action, failure.component(), failure.getMessage(), context);
        } else if (failure instanceof ConnectionException) {
            log.warn("{} failed in {}: {} context={}",
                    action, failure.component(), failure.getMessage(), context, failure.getCause());
        } else if (failure instanceof ViewException) {
            log.error("{} failed in {}: {} context={}",
                    action, failure.component(), failure.getMessage(), context, failure.getCause());
        } else {
            log.error("{} failed in {}: {} context={}",
                    action, failure.component(), failure.getMessage(), context, failure);
        }
        countFailure(failure.component(), failure.getClass().getSimpleName());
        return failure;
    }

    /**
     * Logs an unexpected exception thrown by a collaborator the caller isolates itself from, such as a
     * subscriber handler or a state-change listener.
     */
    public void reportIsolated(String component, String action, Throwable failure) {
        if (failure instanceof ReflexException reflex) {
            report(action, reflex);
            return;
        }
        log.error("{} failed in {} and was isolated", action, component, failure);
        countFailure(component, failure.getClass().getSimpleName());
    }

    private void countFailure(String component, String type) {
        Counter counter =
                metrics.counter("reflex.failures", "Failures surfaced or handled",
                        "origin", component, "type", type);
        counter.increment();
    }
}
