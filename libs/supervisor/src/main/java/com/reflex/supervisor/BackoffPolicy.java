package com.reflex.supervisor;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect backoff with ±20% jitter, capped at a ceiling.
 *
 * <p>{@code delay(n) = min(base * 2^n * (1 + 0.2 * (2r - 1)), ceiling)} with {@code r} uniform in
 * [0, 1). Jitter is applied before the cap, so the sequence of delays never decreases.
 */
public final class BackoffPolicy {

    /** Maximum relative deviation from the nominal delay. */
    public static final double JITTER = 0.2;

    private final Duration base;
    private final Duration ceiling;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration ceiling) {
        this(base, ceiling, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random source of values in [0, 1) */
    public BackoffPolicy(Duration base, Duration ceiling, DoubleSupplier random) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (ceiling == null || ceiling.compareTo(base) < 0) {
            throw new IllegalArgumentException("ceiling must be >= base");
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.base = base;
        this.ceiling = ceiling;
        this.random = random;
    }

    /**
     * Delay before reconnect attempt number {@code attempt} (0-based count of failures so far).
     */
    public Duration delay(int attempt) {
        double factor = 1 + JITTER * (2 * random.getAsDouble() - 1);
        return capped(nominalNanos(attempt) * factor);
    }

    /** Smallest delay {@link #delay(int)} can return for this attempt. */
    public Duration lowerBound(int attempt) {
        return capped(nominalNanos(attempt) * (1 - JITTER));
    }

    /** Largest delay {@link #delay(int)} can return for this attempt. */
    public Duration upperBound(int attempt) {
        return capped(nominalNanos(attempt) * (1 + JITTER));
    }

    public Duration base() {
        return base;
    }

    public Duration ceiling() {
        return ceiling;
    }

    private double nominalNanos(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was " + attempt);
        }
        return base.toNanos() * Math.pow(2, attempt);
    }

    private Duration capped(double nanos) {
        return Duration.ofNanos((long) Math.min(nanos, ceiling.toNanos()));
    }
}
