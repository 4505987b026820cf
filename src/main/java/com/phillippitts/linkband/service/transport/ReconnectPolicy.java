package com.phillippitts.linkband.service.transport;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff with symmetric jitter.
 *
 * <p>delay(n) = min(base * multiplier^(n-1), max) * (1 + jitter * u), where u is uniform in
 * [-1, 1] and n is the 1-based attempt number. The jittered delay never exceeds
 * {@code max * (1 + jitter)} and is never negative.
 */
public final class ReconnectPolicy {

    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitter;
    private final int maxAttempts;
    private final DoubleSupplier random;

    /**
     * @param maxAttempts 0 for unbounded retries
     * @param random source of uniform values in [0, 1)
     */
    public ReconnectPolicy(long baseDelayMs, double multiplier, long maxDelayMs, double jitter,
                           int maxAttempts, DoubleSupplier random) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Require 0 < baseDelayMs <= maxDelayMs, got base="
                    + baseDelayMs + ", max=" + maxDelayMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1], got: " + jitter);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
        }
        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
        this.maxAttempts = maxAttempts;
        this.random = Objects.requireNonNull(random, "random");
    }

    public ReconnectPolicy(long baseDelayMs, double multiplier, long maxDelayMs, double jitter, int maxAttempts) {
        this(baseDelayMs, multiplier, maxDelayMs, jitter, maxAttempts, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Delay before the given attempt, or empty when the attempt budget is spent.
     *
     * @param attempt 1-based attempt number
     */
    public OptionalLong delayMillis(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got: " + attempt);
        }
        if (isExhausted(attempt)) {
            return OptionalLong.empty();
        }
        double capped = Math.min(baseDelayMs * Math.pow(multiplier, attempt - 1), maxDelayMs);
        double u = random.getAsDouble() * 2.0 - 1.0;
        return OptionalLong.of(Math.max(0L, Math.round(capped * (1.0 + jitter * u))));
    }

    /** True when {@code attempt} exceeds the configured budget. */
    public boolean isExhausted(int attempt) {
        return maxAttempts > 0 && attempt > maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
