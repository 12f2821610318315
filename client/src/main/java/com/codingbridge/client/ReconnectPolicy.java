package com.codingbridge.client;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Exponential reconnect backoff: 1s, 2s, 4s, then capped at 8s, plus up to
 * 500 ms of random jitter so many clients do not reconnect in lockstep.
 */
public final class ReconnectPolicy {

    public static final long BASE_DELAY_MILLIS = 1_000;
    public static final int  CAP_EXPONENT      = 3;
    public static final long MAX_JITTER_MILLIS = 500;

    private final LongSupplier jitterMillis;

    public ReconnectPolicy() {
        this(() -> ThreadLocalRandom.current().nextLong(MAX_JITTER_MILLIS));
    }

    /** @param jitterMillis source of jitter in [0, {@value #MAX_JITTER_MILLIS}) */
    public ReconnectPolicy(LongSupplier jitterMillis) {
        this.jitterMillis = jitterMillis;
    }

    /** Delay without jitter for the given 1-based attempt. */
    public long nominalDelayMillis(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), CAP_EXPONENT);
        return BASE_DELAY_MILLIS << exponent;
    }

    public long delayMillis(int attempt) {
        long jitter = Math.floorMod(jitterMillis.getAsLong(), MAX_JITTER_MILLIS);
        return nominalDelayMillis(attempt) + jitter;
    }
}
