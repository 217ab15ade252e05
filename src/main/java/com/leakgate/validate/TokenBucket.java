package com.leakgate.validate;

import java.time.Clock;

/**
 * Non-blocking token bucket. Tokens refill continuously at {@code qps} per second up to
 * {@code capacity}; {@link #tryAcquire(double)} either takes the tokens now or fails now.
 */
public class TokenBucket {
    private final double qps;
    private final double capacity;
    private final Clock clock;

    private double tokens;
    private long lastRefillMillis;

    public TokenBucket(double qps, Clock clock) {
        this(qps, Math.max(qps, 1.0), clock);
    }

    public TokenBucket(double qps, double capacity, Clock clock) {
        if (qps <= 0) {
            throw new IllegalArgumentException("qps must be positive: " + qps);
        }
        this.qps = qps;
        this.capacity = capacity;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    public synchronized boolean tryAcquire(double n) {
        long now = clock.millis();
        double elapsedSeconds = Math.max(0L, now - lastRefillMillis) / 1000.0;
        tokens = Math.min(capacity, tokens + elapsedSeconds * qps);
        lastRefillMillis = now;

        if (tokens >= n) {
            tokens -= n;
            return true;
        }
        return false;
    }

    public boolean tryAcquire() {
        return tryAcquire(1.0);
    }

    public synchronized double availableTokens() {
        return tokens;
    }

    public double getQps() {
        return qps;
    }

    public double getCapacity() {
        return capacity;
    }
}
