package axonsentry.core.model.sampling;

import java.util.concurrent.TimeUnit;

/**
 * Token bucket state for the rate-limiting sampler.
 *
 * <p>Tokens and refill timestamp live in one immutable value so that a single
 * compare-and-swap publishes both. A refill that does not accrue at least one
 * whole token leaves the timestamp where it was, so fractional progress is
 * carried forward instead of being lost.
 *
 * @param tokens the current number of tokens, between 0 and the bucket capacity
 * @param lastRefillNanos monotonic timestamp of the last refill ({@link System#nanoTime()} scale)
 */
public record TokenBucketState(double tokens, long lastRefillNanos) {

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    public TokenBucketState {
        if (tokens < 0.0 || Double.isNaN(tokens)) {
            throw new IllegalArgumentException("tokens must be non-negative, got: " + tokens);
        }
    }

    /**
     * Creates a full bucket.
     *
     * @param capacity the bucket capacity
     * @param nowNanos the current monotonic time
     * @return the initial state
     */
    public static TokenBucketState full(int capacity, long nowNanos) {
        return new TokenBucketState(capacity, nowNanos);
    }

    /**
     * Returns the state after accruing tokens for the time elapsed since the last refill.
     *
     * @param nowNanos the current monotonic time
     * @param tokensPerSecond refill rate
     * @param capacity the maximum number of tokens
     * @return a refilled state, or this state if less than one token has accrued
     */
    public TokenBucketState refill(long nowNanos, int tokensPerSecond, int capacity) {
        // nanoTime may be negative, so compare the difference rather than the values
        final var elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return this;
        }
        final var tokensToAdd = elapsed * (double) tokensPerSecond / NANOS_PER_SECOND;
        if (tokensToAdd < 1.0) {
            return this;
        }
        return new TokenBucketState(Math.min(tokens + tokensToAdd, capacity), nowNanos);
    }

    /**
     * Check whether a whole token is available.
     *
     * @return true if at least one token can be consumed
     */
    public boolean hasToken() {
        return tokens >= 1.0;
    }

    /**
     * Returns a new state after consuming one token.
     *
     * @return the new state with one fewer token
     * @throws IllegalStateException if no whole token is available
     */
    public TokenBucketState consume() {
        if (!hasToken()) {
            throw new IllegalStateException("No tokens available to consume");
        }
        return new TokenBucketState(tokens - 1.0, lastRefillNanos);
    }
}
