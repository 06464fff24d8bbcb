package axonsentry.adapter.out.telemetry;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.samplers.SamplingResult;

import axonsentry.core.model.sampling.TokenBucketState;

/**
 * Limits the number of kept traces per second with a token bucket.
 *
 * <p>The bucket starts full, holds at most {@code burstCapacity} tokens and refills
 * at {@code tracesPerSecond} tokens per second. Each kept trace consumes one token;
 * traces are dropped while the bucket is empty. The decision is insensitive to the
 * trace ID.
 *
 * <p><b>Concurrency:</b> tokens and the refill timestamp are held in one immutable
 * {@link TokenBucketState} behind an {@link AtomicReference}. Refill and consume are
 * applied together in a compare-and-swap loop, so concurrent callers never lose a
 * refill and never block.
 */
public final class RateLimitingSampler implements TraceSampler {

    private final int tracesPerSecond;
    private final int burstCapacity;
    private final LongSupplier nanoClock;
    private final AtomicReference<TokenBucketState> bucket;

    /**
     * Create a sampler whose burst capacity equals its rate.
     *
     * @param tracesPerSecond maximum number of traces kept per second
     * @throws IllegalArgumentException if the rate is not positive
     */
    public RateLimitingSampler(int tracesPerSecond) {
        this(tracesPerSecond, tracesPerSecond);
    }

    /**
     * Create a sampler with an explicit burst capacity.
     *
     * @param tracesPerSecond maximum number of traces kept per second
     * @param burstCapacity maximum number of tokens in the bucket
     * @throws IllegalArgumentException if either value is not positive
     */
    public RateLimitingSampler(int tracesPerSecond, int burstCapacity) {
        this(tracesPerSecond, burstCapacity, System::nanoTime);
    }

    RateLimitingSampler(int tracesPerSecond, int burstCapacity, LongSupplier nanoClock) {
        if (tracesPerSecond <= 0) {
            throw new IllegalArgumentException("tracesPerSecond must be positive, got: " + tracesPerSecond);
        }
        if (burstCapacity <= 0) {
            throw new IllegalArgumentException("burstCapacity must be positive, got: " + burstCapacity);
        }
        this.tracesPerSecond = tracesPerSecond;
        this.burstCapacity = burstCapacity;
        this.nanoClock = nanoClock;
        this.bucket = new AtomicReference<>(TokenBucketState.full(burstCapacity, nanoClock.getAsLong()));
    }

    @Override
    public SamplingResult shouldSample(
            Context parentContext,
            String traceId,
            String name,
            SpanKind spanKind,
            Attributes attributes,
            List<LinkData> parentLinks) {
        if (tryAcquire()) {
            return SamplingResult.recordAndSample();
        }
        return SamplingResult.drop();
    }

    private boolean tryAcquire() {
        final var now = nanoClock.getAsLong();
        while (true) {
            final var current = bucket.get();
            final var refilled = current.refill(now, tracesPerSecond, burstCapacity);
            final var acquired = refilled.hasToken();
            final var next = acquired ? refilled.consume() : refilled;
            if (next == current || bucket.compareAndSet(current, next)) {
                return acquired;
            }
        }
    }

    /**
     * Returns the tokens currently in the bucket, without refilling.
     *
     * <p>Intended for tests and diagnostics.
     *
     * @return the available tokens
     */
    double availableTokens() {
        return bucket.get().tokens();
    }

    /**
     * Get the configured rate.
     *
     * @return traces per second
     */
    public int tracesPerSecond() {
        return tracesPerSecond;
    }

    /**
     * Get the configured bucket capacity.
     *
     * @return the burst capacity
     */
    public int burstCapacity() {
        return burstCapacity;
    }

    @Override
    public String getDescription() {
        return "RateLimitingSampler{tracesPerSecond=" + tracesPerSecond + ", burstCapacity=" + burstCapacity + "}";
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
