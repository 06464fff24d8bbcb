package axonsentry.adapter.out.telemetry;

import java.util.List;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.samplers.SamplingResult;

/**
 * Keeps a fixed share of traces, decided from a hash of the trace ID.
 *
 * <p>The decision depends only on the trace ID and the configured probability,
 * so every service that sees the same trace makes the same decision and traces
 * stay complete across process boundaries.
 *
 * <p>The trace ID is hashed with a polynomial rolling hash (multiplier 31,
 * kept non-negative), reduced modulo 100000 and mapped onto {@code [0, 1)}.
 * The trace is kept if that value is strictly below the probability, so a
 * probability of 0.0 drops everything and 1.0 keeps everything.
 */
public final class ProbabilitySampler implements TraceSampler {

    private static final long HASH_MODULUS = 100_000L;
    private static final long HASH_MULTIPLIER = 31L;
    private static final long NON_NEGATIVE_MASK = 0x7FFF_FFFF_FFFF_FFFFL;

    private final double probability;

    /**
     * Create a new ProbabilitySampler.
     *
     * @param probability keep-probability from 0.0 (keep nothing) to 1.0 (keep everything)
     * @throws IllegalArgumentException if the probability is outside {@code [0.0, 1.0]}
     */
    public ProbabilitySampler(double probability) {
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Probability must be between 0.0 and 1.0, got: " + probability);
        }
        this.probability = probability;
    }

    @Override
    public SamplingResult shouldSample(
            Context parentContext,
            String traceId,
            String name,
            SpanKind spanKind,
            Attributes attributes,
            List<LinkData> parentLinks) {
        if (bucketOf(traceId) < probability) {
            return SamplingResult.recordAndSample();
        }
        return SamplingResult.drop();
    }

    /**
     * Map a trace ID onto {@code [0, 1)}.
     *
     * @param traceId the trace ID
     * @return the position of the trace ID in the sampling range
     */
    static double bucketOf(String traceId) {
        return (hash(traceId) % HASH_MODULUS) / (double) HASH_MODULUS;
    }

    static long hash(String traceId) {
        var hash = 0L;
        for (int i = 0; i < traceId.length(); i++) {
            hash = (hash * HASH_MULTIPLIER + traceId.charAt(i)) & NON_NEGATIVE_MASK;
        }
        return hash;
    }

    /**
     * Get the configured keep-probability.
     *
     * @return the probability
     */
    public double probability() {
        return probability;
    }

    @Override
    public String getDescription() {
        return "ProbabilitySampler{" + probability + "}";
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
