package axonsentry.adapter.out.telemetry;

import java.util.List;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.sdk.trace.samplers.SamplingResult;

/**
 * Root span sampler built by {@link SamplingPolicyResolver}.
 *
 * <p>The set of variants is closed: each implementation is a leaf strategy
 * (probability, rate limit, pass-through) or a composition of other variants.
 * Parent-based propagation is applied on top by {@link TraceSamplerProvider}.
 *
 * <p>Implementations must be safe for concurrent use; {@code shouldSample} is
 * called on every span start and never blocks.
 */
public sealed interface TraceSampler extends Sampler
        permits ProbabilitySampler, RateLimitingSampler, CompositeSampler, PassThroughSampler {

    /**
     * Decide on a root span without parent context or links.
     *
     * @param traceId the trace ID
     * @param name the span name
     * @param spanKind the span kind
     * @param attributes the span attributes known at start
     * @return the sampling result
     */
    default SamplingResult shouldSample(String traceId, String name, SpanKind spanKind, Attributes attributes) {
        return shouldSample(Context.root(), traceId, name, spanKind, attributes, List.of());
    }
}
