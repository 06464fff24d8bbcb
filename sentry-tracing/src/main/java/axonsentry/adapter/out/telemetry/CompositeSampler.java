package axonsentry.adapter.out.telemetry;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.samplers.SamplingDecision;
import io.opentelemetry.sdk.trace.samplers.SamplingResult;

import axonsentry.core.model.sampling.CombineStrategy;

/**
 * Combines several samplers with AND or OR semantics.
 *
 * <p>Samplers are evaluated in list order and evaluation stops as soon as the
 * outcome is known:
 * <ul>
 *   <li>{@link CombineStrategy#AND}: the first sampler that does not keep the trace drops it</li>
 *   <li>{@link CombineStrategy#OR}: the first sampler that keeps the trace keeps it</li>
 * </ul>
 *
 * <p><b>Order matters for stateful samplers.</b> A {@link RateLimitingSampler} placed
 * after a probability sampler in an AND chain only spends tokens on traces the
 * probability sampler already kept. In an OR chain it only spends tokens on traces
 * that every earlier sampler dropped.
 *
 * <p>Example: keep 10% of traces, but never more than 100 per second:
 * <pre>{@code
 * CompositeSampler.and(new ProbabilitySampler(0.1), new RateLimitingSampler(100));
 * }</pre>
 */
public final class CompositeSampler implements TraceSampler {

    private final List<TraceSampler> samplers;
    private final CombineStrategy strategy;

    private CompositeSampler(CombineStrategy strategy, List<TraceSampler> samplers) {
        if (strategy == null) {
            throw new IllegalArgumentException("Combine strategy cannot be null");
        }
        if (samplers.isEmpty()) {
            throw new IllegalArgumentException("CompositeSampler requires at least one sampler");
        }
        this.strategy = strategy;
        this.samplers = samplers;
    }

    /**
     * Create a composite with the given strategy.
     *
     * @param strategy how decisions are merged
     * @param samplers samplers in evaluation order (at least one)
     * @return the composite sampler
     * @throws IllegalArgumentException if the list is empty or contains null
     */
    public static CompositeSampler of(CombineStrategy strategy, List<? extends TraceSampler> samplers) {
        if (samplers == null) {
            return new CompositeSampler(strategy, List.of());
        }
        for (var sampler : samplers) {
            if (sampler == null) {
                throw new IllegalArgumentException("CompositeSampler does not accept null samplers");
            }
        }
        return new CompositeSampler(strategy, List.copyOf(samplers));
    }

    /**
     * Create a composite that keeps a trace only if every sampler keeps it.
     *
     * @param samplers samplers in evaluation order (at least one)
     * @return the composite sampler
     */
    public static CompositeSampler and(TraceSampler... samplers) {
        return of(CombineStrategy.AND, samplers == null ? null : Arrays.asList(samplers));
    }

    /**
     * Create a composite that keeps a trace if any sampler keeps it.
     *
     * @param samplers samplers in evaluation order (at least one)
     * @return the composite sampler
     */
    public static CompositeSampler or(TraceSampler... samplers) {
        return of(CombineStrategy.OR, samplers == null ? null : Arrays.asList(samplers));
    }

    @Override
    public SamplingResult shouldSample(
            Context parentContext,
            String traceId,
            String name,
            SpanKind spanKind,
            Attributes attributes,
            List<LinkData> parentLinks) {
        return switch (strategy) {
            case AND -> allKeep(parentContext, traceId, name, spanKind, attributes, parentLinks);
            case OR -> anyKeeps(parentContext, traceId, name, spanKind, attributes, parentLinks);
        };
    }

    private SamplingResult allKeep(
            Context parentContext,
            String traceId,
            String name,
            SpanKind spanKind,
            Attributes attributes,
            List<LinkData> parentLinks) {
        for (var sampler : samplers) {
            final var result = sampler.shouldSample(parentContext, traceId, name, spanKind, attributes, parentLinks);
            if (result.getDecision() != SamplingDecision.RECORD_AND_SAMPLE) {
                return SamplingResult.drop();
            }
        }
        return SamplingResult.recordAndSample();
    }

    private SamplingResult anyKeeps(
            Context parentContext,
            String traceId,
            String name,
            SpanKind spanKind,
            Attributes attributes,
            List<LinkData> parentLinks) {
        for (var sampler : samplers) {
            final var result = sampler.shouldSample(parentContext, traceId, name, spanKind, attributes, parentLinks);
            if (result.getDecision() == SamplingDecision.RECORD_AND_SAMPLE) {
                return SamplingResult.recordAndSample();
            }
        }
        return SamplingResult.drop();
    }

    /**
     * Get the combine strategy.
     *
     * @return the strategy
     */
    public CombineStrategy strategy() {
        return strategy;
    }

    /**
     * Get the child samplers in evaluation order.
     *
     * @return an immutable list of samplers
     */
    public List<TraceSampler> samplers() {
        return samplers;
    }

    @Override
    public String getDescription() {
        final var children = samplers.stream().map(TraceSampler::getDescription).collect(Collectors.joining(", "));
        return "CompositeSampler{strategy=" + strategy + ", samplers=[" + children + "]}";
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
