package axonsentry.adapter.out.telemetry;

import java.util.List;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.samplers.SamplingResult;

/**
 * Keeps every trace. Used when sampling is disabled or no strategy is configured.
 */
public final class PassThroughSampler implements TraceSampler {

    private static final PassThroughSampler INSTANCE = new PassThroughSampler();

    private PassThroughSampler() {}

    /**
     * Returns the shared instance. The sampler holds no state.
     *
     * @return the pass-through sampler
     */
    public static PassThroughSampler getInstance() {
        return INSTANCE;
    }

    @Override
    public SamplingResult shouldSample(
            Context parentContext,
            String traceId,
            String name,
            SpanKind spanKind,
            Attributes attributes,
            List<LinkData> parentLinks) {
        return SamplingResult.recordAndSample();
    }

    @Override
    public String getDescription() {
        return "PassThroughSampler";
    }
}
