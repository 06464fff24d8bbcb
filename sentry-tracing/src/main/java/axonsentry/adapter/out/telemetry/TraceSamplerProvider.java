package axonsentry.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.quarkus.arc.DefaultBean;

import axonsentry.core.config.SamplingConfig;

/**
 * CDI producer that provides the configured sampler to the OpenTelemetry SDK.
 *
 * <p>The resolved policy only decides for root spans. It is wrapped with
 * {@code Sampler.parentBased()} so that child spans, including those continuing
 * a trace from another service, follow their parent's decision.
 *
 * <p>Applications can replace the sampler by declaring their own {@link Sampler} bean.
 */
@ApplicationScoped
public class TraceSamplerProvider {

    private final SamplingConfig config;
    private final SamplingPolicyResolver resolver;

    @Inject
    public TraceSamplerProvider(SamplingConfig config, SamplingPolicyResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    /**
     * Produce the sampler bean.
     *
     * @return the parent-based sampler to use for tracing
     * @throws IllegalArgumentException if the sampling configuration is invalid
     */
    @Produces
    @Singleton
    @DefaultBean
    public Sampler sampler() {
        return Sampler.parentBased(resolver.resolve(config));
    }
}
