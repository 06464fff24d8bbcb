package axonsentry.adapter.out.telemetry;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import axonsentry.core.config.SamplingConfig;
import axonsentry.core.model.sampling.CombineStrategy;
import axonsentry.core.model.sampling.SamplingSettings;

/**
 * Assembles the root span sampler from declarative settings.
 *
 * <p>Resolution rules:
 * <ol>
 *   <li>Sampling disabled: keep every trace</li>
 *   <li>Probability and rate limit set: both, merged with the combine strategy</li>
 *   <li>Only one set: that sampler alone</li>
 *   <li>Neither set: keep every trace</li>
 * </ol>
 *
 * <p>Invalid values fail here, at startup, rather than on the span path.
 */
@ApplicationScoped
public class SamplingPolicyResolver {

    private static final Logger LOG = Logger.getLogger(SamplingPolicyResolver.class);

    /**
     * Resolve the sampler for a configuration mapping.
     *
     * @param config the sampling configuration
     * @return the sampler to apply to root spans
     * @throws IllegalArgumentException if any configured value is invalid
     */
    public TraceSampler resolve(SamplingConfig config) {
        return resolve(toSettings(config));
    }

    /**
     * Resolve the sampler for the given settings.
     *
     * @param settings the sampling settings
     * @return the sampler to apply to root spans
     */
    public TraceSampler resolve(SamplingSettings settings) {
        final var sampler = build(settings);
        LOG.infov("Resolved trace sampler: {0}", sampler.getDescription());
        return sampler;
    }

    /**
     * Convert a configuration mapping into validated settings.
     *
     * @param config the sampling configuration
     * @return the settings
     * @throws IllegalArgumentException if the combine strategy or any numeric value is invalid
     */
    public static SamplingSettings toSettings(SamplingConfig config) {
        return new SamplingSettings(
                config.enabled(),
                config.probability(),
                config.tracesPerSecond(),
                config.burstCapacity(),
                CombineStrategy.parse(config.combineStrategy()));
    }

    private TraceSampler build(SamplingSettings settings) {
        if (!settings.enabled()) {
            LOG.debug("Sampling disabled, keeping all traces");
            return PassThroughSampler.getInstance();
        }

        final var probability = settings.probability().map(ProbabilitySampler::new);
        final var rateLimit = settings.tracesPerSecond()
                .map(rate -> new RateLimitingSampler(rate, settings.effectiveBurstCapacity()));

        if (probability.isPresent() && rateLimit.isPresent()) {
            return CompositeSampler.of(settings.combineStrategy(), List.of(probability.get(), rateLimit.get()));
        }
        if (probability.isPresent()) {
            return probability.get();
        }
        if (rateLimit.isPresent()) {
            return rateLimit.get();
        }

        LOG.debug("No sampling strategy configured, keeping all traces");
        return PassThroughSampler.getInstance();
    }
}
