package axonsentry.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for root span sampling.
 *
 * <p>Configuration prefix: {@code axon.sentry.tracing.sampling}
 *
 * <p>Two strategies can be configured independently:
 * <ul>
 *   <li>Probability sampling keeps a deterministic share of trace IDs</li>
 *   <li>Rate limiting caps the number of traces per second with a token bucket</li>
 * </ul>
 * When both are set they are merged with {@link #combineStrategy()}. When neither
 * is set every trace is kept.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code AXON_SENTRY_TRACING_SAMPLING_ENABLED} - Enable sampling at this layer</li>
 *   <li>{@code AXON_SENTRY_TRACING_SAMPLING_PROBABILITY} - Keep-probability (0.0 to 1.0)</li>
 *   <li>{@code AXON_SENTRY_TRACING_SAMPLING_TRACES_PER_SECOND} - Rate limit</li>
 *   <li>{@code AXON_SENTRY_TRACING_SAMPLING_BURST_CAPACITY} - Token bucket capacity</li>
 *   <li>{@code AXON_SENTRY_TRACING_SAMPLING_COMBINE_STRATEGY} - {@code AND} or {@code OR}</li>
 * </ul>
 */
@ConfigMapping(prefix = "axon.sentry.tracing.sampling")
public interface SamplingConfig {

    /**
     * Enable sampling.
     *
     * <p>When disabled every trace is kept; whether tracing runs at all is
     * controlled elsewhere.
     *
     * @return true if sampling is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Probability-based sampling rate.
     *
     * @return keep-probability between 0.0 and 1.0, or empty to skip probability sampling
     */
    Optional<Double> probability();

    /**
     * Maximum number of traces kept per second.
     *
     * @return the rate limit, or empty to skip rate limiting
     */
    @WithName("traces-per-second")
    Optional<Integer> tracesPerSecond();

    /**
     * Token bucket capacity, i.e. how many traces a burst may admit at once.
     *
     * @return the burst capacity, or empty to use {@link #tracesPerSecond()}
     */
    @WithName("burst-capacity")
    Optional<Integer> burstCapacity();

    /**
     * How to merge probability and rate-limit decisions.
     *
     * <p>Kept as a string so that an invalid value fails with a message naming it.
     *
     * @return {@code AND} or {@code OR} (default: AND)
     */
    @WithName("combine-strategy")
    @WithDefault("AND")
    String combineStrategy();
}
