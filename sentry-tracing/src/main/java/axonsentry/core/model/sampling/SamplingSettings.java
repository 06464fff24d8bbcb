package axonsentry.core.model.sampling;

import java.util.Optional;

/**
 * Declarative sampling policy for root spans.
 *
 * <p>When both a probability and a rate limit are set, both samplers are built and
 * merged with {@link #combineStrategy()}. When neither is set, or sampling is
 * disabled, every trace is kept.
 *
 * @param enabled whether this layer filters traces at all
 * @param probability keep-probability between 0.0 and 1.0, if probability sampling is wanted
 * @param tracesPerSecond steady-state limit in traces per second, if rate limiting is wanted
 * @param burstCapacity token bucket capacity; defaults to {@code tracesPerSecond} when absent
 * @param combineStrategy how probability and rate decisions are merged
 */
public record SamplingSettings(
        boolean enabled,
        Optional<Double> probability,
        Optional<Integer> tracesPerSecond,
        Optional<Integer> burstCapacity,
        CombineStrategy combineStrategy) {

    public SamplingSettings {
        if (probability == null) {
            probability = Optional.empty();
        }
        if (tracesPerSecond == null) {
            tracesPerSecond = Optional.empty();
        }
        if (burstCapacity == null) {
            burstCapacity = Optional.empty();
        }
        if (combineStrategy == null) {
            combineStrategy = CombineStrategy.AND;
        }
        probability.ifPresent(p -> {
            if (p.isNaN() || p < 0.0 || p > 1.0) {
                throw new IllegalArgumentException("probability must be between 0.0 and 1.0, got: " + p);
            }
        });
        tracesPerSecond.ifPresent(rate -> {
            if (rate <= 0) {
                throw new IllegalArgumentException("tracesPerSecond must be positive, got: " + rate);
            }
        });
        burstCapacity.ifPresent(burst -> {
            if (burst <= 0) {
                throw new IllegalArgumentException("burstCapacity must be positive, got: " + burst);
            }
        });
    }

    /**
     * Enabled, with no strategy configured: keeps every trace.
     *
     * @return the default settings
     */
    public static SamplingSettings defaults() {
        return new SamplingSettings(true, Optional.empty(), Optional.empty(), Optional.empty(), CombineStrategy.AND);
    }

    /**
     * Sampling switched off at this layer.
     *
     * @return disabled settings
     */
    public static SamplingSettings disabled() {
        return new SamplingSettings(false, Optional.empty(), Optional.empty(), Optional.empty(), CombineStrategy.AND);
    }

    /**
     * Development profile: keep every trace through the probability sampler.
     *
     * @return development settings
     */
    public static SamplingSettings development() {
        return probabilityOnly(1.0);
    }

    /**
     * Production profile: 10% of traces, never more than 100 per second.
     *
     * @return production settings
     */
    public static SamplingSettings production() {
        return new SamplingSettings(true, Optional.of(0.1), Optional.of(100), Optional.empty(), CombineStrategy.AND);
    }

    /**
     * High-traffic profile: 1% of traces, never more than 50 per second.
     *
     * @return high-traffic settings
     */
    public static SamplingSettings highTraffic() {
        return new SamplingSettings(true, Optional.of(0.01), Optional.of(50), Optional.empty(), CombineStrategy.AND);
    }

    /**
     * Probability sampling only.
     *
     * @param probability keep-probability between 0.0 and 1.0
     * @return settings with only a probability
     */
    public static SamplingSettings probabilityOnly(double probability) {
        return new SamplingSettings(
                true, Optional.of(probability), Optional.empty(), Optional.empty(), CombineStrategy.AND);
    }

    /**
     * Rate limiting only.
     *
     * @param tracesPerSecond steady-state limit
     * @return settings with only a rate limit
     */
    public static SamplingSettings rateLimitOnly(int tracesPerSecond) {
        return new SamplingSettings(
                true, Optional.empty(), Optional.of(tracesPerSecond), Optional.empty(), CombineStrategy.AND);
    }

    /**
     * Check whether any sampling strategy is in effect.
     *
     * @return true if enabled and a probability or rate limit is set
     */
    public boolean hasSamplingStrategy() {
        return enabled && (probability.isPresent() || tracesPerSecond.isPresent());
    }

    /**
     * Resolve the bucket capacity for the rate limiter.
     *
     * @return the configured burst capacity, or the rate itself when unset
     * @throws IllegalStateException if no rate limit is configured
     */
    public int effectiveBurstCapacity() {
        final var rate = tracesPerSecond.orElseThrow(
                () -> new IllegalStateException("No tracesPerSecond configured"));
        return burstCapacity.orElse(rate);
    }
}
