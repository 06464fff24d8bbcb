package axonsentry.core.model.sampling;

import java.util.Locale;

/**
 * How the decisions of several samplers are merged into one.
 */
public enum CombineStrategy {
    /** Every sampler must keep the trace (more restrictive) */
    AND,
    /** Any sampler keeping the trace is sufficient (less restrictive) */
    OR;

    /**
     * Parse a configured strategy name.
     *
     * <p>Matching ignores case and surrounding whitespace.
     *
     * @param value the configured value, e.g. {@code "and"}
     * @return the matching strategy
     * @throws IllegalArgumentException if the value is blank or not a known strategy
     */
    public static CombineStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Combine strategy must not be blank");
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT);
        for (var strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown combine strategy '" + value + "', expected AND or OR");
    }
}
