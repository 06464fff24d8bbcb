package axonsentry.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for which Axon message spans are exported.
 *
 * <p>Configuration prefix: {@code axon.sentry.tracing}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code AXON_SENTRY_TRACING_ENABLED} - Master switch for span export</li>
 *   <li>{@code AXON_SENTRY_TRACING_TRACE_COMMANDS} - Export command spans</li>
 *   <li>{@code AXON_SENTRY_TRACING_TRACE_EVENTS} - Export event spans</li>
 *   <li>{@code AXON_SENTRY_TRACING_TRACE_QUERIES} - Export query spans</li>
 * </ul>
 *
 * @see SamplingConfig
 */
@ConfigMapping(prefix = "axon.sentry.tracing")
public interface TracingConfig {

    /**
     * Master switch. When disabled no span is exported.
     *
     * @return true if tracing is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * @return true if command spans are exported (default: true)
     */
    @WithName("trace-commands")
    @WithDefault("true")
    boolean traceCommands();

    /**
     * @return true if event spans are exported (default: true)
     */
    @WithName("trace-events")
    @WithDefault("true")
    boolean traceEvents();

    /**
     * @return true if query spans are exported (default: true)
     */
    @WithName("trace-queries")
    @WithDefault("true")
    boolean traceQueries();
}
