package axonsentry.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.trace.data.SpanData;

import axonsentry.core.config.TracingConfig;

/**
 * Filters spans by the kind of Axon message they handled.
 *
 * <p>Nothing is exported while tracing is disabled. Otherwise command, event and
 * query spans follow their {@link TracingConfig} switch, and spans of any other
 * or no message type are exported.
 */
@ApplicationScoped
public class MessageTypeSpanFilter implements SpanFilter {

    public static final AttributeKey<String> MESSAGE_TYPE = AttributeKey.stringKey("axon.message.type");

    static final String COMMAND = "command";
    static final String EVENT = "event";
    static final String QUERY = "query";

    private final TracingConfig config;

    @Inject
    public MessageTypeSpanFilter(TracingConfig config) {
        this.config = config;
    }

    @Override
    public boolean shouldExport(SpanData span) {
        if (!config.enabled()) {
            return false;
        }

        final var messageType = span.getAttributes().get(MESSAGE_TYPE);
        if (messageType == null) {
            return true;
        }
        return switch (messageType) {
            case COMMAND -> config.traceCommands();
            case EVENT -> config.traceEvents();
            case QUERY -> config.traceQueries();
            default -> true;
        };
    }
}
