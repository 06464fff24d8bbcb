package axonsentry.adapter.out.telemetry;

import io.opentelemetry.sdk.trace.data.SpanData;

/**
 * Decides whether a finished span is exported to Sentry.
 */
@FunctionalInterface
public interface SpanFilter {

    /**
     * @param span the finished span
     * @return true if the span should be exported
     */
    boolean shouldExport(SpanData span);
}
