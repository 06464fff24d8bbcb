package axonsentry.adapter.out.telemetry;

import java.util.List;

import io.opentelemetry.sdk.trace.data.SpanData;

/**
 * Exports a span only if every child filter exports it. An empty composite
 * exports everything.
 */
public final class CompositeSpanFilter implements SpanFilter {

    private final List<SpanFilter> filters;

    public CompositeSpanFilter(List<? extends SpanFilter> filters) {
        this.filters = filters == null ? List.of() : List.copyOf(filters);
    }

    @Override
    public boolean shouldExport(SpanData span) {
        for (var filter : filters) {
            if (!filter.shouldExport(span)) {
                return false;
            }
        }
        return true;
    }

    public List<SpanFilter> filters() {
        return filters;
    }
}
