package axonsentry.adapter.out.telemetry;

import java.util.Collection;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.jboss.logging.Logger;

/**
 * Span exporter that drops spans rejected by a {@link SpanFilter} before handing
 * the rest to a delegate.
 */
public final class FilteringSpanExporter implements SpanExporter {

    private static final Logger LOG = Logger.getLogger(FilteringSpanExporter.class);

    private final SpanExporter delegate;
    private final SpanFilter filter;

    public FilteringSpanExporter(SpanExporter delegate, SpanFilter filter) {
        if (delegate == null || filter == null) {
            throw new IllegalArgumentException("Delegate exporter and filter are required");
        }
        this.delegate = delegate;
        this.filter = filter;
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        final var exported = spans.stream().filter(filter::shouldExport).toList();
        if (exported.size() < spans.size()) {
            LOG.debugv("Filtered {0} of {1} spans before export", spans.size() - exported.size(), spans.size());
        }
        if (exported.isEmpty()) {
            return CompletableResultCode.ofSuccess();
        }
        return delegate.export(exported);
    }

    @Override
    public CompletableResultCode flush() {
        return delegate.flush();
    }

    @Override
    public CompletableResultCode shutdown() {
        return delegate.shutdown();
    }
}
