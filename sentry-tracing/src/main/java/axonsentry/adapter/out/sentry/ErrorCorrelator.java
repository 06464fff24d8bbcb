package axonsentry.adapter.out.sentry;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.sentry.HubAdapter;
import io.sentry.IHub;
import io.sentry.SentryEvent;
import org.axonframework.eventhandling.DomainEventMessage;
import org.axonframework.messaging.Message;
import org.jboss.logging.Logger;

import axonsentry.core.service.error.ErrorFingerprintGenerator;

/**
 * Links exceptions to their OpenTelemetry span and reports them to Sentry.
 *
 * <p>For each exception the correlator:
 * <ol>
 *   <li>Records the exception on the span and marks the span as failed</li>
 *   <li>Tags a Sentry event with the span's trace and span IDs</li>
 *   <li>Adds Axon message context via {@link AxonExceptionEnricher}</li>
 *   <li>Sets the grouping fingerprint via {@link ErrorFingerprintGenerator}</li>
 *   <li>Captures the event if Sentry is enabled</li>
 * </ol>
 *
 * <p>Usage from a message handler interceptor:
 * <pre>{@code
 * try {
 *     return chain.proceed();
 * } catch (Exception e) {
 *     errorCorrelator.recordException(span, e, message);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>Correlation never throws: a failure to report must not change how the
 * message itself is handled.
 */
@ApplicationScoped
public class ErrorCorrelator {

    private static final Logger LOG = Logger.getLogger(ErrorCorrelator.class);

    static final String TRACE_ID_TAG = "trace_id";
    static final String SPAN_ID_TAG = "span_id";
    static final String TRACE_SAMPLED_TAG = "trace_sampled";

    private final IHub hub;
    private final AxonExceptionEnricher enricher;
    private final ErrorFingerprintGenerator fingerprintGenerator;

    @Inject
    public ErrorCorrelator(AxonExceptionEnricher enricher, ErrorFingerprintGenerator fingerprintGenerator) {
        this(HubAdapter.getInstance(), enricher, fingerprintGenerator);
    }

    /**
     * Create a correlator that captures through the given hub.
     *
     * @param hub the Sentry hub to capture events with
     * @param enricher the Axon context enricher
     * @param fingerprintGenerator the fingerprint generator
     */
    public ErrorCorrelator(
            IHub hub, AxonExceptionEnricher enricher, ErrorFingerprintGenerator fingerprintGenerator) {
        this.hub = hub;
        this.enricher = enricher;
        this.fingerprintGenerator = fingerprintGenerator;
    }

    /**
     * Record an exception on a span and report it to Sentry.
     *
     * @param span the span the exception occurred in
     * @param exception the exception
     * @param message the Axon message being handled, may be null
     */
    public void recordException(Span span, Throwable exception, Message<?> message) {
        try {
            span.recordException(exception);
            span.setStatus(StatusCode.ERROR, exception.getMessage() != null ? exception.getMessage() : "Error");

            final var event = new SentryEvent(exception);
            addTraceContext(event, span);
            enricher.enrich(event, message);
            event.setFingerprints(fingerprint(exception, message));

            final var traceId = span.getSpanContext().getTraceId();
            if (hub.isEnabled()) {
                final var eventId = hub.captureEvent(event);
                LOG.debugv("Captured exception to Sentry: eventId={0}, traceId={1}", eventId, traceId);
            } else {
                LOG.debugv("Sentry not enabled, skipping event capture for trace {0}", traceId);
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to correlate exception with Sentry", e);
        }
    }

    /**
     * Record an exception that is not tied to a message.
     *
     * @param span the span the exception occurred in
     * @param exception the exception
     */
    public void recordException(Span span, Throwable exception) {
        recordException(span, exception, null);
    }

    private List<String> fingerprint(Throwable exception, Message<?> message) {
        if (message instanceof DomainEventMessage<?> domainEvent) {
            return fingerprintGenerator.generateFingerprint(
                    exception, domainEvent.getType(), domainEvent.getAggregateIdentifier());
        }
        return fingerprintGenerator.generateFingerprint(exception);
    }

    private void addTraceContext(SentryEvent event, Span span) {
        final var spanContext = span.getSpanContext();
        if (spanContext.isValid()) {
            event.setTag(TRACE_ID_TAG, spanContext.getTraceId());
            event.setTag(SPAN_ID_TAG, spanContext.getSpanId());
            event.setTag(TRACE_SAMPLED_TAG, String.valueOf(spanContext.isSampled()));
        }
    }
}
