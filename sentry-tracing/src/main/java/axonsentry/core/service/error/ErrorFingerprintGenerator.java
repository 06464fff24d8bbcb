package axonsentry.core.service.error;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.axonframework.commandhandling.CommandExecutionException;
import org.axonframework.eventhandling.EventProcessingException;
import org.axonframework.queryhandling.QueryExecutionException;
import org.jboss.logging.Logger;

/**
 * Generates stable fingerprints used by Sentry to group error reports.
 *
 * <p>A fingerprint is an ordered list of components:
 * <ol>
 *   <li>Exception type (always first)</li>
 *   <li>Axon failure category, e.g. {@code CommandExecution}, and the aggregate type</li>
 *   <li>Normalized message (see {@link MessageNormalizer})</li>
 *   <li>Top stack frame as {@code class.method}</li>
 * </ol>
 * Duplicate components are dropped, keeping the first occurrence.
 *
 * <p>The aggregate identifier never contributes, so one failure across many
 * aggregate instances forms one group. For example, {@code "Account 123 not found"}
 * and {@code "Account 456 not found"} share a fingerprint, while a
 * {@code RuntimeException} and an {@code IllegalArgumentException} with the same
 * message do not.
 *
 * <p>Generation never throws. If inspecting the exception fails, the fingerprint
 * degrades to the exception type alone, and a missing exception yields
 * {@code [Unknown]}.
 */
@ApplicationScoped
public class ErrorFingerprintGenerator {

    private static final Logger LOG = Logger.getLogger(ErrorFingerprintGenerator.class);

    static final String COMMAND_EXECUTION = "CommandExecution";
    static final String EVENT_PROCESSING = "EventProcessing";
    static final String QUERY_EXECUTION = "QueryExecution";
    static final String UNKNOWN = "Unknown";

    /**
     * Generate a fingerprint without aggregate context.
     *
     * @param exception the exception to fingerprint
     * @return the fingerprint components
     */
    public List<String> generateFingerprint(Throwable exception) {
        return generateFingerprint(exception, null, null);
    }

    /**
     * Generate a fingerprint for an exception.
     *
     * @param exception the exception to fingerprint
     * @param aggregateType the aggregate type, if known
     * @param aggregateId the aggregate identifier; accepted for symmetry but never part of the fingerprint
     * @return the fingerprint components, never empty
     */
    public List<String> generateFingerprint(Throwable exception, String aggregateType, String aggregateId) {
        if (exception == null) {
            LOG.warnf("No exception to fingerprint for aggregate type %s", aggregateType);
            return List.of(UNKNOWN);
        }

        try {
            return List.copyOf(new LinkedHashSet<>(components(exception, blankToNull(aggregateType))));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to generate error fingerprint for %s", exception.getClass().getName());
            return List.of(typeName(exception));
        }
    }

    private List<String> components(Throwable exception, String aggregateType) {
        final var components = new ArrayList<String>();

        components.add(typeName(exception));

        final var commandFailure = exception instanceof CommandExecutionException;
        if (commandFailure) {
            components.add(COMMAND_EXECUTION);
            if (aggregateType != null) {
                components.add(aggregateType);
            }
        } else if (exception instanceof EventProcessingException) {
            components.add(EVENT_PROCESSING);
        } else if (exception instanceof QueryExecutionException) {
            components.add(QUERY_EXECUTION);
        }

        if (aggregateType != null && !commandFailure) {
            components.add(aggregateType);
        }

        final var normalized = MessageNormalizer.normalize(exception.getMessage());
        if (!normalized.isEmpty()) {
            components.add(normalized);
        }

        final var stackTrace = exception.getStackTrace();
        if (stackTrace != null && stackTrace.length > 0) {
            final var frame = stackTrace[0];
            components.add(frame.getClassName() + "." + frame.getMethodName());
        }

        return components;
    }

    /**
     * Short type name, falling back to the binary name for anonymous classes.
     */
    private static String typeName(Throwable exception) {
        final var type = exception.getClass();
        final var simpleName = type.getSimpleName();
        return simpleName.isEmpty() ? type.getName() : simpleName;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
