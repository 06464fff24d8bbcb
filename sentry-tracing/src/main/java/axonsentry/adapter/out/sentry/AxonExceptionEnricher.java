package axonsentry.adapter.out.sentry;

import java.util.LinkedHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.sentry.SentryEvent;
import org.axonframework.commandhandling.CommandExecutionException;
import org.axonframework.commandhandling.CommandMessage;
import org.axonframework.eventhandling.DomainEventMessage;
import org.axonframework.eventhandling.EventMessage;
import org.axonframework.messaging.Message;
import org.axonframework.queryhandling.QueryMessage;
import org.jboss.logging.Logger;

/**
 * Adds Axon message context to Sentry error events.
 *
 * <p>Tags written for every message:
 * <ul>
 *   <li>{@code axon.message_id} - message identifier</li>
 *   <li>{@code axon.message_name} - payload type</li>
 *   <li>{@code axon.message_type} - {@code command}, {@code event}, {@code query} or {@code message}</li>
 * </ul>
 * Commands, domain events, events and queries add their own tags. Metadata is
 * attached as the {@code axon.metadata} extra.
 *
 * <p>Enrichment is best effort: failures are logged and the event is left as far
 * as it got.
 */
@ApplicationScoped
public class AxonExceptionEnricher {

    private static final Logger LOG = Logger.getLogger(AxonExceptionEnricher.class);

    static final String MESSAGE_ID = "axon.message_id";
    static final String MESSAGE_NAME = "axon.message_name";
    static final String MESSAGE_TYPE = "axon.message_type";
    static final String COMMAND_NAME = "axon.command_name";
    static final String AGGREGATE_TYPE = "axon.aggregate_type";
    static final String AGGREGATE_ID = "axon.aggregate_id";
    static final String SEQUENCE_NUMBER = "axon.sequence_number";
    static final String EVENT_TIMESTAMP = "axon.event_timestamp";
    static final String QUERY_NAME = "axon.query_name";
    static final String QUERY_RESPONSE_TYPE = "axon.query_response_type";
    static final String EXCEPTION_TYPE = "axon.exception_type";
    static final String METADATA = "axon.metadata";

    /**
     * Enrich a Sentry event with the context of the message being handled.
     *
     * @param event the event to enrich
     * @param message the message being handled, may be null
     */
    public void enrich(SentryEvent event, Message<?> message) {
        if (message == null) {
            return;
        }

        try {
            event.setTag(MESSAGE_ID, message.getIdentifier());
            event.setTag(MESSAGE_NAME, message.getPayloadType().getName());

            if (message instanceof CommandMessage<?> command) {
                event.setTag(MESSAGE_TYPE, "command");
                event.setTag(COMMAND_NAME, command.getCommandName());
            } else if (message instanceof DomainEventMessage<?> domainEvent) {
                event.setTag(MESSAGE_TYPE, "event");
                event.setTag(AGGREGATE_TYPE, domainEvent.getType());
                event.setTag(AGGREGATE_ID, domainEvent.getAggregateIdentifier());
                event.setTag(SEQUENCE_NUMBER, String.valueOf(domainEvent.getSequenceNumber()));
                event.setTag(EVENT_TIMESTAMP, domainEvent.getTimestamp().toString());
            } else if (message instanceof EventMessage<?> eventMessage) {
                event.setTag(MESSAGE_TYPE, "event");
                event.setTag(EVENT_TIMESTAMP, eventMessage.getTimestamp().toString());
            } else if (message instanceof QueryMessage<?, ?> query) {
                event.setTag(MESSAGE_TYPE, "query");
                event.setTag(QUERY_NAME, query.getQueryName());
                event.setTag(QUERY_RESPONSE_TYPE, String.valueOf(query.getResponseType()));
            } else {
                event.setTag(MESSAGE_TYPE, "message");
            }

            enrichWithMetadata(event, message);

            if (event.getThrowable() instanceof CommandExecutionException) {
                event.setTag(EXCEPTION_TYPE, "CommandExecutionException");
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to enrich Sentry event with Axon context for message %s", message.getIdentifier());
        }
    }

    private void enrichWithMetadata(SentryEvent event, Message<?> message) {
        final var metaData = message.getMetaData();
        if (metaData.isEmpty()) {
            return;
        }

        final var context = new LinkedHashMap<String, Object>();
        metaData.forEach((key, value) -> {
            if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
                context.put(key, value);
            } else {
                context.put(key, value.toString());
            }
        });
        event.setExtra(METADATA, context);
    }
}
