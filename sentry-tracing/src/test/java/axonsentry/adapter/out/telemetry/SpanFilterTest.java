package axonsentry.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.trace.data.SpanData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import axonsentry.core.config.TracingConfig;

@DisplayName("SpanFilter")
@ExtendWith(MockitoExtension.class)
class SpanFilterTest {

    static SpanData spanOf(String messageType) {
        var span = mock(SpanData.class);
        var attributes = messageType == null
                ? Attributes.empty()
                : Attributes.of(MessageTypeSpanFilter.MESSAGE_TYPE, messageType);
        lenient().when(span.getAttributes()).thenReturn(attributes);
        return span;
    }

    @Nested
    @DisplayName("MessageTypeSpanFilter")
    class MessageType {

        @Mock
        private TracingConfig config;

        private MessageTypeSpanFilter filter;

        @BeforeEach
        void setUp() {
            lenient().when(config.enabled()).thenReturn(true);
            lenient().when(config.traceCommands()).thenReturn(true);
            lenient().when(config.traceEvents()).thenReturn(true);
            lenient().when(config.traceQueries()).thenReturn(true);
            filter = new MessageTypeSpanFilter(config);
        }

        @Test
        @DisplayName("should export nothing when tracing is disabled")
        void shouldRejectAllWhenDisabled() {
            when(config.enabled()).thenReturn(false);

            assertFalse(filter.shouldExport(spanOf(MessageTypeSpanFilter.COMMAND)));
            assertFalse(filter.shouldExport(spanOf(null)));
        }

        @Test
        @DisplayName("should follow the command switch")
        void shouldFollowCommandSwitch() {
            var commandSpan = spanOf(MessageTypeSpanFilter.COMMAND);
            assertTrue(filter.shouldExport(commandSpan));

            when(config.traceCommands()).thenReturn(false);
            assertFalse(filter.shouldExport(commandSpan));
            assertTrue(filter.shouldExport(spanOf(MessageTypeSpanFilter.EVENT)));
        }

        @Test
        @DisplayName("should follow the event switch")
        void shouldFollowEventSwitch() {
            var eventSpan = spanOf(MessageTypeSpanFilter.EVENT);
            assertTrue(filter.shouldExport(eventSpan));

            when(config.traceEvents()).thenReturn(false);
            assertFalse(filter.shouldExport(eventSpan));
            assertTrue(filter.shouldExport(spanOf(MessageTypeSpanFilter.QUERY)));
        }

        @Test
        @DisplayName("should follow the query switch")
        void shouldFollowQuerySwitch() {
            var querySpan = spanOf(MessageTypeSpanFilter.QUERY);
            assertTrue(filter.shouldExport(querySpan));

            when(config.traceQueries()).thenReturn(false);
            assertFalse(filter.shouldExport(querySpan));
            assertTrue(filter.shouldExport(spanOf(MessageTypeSpanFilter.COMMAND)));
        }

        @Test
        @DisplayName("should export unknown message types")
        void shouldExportUnknownTypes() {
            lenient().when(config.traceCommands()).thenReturn(false);

            assertTrue(filter.shouldExport(spanOf("deadline")));
        }

        @Test
        @DisplayName("should export spans without a message type")
        void shouldExportUntypedSpans() {
            assertTrue(filter.shouldExport(spanOf(null)));
        }
    }

    @Nested
    @DisplayName("CompositeSpanFilter")
    class Composite {

        private final SpanData span = spanOf(null);

        @Test
        @DisplayName("should export when all filters pass")
        void shouldExportWhenAllPass() {
            var filter = new CompositeSpanFilter(List.<SpanFilter>of(s -> true, s -> true));

            assertTrue(filter.shouldExport(span));
        }

        @Test
        @DisplayName("should reject when any filter fails")
        void shouldRejectWhenAnyFails() {
            var filter = new CompositeSpanFilter(List.<SpanFilter>of(s -> true, s -> false));

            assertFalse(filter.shouldExport(span));
        }

        @Test
        @DisplayName("should reject when all filters fail")
        void shouldRejectWhenAllFail() {
            var filter = new CompositeSpanFilter(List.<SpanFilter>of(s -> false, s -> false));

            assertFalse(filter.shouldExport(span));
        }

        @Test
        @DisplayName("should export everything when empty")
        void shouldExportWhenEmpty() {
            assertTrue(new CompositeSpanFilter(List.of()).shouldExport(span));
            assertTrue(new CompositeSpanFilter(null).shouldExport(span));
        }

        @Test
        @DisplayName("should stop at the first rejecting filter")
        void shouldShortCircuit() {
            SpanFilter failing = s -> {
                throw new AssertionError("should not be evaluated");
            };
            var filter = new CompositeSpanFilter(List.<SpanFilter>of(s -> false, failing));

            assertFalse(filter.shouldExport(span));
        }
    }
}
