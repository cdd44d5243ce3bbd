package net.spookly.arbiter.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class AuditLoggerTest {
    private final Logger logger = (Logger) LoggerFactory.getLogger(AuditLogger.LOGGER_NAME);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void writesOneLinePerEvent() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("action", "block");
        fields.put("matchedBindingId", "ask");
        fields.put("rerouteTarget", null);

        AuditLogger.INSTANCE.log(AuditEvent.of("dispatch_decision", Instant.ofEpochMilli(0), fields));

        assertEquals(1, appender.list.size());
        String line = appender.list.get(0).getFormattedMessage();
        assertEquals("audit_event name=dispatch_decision action=block matchedBindingId=ask"
                + " timestamp=1970-01-01T00:00:00Z", line);
    }

    @Test
    void quotesValuesThatWouldBreakKeyValueParsing() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("details", "Provider call failed: quota exceeded");
        fields.put("path", "/ask");
        fields.put("injected", "ok\naudit_event name=forged");
        fields.put("quoted", "say \"hi\"");
        fields.put("blank", "");
        fields.put("pair", "a=b");

        String line = AuditLogger.render(AuditEvent.of("provider_error", Instant.EPOCH, fields));

        assertEquals("audit_event name=provider_error details=\"Provider call failed: quota exceeded\" path=/ask"
                + " injected=\"ok\\naudit_event name=forged\" quoted=\"say \\\"hi\\\"\" blank=\"\""
                + " pair=\"a=b\" timestamp=1970-01-01T00:00:00Z", line);
        assertFalse(line.contains("\n"));
    }

    @Test
    void eventDropsNullFieldsAndKeepsOrder() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("b", 2);
        fields.put("a", 1);
        fields.put("gone", null);

        AuditEvent event = AuditEvent.of("x", Instant.EPOCH, fields);

        assertEquals("[b, a]", event.fields().keySet().toString());
        assertNull(event.field("gone"));
        assertTrue(AuditLogger.render(event).startsWith("audit_event name=x b=2 a=1"));
    }
}
