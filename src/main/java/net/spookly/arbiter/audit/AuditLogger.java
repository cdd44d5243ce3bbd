package net.spookly.arbiter.audit;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default audit sink that emits one line per event on the {@code arbiter.audit} logger.
 */
public final class AuditLogger implements AuditSink {
    public static final String LOGGER_NAME = "arbiter.audit";
    public static final AuditLogger INSTANCE = new AuditLogger();

    private static final Logger LOGGER = LoggerFactory.getLogger(LOGGER_NAME);

    private AuditLogger() {
    }

    @Override
    public void log(AuditEvent event) {
        if (event == null || !LOGGER.isInfoEnabled()) {
            return;
        }
        LOGGER.info(render(event));
    }

    static String render(AuditEvent event) {
        StringBuilder builder = new StringBuilder("audit_event");
        append(builder, "name", event.name());
        for (Map.Entry<String, Object> entry : event.fields().entrySet()) {
            append(builder, entry.getKey(), entry.getValue());
        }
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=');
        appendValue(builder, String.valueOf(value));
    }

    /**
     * Values that are empty or contain whitespace, quotes, backslashes or {@code =} are double-quoted with
     * backslash escapes so every line stays one line of {@code key=value} pairs.
     */
    private static void appendValue(StringBuilder builder, String value) {
        if (!needsQuoting(value)) {
            builder.append(value);
            return;
        }
        builder.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    builder.append("\\\"");
                    break;
                case '\\':
                    builder.append("\\\\");
                    break;
                case '\n':
                    builder.append("\\n");
                    break;
                case '\r':
                    builder.append("\\r");
                    break;
                case '\t':
                    builder.append("\\t");
                    break;
                default:
                    builder.append(c);
            }
        }
        builder.append('"');
    }

    private static boolean needsQuoting(String value) {
        if (value.isEmpty()) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '=' || c == '\\') {
                return true;
            }
        }
        return false;
    }
}
