package net.spookly.arbiter.audit;

/**
 * Append-only destination for audit events.
 */
@FunctionalInterface
public interface AuditSink {
    AuditSink NOOP = event -> {
    };

    void log(AuditEvent event);
}
