package at.sv.lock.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to the {@code audit} logger, which can be routed to its own appender.
 */
public final class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("audit");

    @Override
    public void record(AuditEvent event) {
        AUDIT.info("{} {}:{} by {} ({}): {}", event.action(), event.subjectType(), event.subjectId(), event.actor(),
                event.reason(), event.metadata());
    }
}
