package at.sv.lock.api;

public interface AuditSink {

    /**
     * Records the given event. Callers treat this as fire-and-forget: a failing sink must not abort their work.
     */
    void record(AuditEvent event);
}
