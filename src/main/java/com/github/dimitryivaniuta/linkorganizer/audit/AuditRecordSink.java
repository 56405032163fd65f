package com.github.dimitryivaniuta.linkorganizer.audit;

/**
 * Destination of audit entries produced by the request filter.
 *
 * <p>Implementations must never throw: whatever goes wrong while persisting is logged and
 * counted, and the HTTP response that produced the entry is unaffected.
 */
public interface AuditRecordSink {

    void submit(AuditEntry entry);
}
