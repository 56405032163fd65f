package com.github.dimitryivaniuta.linkorganizer.audit;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Persists on the calling (request) thread. */
@RequiredArgsConstructor
public class SynchronousAuditRecordSink implements AuditRecordSink {

    private static final Logger log = LoggerFactory.getLogger(SynchronousAuditRecordSink.class);

    private final AuditLogService auditLogService;
    private final AuditMetrics metrics;

    @Override
    public void submit(AuditEntry entry) {
        try {
            auditLogService.log(entry);
            metrics.recordWritten();
        } catch (Exception e) {
            metrics.recordFailed(e);
            log.warn("Audit persistence failed for {} {}, reason={}",
                    entry.method(), entry.endpoint(), e.toString());
        }
    }
}
