package com.github.dimitryivaniuta.linkorganizer.audit;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically deletes audit records older than {@code audit.retention.days}.
 * Runs on {@code audit.retention.cron} (daily at 03:00 by default).
 */
@Component
@RequiredArgsConstructor
public class AuditRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(AuditRetentionJob.class);

    private final AuditLogService service;
    private final AuditProperties props;
    private final AuditMetrics metrics;

    @Scheduled(cron = "${audit.retention.cron:0 0 3 * * *}")
    public void purgeExpired() {
        AuditProperties.Retention retention = props.getRetention();
        if (!retention.isEnabled()) {
            log.debug("Audit retention disabled, skipping");
            return;
        }

        int deleted = service.deleteOlderThan(retention.getDays());
        metrics.retentionDeleted(deleted);
        if (deleted > 0) {
            log.info("Audit retention deleted {} records older than {} days", deleted, retention.getDays());
        }
    }
}
