package com.github.dimitryivaniuta.linkorganizer.audit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class AuditMetrics {

    private final MeterRegistry registry;

    public AuditMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWritten() {
        Counter.builder("link_organizer_audit_written_total")
                .register(registry)
                .increment();
    }

    public void recordDropped(String reason) {
        Counter.builder("link_organizer_audit_dropped_total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordFailed(Throwable cause) {
        Counter.builder("link_organizer_audit_failed_total")
                .tag("exception", cause.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    public void retentionDeleted(int count) {
        Counter.builder("link_organizer_audit_retention_deleted_total")
                .register(registry)
                .increment(count);
    }

    public void queueSize(Collection<?> queue) {
        Gauge.builder("link_organizer_audit_queue_size", queue, Collection::size)
                .register(registry);
    }
}
