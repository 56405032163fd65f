package com.github.dimitryivaniuta.linkorganizer.audit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between request threads and a single background writer.
 *
 * <p>Backpressure policy: drop-newest. {@link #submit} never blocks; when the queue is full
 * the entry is discarded and counted, as is any entry submitted after {@link #stop}. Records may be persisted in a different order than
 * requests completed. On shutdown the writer drains what is queued, bounded by
 * {@code shutdownTimeout}.
 */
public class QueueingAuditRecordSink implements AuditRecordSink {

    private static final Logger log = LoggerFactory.getLogger(QueueingAuditRecordSink.class);

    private static final long DROP_LOG_EVERY = 100;

    private final AuditLogService auditLogService;
    private final AuditMetrics metrics;
    private final Duration shutdownTimeout;
    private final BlockingQueue<AuditEntry> queue;
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean running;
    private volatile boolean stopped;
    private Thread writer;

    public QueueingAuditRecordSink(AuditLogService auditLogService,
                                   AuditMetrics metrics,
                                   int capacity,
                                   Duration shutdownTimeout) {
        this.auditLogService = auditLogService;
        this.metrics = metrics;
        this.shutdownTimeout = shutdownTimeout;
        this.queue = new ArrayBlockingQueue<>(capacity);
        metrics.queueSize(queue);
    }

    @PostConstruct
    public void start() {
        running = true;
        writer = new Thread(this::drainLoop, "audit-writer");
        writer.setDaemon(true);
        writer.start();
        log.info("Started audit writer, queueCapacity={}", queue.remainingCapacity() + queue.size());
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        running = false;
        if (writer == null) return;
        try {
            writer.join(shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (writer.isAlive()) {
            writer.interrupt();
            log.warn("Audit writer did not drain in {}, {} entries abandoned", shutdownTimeout, queue.size());
        }
    }

    @Override
    public void submit(AuditEntry entry) {
        if (stopped) {
            // no writer drains the queue after stop
            metrics.recordDropped("shutdown");
            log.warn("Audit writer stopped, dropping entry for {} {}", entry.method(), entry.endpoint());
            return;
        }
        if (queue.offer(entry)) return;

        metrics.recordDropped("queue_full");
        long n = dropped.incrementAndGet();
        if (n % DROP_LOG_EVERY == 1) {
            log.warn("Audit queue full, dropping entries (dropped so far: {})", n);
        }
    }

    public int pending() {
        return queue.size();
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            try {
                AuditEntry entry = queue.poll(200, TimeUnit.MILLISECONDS);
                if (entry != null) {
                    write(entry);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Audit writer stopped");
    }

    private void write(AuditEntry entry) {
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
