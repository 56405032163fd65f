package com.github.dimitryivaniuta.linkorganizer.web;

import java.time.Instant;

/**
 * Timing state of one request, created when the request enters the audit filter and passed
 * explicitly to the completion or failure path.
 *
 * @param startNanos monotonic start, used for the duration
 * @param startedAt  wall-clock start, persisted as {@code request_time}
 */
public record RequestAuditContext(long startNanos, Instant startedAt) {

    public static RequestAuditContext begin() {
        return new RequestAuditContext(System.nanoTime(), Instant.now());
    }

    public int elapsedMillis() {
        long ms = (System.nanoTime() - startNanos) / 1_000_000L;
        return (int) Math.max(0L, Math.min(ms, Integer.MAX_VALUE));
    }
}
