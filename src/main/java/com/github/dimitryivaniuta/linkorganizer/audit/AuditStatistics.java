package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Aggregates over a (possibly time-restricted) slice of the audit log.
 * Map iteration order is meaningful: status codes ascending, methods alphabetical,
 * endpoints by descending count.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditStatistics(
        long totalRequests,
        Map<String, Long> statusCodeCounts,
        Map<String, Long> methodCounts,
        Map<String, Long> topEndpoints,
        double averageResponseTimeMs
) {}
