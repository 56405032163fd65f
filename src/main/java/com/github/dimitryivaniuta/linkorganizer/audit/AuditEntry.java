package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Input of {@link AuditLogService#log(AuditEntry)}. {@code method}, {@code endpoint} and a
 * non-zero {@code statusCode} are required; everything else may be null.
 */
@Builder(toBuilder = true)
public record AuditEntry(
        String method,
        String endpoint,
        Integer statusCode,
        JsonNode requestData,
        Map<String, String> requestParams,
        Map<String, String> requestHeaders,
        String clientIp,
        String userAgent,
        JsonNode responseData,
        String errorMessage,
        String errorType,
        String sessionId,
        Integer userId,
        Instant requestTime,
        Instant responseTime,
        Integer durationMs
) {}
