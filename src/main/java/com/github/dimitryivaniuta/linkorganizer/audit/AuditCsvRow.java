package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One CSV line; JSON columns carry compact JSON text. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
        "id", "method", "endpoint", "status_code", "error_type", "error_message",
        "request_time", "response_time", "duration_ms", "client_ip", "user_agent",
        "request_params", "request_headers", "request_data", "response_data",
        "session_id", "user_id"
})
record AuditCsvRow(
        Long id,
        String method,
        String endpoint,
        int statusCode,
        String errorType,
        String errorMessage,
        String requestTime,
        String responseTime,
        Integer durationMs,
        String clientIp,
        String userAgent,
        String requestParams,
        String requestHeaders,
        String requestData,
        String responseData,
        String sessionId,
        Integer userId
) {}
