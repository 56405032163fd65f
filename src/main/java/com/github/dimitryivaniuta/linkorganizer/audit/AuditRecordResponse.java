package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/** API view of an {@link AuditRecord}; absent fields are rendered as explicit nulls. */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditRecordResponse(
        Long id,
        String method,
        String endpoint,
        JsonNode requestData,
        Map<String, String> requestParams,
        Map<String, String> requestHeaders,
        String clientIp,
        String userAgent,
        int statusCode,
        JsonNode responseData,
        String errorMessage,
        String errorType,
        Instant requestTime,
        Instant responseTime,
        Integer durationMs,
        String sessionId,
        Integer userId
) {}
