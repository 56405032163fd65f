package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON boundary of the audit log: serializes captured payloads into text columns
 * (with truncation) and reads them back for the API.
 */
@Component
@RequiredArgsConstructor
public class AuditRecordMapper {

    private static final Logger log = LoggerFactory.getLogger(AuditRecordMapper.class);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public AuditRecordResponse toResponse(AuditRecord r) {
        return new AuditRecordResponse(
                r.getId(),
                r.getMethod(),
                r.getEndpoint(),
                readTree(r.getRequestDataJson()),
                readMap(r.getRequestParamsJson()),
                readMap(r.getRequestHeadersJson()),
                r.getClientIp(),
                r.getUserAgent(),
                r.getStatusCode(),
                readTree(r.getResponseDataJson()),
                r.getErrorMessage(),
                r.getErrorType(),
                r.getRequestTime(),
                r.getResponseTime(),
                r.getDurationMs(),
                r.getSessionId(),
                r.getUserId()
        );
    }

    /**
     * Serializes {@code value}; output longer than {@code maxChars} is replaced by a
     * {@code {"_truncated":true,...}} envelope so the stored text is still valid JSON.
     */
    public String writeJson(Object value, int maxChars) {
        if (value == null) return null;
        return truncateJsonSafe(safeWrite(value), maxChars);
    }

    /** Compact JSON text for a value that is already stored, used by CSV export. */
    public String compact(String storedJson) {
        if (storedJson == null) return null;
        JsonNode node = readTree(storedJson);
        return node == null ? null : safeWrite(node);
    }

    JsonNode readTree(String json) {
        if (json == null) return null;
        try {
            return mapper.readTree(json);
        } catch (Exception e) {
            // legacy or hand-inserted rows: expose the raw text instead of failing the read
            log.debug("Stored audit payload is not valid JSON, returning raw text: {}", e.toString());
            return TextNode.valueOf(json);
        }
    }

    Map<String, String> readMap(String json) {
        if (json == null) return null;
        try {
            return mapper.readValue(json, STRING_MAP);
        } catch (Exception e) {
            log.debug("Stored audit map is not a JSON object of strings: {}", e.toString());
            return null;
        }
    }

    private String safeWrite(Object v) {
        try {
            return mapper.writeValueAsString(v);
        } catch (Exception e) {
            return "\"<json-serialization-error>\"";
        }
    }

    private String truncateJsonSafe(String json, int maxChars) {
        if (json == null) return null;
        if (maxChars <= 0 || json.length() <= maxChars) return json;

        int previewLen = Math.min(maxChars, Math.min(json.length(), 10_000));
        ObjectNode node = mapper.createObjectNode();
        node.put("_truncated", true);
        node.put("_originalLength", json.length());
        node.put("_preview", json.substring(0, previewLen));

        try {
            return mapper.writeValueAsString(node);
        } catch (Exception e) {
            return "\"<truncated>\"";
        }
    }

    static String truncatePlain(String s, int maxChars) {
        if (s == null) return null;
        if (maxChars <= 0 || s.length() <= maxChars) return s;
        return s.substring(0, maxChars);
    }
}
