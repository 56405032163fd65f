package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Derives {@code response_data / error_message / error_type} for a finished response.
 *
 * <ul>
 *   <li>status &lt; 400: nothing is derived</li>
 *   <li>body is a JSON object: it becomes {@code response_data}; its {@code message}
 *       field (or "Unknown error") becomes the error message</li>
 *   <li>anything else: synthetic "HTTP &lt;status&gt;" message, no response data</li>
 * </ul>
 * The error type is always {@value #HTTP_ERROR} for failure statuses. Never throws.
 */
public final class ResponseOutcomeClassifier {

    public static final String HTTP_ERROR = "HTTPError";
    public static final String UNKNOWN_ERROR = "Unknown error";

    private final ObjectMapper mapper;

    public ResponseOutcomeClassifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public record Outcome(JsonNode responseData, String errorMessage, String errorType) {
        static final Outcome NONE = new Outcome(null, null, null);

        public boolean isFailure() {
            return errorType != null;
        }
    }

    public Outcome classify(int statusCode, byte[] body) {
        if (statusCode < 400) {
            return Outcome.NONE;
        }

        JsonNode json = parseObject(body);
        if (json == null) {
            return new Outcome(null, "HTTP " + statusCode, HTTP_ERROR);
        }

        JsonNode message = json.get("message");
        String text = (message == null || message.isNull()) ? UNKNOWN_ERROR : message.asText();
        return new Outcome(json, text, HTTP_ERROR);
    }

    private JsonNode parseObject(byte[] body) {
        if (body == null || body.length == 0) return null;
        try {
            JsonNode node = mapper.readTree(body);
            return (node != null && node.isObject()) ? node : null;
        } catch (IOException e) {
            return null;
        }
    }
}
