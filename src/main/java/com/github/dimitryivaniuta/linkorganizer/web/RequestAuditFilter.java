package com.github.dimitryivaniuta.linkorganizer.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditEntry;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditRecordSink;
import com.github.dimitryivaniuta.linkorganizer.audit.HeaderSanitizer;
import com.github.dimitryivaniuta.linkorganizer.audit.ResponseOutcomeClassifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Emits exactly one audit entry per request:
 * <ul>
 *   <li>completion path: the chain returned, the buffered body is flushed to the client and
 *       then the entry is built from request metadata plus the classified response</li>
 *   <li>failure path: an exception escaped the chain; the entry is recorded as a 500 with the
 *       exception's message and simple class name, then the exception is rethrown untouched</li>
 * </ul>
 * Nothing that goes wrong while building or submitting the entry reaches the client.
 *
 * <p>Skip-listed paths (static assets, health checks, favicon, robots.txt) are neither
 * wrapped nor recorded. Error and async dispatches are not filtered, so a request is never
 * recorded twice.
 */
public class RequestAuditFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestAuditFilter.class);

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private final AuditRecordSink sink;
    private final ResponseOutcomeClassifier classifier;
    private final HeaderSanitizer sanitizer;
    private final ObjectMapper mapper;
    private final List<String> skipPatterns;

    public RequestAuditFilter(AuditRecordSink sink,
                              ResponseOutcomeClassifier classifier,
                              HeaderSanitizer sanitizer,
                              ObjectMapper mapper,
                              List<String> skipPatterns) {
        this.sink = sink;
        this.classifier = classifier;
        this.sanitizer = sanitizer;
        this.mapper = mapper;
        this.skipPatterns = skipPatterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return isSkipped(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        RequestAuditContext ctx = RequestAuditContext.begin();

        ContentCachingRequestWrapper req = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper res = new ContentCachingResponseWrapper(response);

        try {
            filterChain.doFilter(req, res);
        } catch (IOException | ServletException | RuntimeException ex) {
            recordFailure(ctx, req, ex);
            throw ex;
        }

        int status = res.getStatus();
        byte[] body = res.getContentAsByteArray();
        // client gets its response before any audit work happens
        try {
            res.copyBodyToResponse();
        } finally {
            recordCompletion(ctx, req, status, body);
        }
    }

    private void recordCompletion(RequestAuditContext ctx,
                                  ContentCachingRequestWrapper req,
                                  int status,
                                  byte[] responseBody) {
        try {
            String endpoint = resolveEndpoint(req);
            if (isSkipped(endpoint)) return;

            ResponseOutcomeClassifier.Outcome outcome = classifier.classify(status, responseBody);

            sink.submit(baseEntry(ctx, req, endpoint)
                    .statusCode(status)
                    .responseData(outcome.responseData())
                    .errorMessage(outcome.errorMessage())
                    .errorType(outcome.errorType())
                    .build());
        } catch (Exception auditEx) {
            log.warn("Request audit failed for {} {}, reason={}",
                    req.getMethod(), req.getRequestURI(), auditEx.toString());
        }
    }

    private void recordFailure(RequestAuditContext ctx, ContentCachingRequestWrapper req, Exception ex) {
        try {
            String endpoint = resolveEndpoint(req);
            if (isSkipped(endpoint)) return;

            Throwable cause = rootCause(ex);
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();

            sink.submit(baseEntry(ctx, req, endpoint)
                    .statusCode(HttpServletResponse.SC_INTERNAL_SERVER_ERROR)
                    .errorMessage(message)
                    .errorType(cause.getClass().getSimpleName())
                    .build());
        } catch (Exception auditEx) {
            log.warn("Request audit failed on exception path for {} {}, reason={}",
                    req.getMethod(), req.getRequestURI(), auditEx.toString());
        }
    }

    private AuditEntry.AuditEntryBuilder baseEntry(RequestAuditContext ctx,
                                                   ContentCachingRequestWrapper req,
                                                   String endpoint) {
        String method = req.getMethod();
        return AuditEntry.builder()
                .method(method)
                .endpoint(endpoint)
                .requestData(requestData(method, req))
                .requestParams(queryParams(req.getQueryString()))
                .requestHeaders(sanitizer.sanitize(headers(req)))
                .clientIp(req.getRemoteAddr())
                .userAgent(req.getHeader("User-Agent"))
                .requestTime(ctx.startedAt())
                .responseTime(Instant.now())
                .durationMs(ctx.elapsedMillis());
    }

    boolean isSkipped(String endpoint) {
        if (endpoint == null) return false;
        String lower = endpoint.toLowerCase(Locale.ROOT);
        for (String p : skipPatterns) {
            if (lower.contains(p)) return true;
        }
        return false;
    }

    /** Route template when a handler matched it ({@code /api/links/{linkId}}), else the raw path. */
    static String resolveEndpoint(HttpServletRequest req) {
        Object pattern = req.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern instanceof String p && !p.isBlank() && !p.endsWith("/**")) {
            return p;
        }
        return req.getRequestURI();
    }

    private JsonNode requestData(String method, ContentCachingRequestWrapper req) {
        if (method == null || !BODY_METHODS.contains(method.toUpperCase(Locale.ROOT))) return null;
        if (!isJson(req.getContentType())) return null;

        byte[] body = req.getContentAsByteArray();
        if (body.length == 0) return null;
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            log.debug("Request body declared as JSON but not parseable: {}", e.toString());
            return null;
        }
    }

    private static boolean isJson(String contentType) {
        if (contentType == null || contentType.isBlank()) return false;
        try {
            MediaType mt = MediaType.parseMediaType(contentType);
            return MediaType.APPLICATION_JSON.isCompatibleWith(mt) || mt.getSubtype().endsWith("+json");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** First value per key, decoded; {@code null} when there is no query string. */
    static Map<String, String> queryParams(String queryString) {
        if (queryString == null || queryString.isBlank()) return null;

        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : queryString.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (!key.isEmpty()) {
                params.putIfAbsent(key, value);
            }
        }
        return params.isEmpty() ? null : params;
    }

    private static Map<String, String> headers(HttpServletRequest req) {
        List<String> names = Collections.list(req.getHeaderNames());
        if (names.isEmpty()) return null;

        Map<String, String> out = new LinkedHashMap<>();
        for (String name : names) {
            out.putIfAbsent(name, req.getHeader(name));
        }
        return out;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static Throwable rootCause(Throwable ex) {
        if (ex instanceof ServletException se && se.getRootCause() != null) {
            return se.getRootCause();
        }
        return ex;
    }
}
