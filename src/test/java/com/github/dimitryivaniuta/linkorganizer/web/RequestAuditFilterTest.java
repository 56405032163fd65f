package com.github.dimitryivaniuta.linkorganizer.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditEntry;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditRecordSink;
import com.github.dimitryivaniuta.linkorganizer.audit.HeaderSanitizer;
import com.github.dimitryivaniuta.linkorganizer.audit.ResponseOutcomeClassifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RequestAuditFilterTest {

    private AuditRecordSink sink;
    private RequestAuditFilter filter;

    @BeforeEach
    void setUp() {
        ObjectMapper om = new ObjectMapper();
        sink = mock(AuditRecordSink.class);
        filter = new RequestAuditFilter(
                sink,
                new ResponseOutcomeClassifier(om),
                new HeaderSanitizer(List.of("authorization", "cookie", "x-api-key")),
                om,
                List.of("static", "health", "favicon", "robots.txt"));
    }

    @Test
    void recordsExactlyOneEntryForSuccessfulGet() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");
        req.setQueryString("category_id=3&category_id=4&q=hello%20world");
        req.addHeader("User-Agent", "junit");
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, json(200, "{\"success\":true}"));

        AuditEntry e = captureSingle();
        assertThat(e.method()).isEqualTo("GET");
        assertThat(e.endpoint()).isEqualTo("/api/links");
        assertThat(e.statusCode()).isEqualTo(200);
        assertThat(e.requestParams())
                .hasSize(2)
                .containsEntry("category_id", "3")
                .containsEntry("q", "hello world");
        assertThat(e.userAgent()).isEqualTo("junit");
        assertThat(e.clientIp()).isEqualTo("127.0.0.1");
        assertThat(e.requestData()).isNull();
        assertThat(e.responseData()).isNull();
        assertThat(e.errorMessage()).isNull();
        assertThat(e.errorType()).isNull();
        assertThat(e.requestTime()).isNotNull();
        assertThat(e.responseTime()).isAfterOrEqualTo(e.requestTime());
    }

    @Test
    void clientStillReceivesBufferedBody() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/ping");
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, json(200, "{\"message\":\"pong\"}"));

        assertThat(res.getStatus()).isEqualTo(200);
        assertThat(res.getContentAsString()).isEqualTo("{\"message\":\"pong\"}");
    }

    @Test
    void skipListedPathsAreNeitherWrappedNorRecorded() throws Exception {
        for (String uri : List.of("/api/health", "/static/app.js", "/favicon.ico", "/robots.txt", "/API/HEALTH")) {
            MockHttpServletRequest req = new MockHttpServletRequest("GET", uri);
            MockHttpServletResponse res = new MockHttpServletResponse();

            filter.doFilter(req, res, json(200, "{}"));

            assertThat(res.getContentAsString()).isEqualTo("{}");
        }
        verifyNoInteractions(sink);
    }

    @Test
    void capturesJsonBodyForWriteMethods() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/links");
        req.setContentType(MediaType.APPLICATION_JSON_VALUE);
        req.setContent("{\"title\":\"Docs\",\"url\":\"https://example.org\"}".getBytes(StandardCharsets.UTF_8));
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, consumeBodyThen(201, "{\"success\":true}"));

        AuditEntry e = captureSingle();
        assertThat(e.requestData()).isNotNull();
        assertThat(e.requestData().get("title").asText()).isEqualTo("Docs");
        assertThat(e.statusCode()).isEqualTo(201);
    }

    @Test
    void ignoresBodyThatIsNotJson() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("PUT", "/api/links/1");
        req.setContentType(MediaType.TEXT_PLAIN_VALUE);
        req.setContent("plain".getBytes(StandardCharsets.UTF_8));

        filter.doFilter(req, new MockHttpServletResponse(), consumeBodyThen(200, "{}"));

        assertThat(captureSingle().requestData()).isNull();
    }

    @Test
    void ignoresUnparseableJsonBody() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("PATCH", "/api/links/1/pin");
        req.setContentType(MediaType.APPLICATION_JSON_VALUE);
        req.setContent("{not json".getBytes(StandardCharsets.UTF_8));

        filter.doFilter(req, new MockHttpServletResponse(), consumeBodyThen(400, "{\"message\":\"bad\"}"));

        AuditEntry e = captureSingle();
        assertThat(e.requestData()).isNull();
        assertThat(e.errorMessage()).isEqualTo("bad");
    }

    @Test
    void sensitiveHeadersNeverReachTheSink() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");
        req.addHeader("Authorization", "Bearer s3cr3t");
        req.addHeader("Cookie", "JSESSIONID=1");
        req.addHeader("X-API-KEY", "key");
        req.addHeader("X-Trace", "abc");

        filter.doFilter(req, new MockHttpServletResponse(), json(200, "{}"));

        AuditEntry e = captureSingle();
        assertThat(e.requestHeaders()).containsEntry("X-Trace", "abc");
        assertThat(e.requestHeaders().keySet())
                .noneMatch(k -> k.equalsIgnoreCase("authorization")
                        || k.equalsIgnoreCase("cookie")
                        || k.equalsIgnoreCase("x-api-key"));
    }

    @Test
    void failureResponseIsClassified() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links/99");

        filter.doFilter(req, new MockHttpServletResponse(),
                json(404, "{\"success\":false,\"message\":\"Link not found\"}"));

        AuditEntry e = captureSingle();
        assertThat(e.statusCode()).isEqualTo(404);
        assertThat(e.errorMessage()).isEqualTo("Link not found");
        assertThat(e.errorType()).isEqualTo("HTTPError");
        assertThat(e.responseData().get("message").asText()).isEqualTo("Link not found");
    }

    @Test
    void usesMatchedRouteTemplateAsEndpoint() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links/42");

        FilterChain chain = (request, response) -> {
            request.setAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE, "/api/links/{linkId}");
            ((HttpServletResponse) response).setStatus(200);
        };
        filter.doFilter(req, new MockHttpServletResponse(), chain);

        assertThat(captureSingle().endpoint()).isEqualTo("/api/links/{linkId}");
    }

    @Test
    void catchAllPatternFallsBackToRequestUri() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/nowhere/else");

        FilterChain chain = (request, response) -> {
            request.setAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE, "/**");
            ((HttpServletResponse) response).setStatus(404);
        };
        filter.doFilter(req, new MockHttpServletResponse(), chain);

        AuditEntry e = captureSingle();
        assertThat(e.endpoint()).isEqualTo("/nowhere/else");
        assertThat(e.errorMessage()).isEqualTo("HTTP 404");
    }

    @Test
    void durationReflectsHandlerTime() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");

        FilterChain slow = (request, response) -> {
            try {
                Thread.sleep(60);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ((HttpServletResponse) response).setStatus(200);
        };
        filter.doFilter(req, new MockHttpServletResponse(), slow);

        assertThat(captureSingle().durationMs()).isGreaterThanOrEqualTo(60);
    }

    @Test
    void unhandledExceptionIsRecordedAsServerErrorAndRethrown() {
        MockHttpServletRequest req = new MockHttpServletRequest("DELETE", "/api/links/7");
        IllegalStateException boom = new IllegalStateException("boom");

        assertThatThrownBy(() -> filter.doFilter(req, new MockHttpServletResponse(), (rq, rs) -> {
            throw boom;
        })).isSameAs(boom);

        AuditEntry e = captureSingle();
        assertThat(e.statusCode()).isEqualTo(500);
        assertThat(e.errorMessage()).isEqualTo("boom");
        assertThat(e.errorType()).isEqualTo("IllegalStateException");
    }

    @Test
    void exceptionWithoutMessageUsesClassName() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");

        assertThatThrownBy(() -> filter.doFilter(req, new MockHttpServletResponse(), (rq, rs) -> {
            throw new NullPointerException();
        })).isInstanceOf(NullPointerException.class);

        AuditEntry e = captureSingle();
        assertThat(e.errorMessage()).isEqualTo("java.lang.NullPointerException");
        assertThat(e.errorType()).isEqualTo("NullPointerException");
    }

    @Test
    void servletExceptionIsUnwrappedToRootCause() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");
        ServletException wrapped = new ServletException("Request processing failed",
                new IllegalArgumentException("bad id"));

        assertThatThrownBy(() -> filter.doFilter(req, new MockHttpServletResponse(), (rq, rs) -> {
            throw wrapped;
        })).isSameAs(wrapped);

        AuditEntry e = captureSingle();
        assertThat(e.errorType()).isEqualTo("IllegalArgumentException");
        assertThat(e.errorMessage()).isEqualTo("bad id");
    }

    @Test
    void sinkFailureDoesNotAlterTheResponse() throws Exception {
        doThrow(new RuntimeException("db down")).when(sink).submit(any());
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, json(200, "{\"success\":true}"));

        assertThat(res.getStatus()).isEqualTo(200);
        assertThat(res.getContentAsString()).isEqualTo("{\"success\":true}");
    }

    @Test
    void brokenClientConnectionIsStillRecorded() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");
        MockHttpServletResponse res = new MockHttpServletResponse() {
            @Override
            public ServletOutputStream getOutputStream() {
                return new ServletOutputStream() {
                    @Override
                    public boolean isReady() {
                        return true;
                    }

                    @Override
                    public void setWriteListener(WriteListener listener) {
                    }

                    @Override
                    public void write(int b) throws IOException {
                        throw new IOException("Broken pipe");
                    }

                    @Override
                    public void write(byte[] b, int off, int len) throws IOException {
                        throw new IOException("Broken pipe");
                    }
                };
            }
        };

        assertThatThrownBy(() -> filter.doFilter(req, res, json(200, "{\"success\":true}")))
                .isInstanceOf(IOException.class)
                .hasMessage("Broken pipe");

        AuditEntry e = captureSingle();
        assertThat(e.statusCode()).isEqualTo(200);
        assertThat(e.endpoint()).isEqualTo("/api/links");
    }

    @Test
    void sinkFailureOnExceptionPathStillRethrowsOriginal() {
        doThrow(new RuntimeException("db down")).when(sink).submit(any());
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/links");
        IllegalStateException boom = new IllegalStateException("boom");

        assertThatThrownBy(() -> filter.doFilter(req, new MockHttpServletResponse(), (rq, rs) -> {
            throw boom;
        })).isSameAs(boom);
    }

    @Test
    void queryParamsParsing() {
        assertThat(RequestAuditFilter.queryParams(null)).isNull();
        assertThat(RequestAuditFilter.queryParams("")).isNull();
        assertThat(RequestAuditFilter.queryParams("&&")).isNull();
        assertThat(RequestAuditFilter.queryParams("flag")).containsEntry("flag", "");
        assertThat(RequestAuditFilter.queryParams("a=1&a=2&b=x+y")).containsEntry("a", "1").containsEntry("b", "x y");
    }

    private AuditEntry captureSingle() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(sink, times(1)).submit(captor.capture());
        return captor.getValue();
    }

    private static FilterChain json(int status, String body) {
        return (request, response) -> {
            HttpServletResponse r = (HttpServletResponse) response;
            r.setStatus(status);
            r.setContentType(MediaType.APPLICATION_JSON_VALUE);
            r.getOutputStream().write(body.getBytes(StandardCharsets.UTF_8));
        };
    }

    private static FilterChain consumeBodyThen(int status, String body) {
        FilterChain respond = json(status, body);
        return (request, response) -> {
            request.getInputStream().readAllBytes();
            respond.doFilter(request, response);
        };
    }
}
