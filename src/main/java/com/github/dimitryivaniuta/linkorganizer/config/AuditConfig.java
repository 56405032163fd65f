package com.github.dimitryivaniuta.linkorganizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditLogService;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditMetrics;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditProperties;
import com.github.dimitryivaniuta.linkorganizer.audit.AuditRecordSink;
import com.github.dimitryivaniuta.linkorganizer.audit.HeaderSanitizer;
import com.github.dimitryivaniuta.linkorganizer.audit.QueueingAuditRecordSink;
import com.github.dimitryivaniuta.linkorganizer.audit.ResponseOutcomeClassifier;
import com.github.dimitryivaniuta.linkorganizer.audit.SynchronousAuditRecordSink;
import com.github.dimitryivaniuta.linkorganizer.web.RequestAuditFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Wires the request audit pipeline: filter, enrichment helpers and the sink that persists.
 */
@Configuration
@EnableConfigurationProperties(AuditProperties.class)
public class AuditConfig {

    // after the very first filters (character encoding, request-context) so the body wrappers see
    // the decoded request, but before everything that may short-circuit the chain
    static final int AUDIT_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 20;

    @Bean
    public HeaderSanitizer headerSanitizer(AuditProperties props) {
        return new HeaderSanitizer(props.getSensitiveHeaders());
    }

    @Bean
    public ResponseOutcomeClassifier responseOutcomeClassifier(ObjectMapper objectMapper) {
        return new ResponseOutcomeClassifier(objectMapper);
    }

    @Bean
    public AuditRecordSink auditRecordSink(AuditLogService auditLogService,
                                           AuditMetrics metrics,
                                           AuditProperties props) {
        AuditProperties.Writer w = props.getWriter();
        return switch (w.getMode()) {
            case SYNC -> new SynchronousAuditRecordSink(auditLogService, metrics);
            case ASYNC -> new QueueingAuditRecordSink(
                    auditLogService, metrics, w.getQueueCapacity(), w.getShutdownTimeout());
        };
    }

    @Bean
    @ConditionalOnProperty(prefix = "audit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FilterRegistrationBean<RequestAuditFilter> requestAuditFilter(AuditRecordSink sink,
                                                                        ResponseOutcomeClassifier classifier,
                                                                        HeaderSanitizer sanitizer,
                                                                        ObjectMapper objectMapper,
                                                                        AuditProperties props) {
        RequestAuditFilter filter = new RequestAuditFilter(
                sink, classifier, sanitizer, objectMapper, props.getSkipPatterns());

        FilterRegistrationBean<RequestAuditFilter> reg = new FilterRegistrationBean<>(filter);
        reg.setName("requestAuditFilter");
        reg.setOrder(AUDIT_FILTER_ORDER);
        reg.addUrlPatterns("/*");
        return reg;
    }
}
