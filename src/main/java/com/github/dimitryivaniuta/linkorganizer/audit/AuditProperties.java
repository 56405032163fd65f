package com.github.dimitryivaniuta.linkorganizer.audit;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

    private boolean enabled = true;

    // json payloads longer than this are replaced by a truncation envelope
    private int maxPayloadChars = 20_000;

    // substring match against the lower-cased request path
    private List<String> skipPatterns = List.of("static", "health", "favicon", "robots.txt");

    // removed case-insensitively before persistence
    private List<String> sensitiveHeaders = List.of("authorization", "cookie", "x-api-key");

    private Query query = new Query();
    private Writer writer = new Writer();
    private Retention retention = new Retention();

    @Getter
    @Setter
    public static class Query {
        private int defaultPageSize = 50;
        private int maxPageSize = 100;
        private int defaultExportLimit = 1_000;
        private int maxExportLimit = 10_000;
        private int topEndpoints = 10;
    }

    @Getter
    @Setter
    public static class Writer {
        private Mode mode = Mode.ASYNC;
        private int queueCapacity = 10_000;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Retention {
        private boolean enabled = true;
        private int days = 30;
        private String cron = "0 0 3 * * *";
    }

    public enum Mode {
        /** persist on the request thread after the response body is flushed */
        SYNC,
        /** hand records to a bounded queue drained by one background writer */
        ASYNC
    }
}
