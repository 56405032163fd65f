package com.github.dimitryivaniuta.linkorganizer.audit;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One audited HTTP transaction. Rows are append-only: there is no update path,
 * only retention cleanup and delete-by-id.
 *
 * JSON payloads are kept as serialized text; {@link AuditLogService} owns the conversion.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "errors")
public class AuditRecord {

    public static final int METHOD_LENGTH = 10;
    public static final int ENDPOINT_LENGTH = 255;
    public static final int CLIENT_IP_LENGTH = 45;
    public static final int USER_AGENT_LENGTH = 500;
    public static final int ERROR_TYPE_LENGTH = 100;
    public static final int SESSION_ID_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "method", nullable = false, length = METHOD_LENGTH)
    private String method;

    @Column(name = "endpoint", nullable = false, length = ENDPOINT_LENGTH)
    private String endpoint;

    @Column(name = "request_data", columnDefinition = "text")
    private String requestDataJson;

    @Column(name = "request_params", columnDefinition = "text")
    private String requestParamsJson;

    @Column(name = "request_headers", columnDefinition = "text")
    private String requestHeadersJson;

    @Column(name = "client_ip", length = CLIENT_IP_LENGTH)
    private String clientIp;

    @Column(name = "user_agent", length = USER_AGENT_LENGTH)
    private String userAgent;

    @Column(name = "status_code", nullable = false)
    private int statusCode;

    @Column(name = "response_data", columnDefinition = "text")
    private String responseDataJson;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "error_type", length = ERROR_TYPE_LENGTH)
    private String errorType;

    @Column(name = "request_time", nullable = false, updatable = false)
    private Instant requestTime;

    @Column(name = "response_time")
    private Instant responseTime;

    @Column(name = "duration_ms")
    private Integer durationMs;

    // reserved: nothing populates these yet
    @Column(name = "session_id", length = SESSION_ID_LENGTH)
    private String sessionId;

    @Column(name = "user_id")
    private Integer userId;

    @PrePersist
    void prePersist() {
        if (requestTime == null) {
            requestTime = Instant.now();
        }
    }
}
