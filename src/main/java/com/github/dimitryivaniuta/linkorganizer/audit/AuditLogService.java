package com.github.dimitryivaniuta.linkorganizer.audit;

import com.github.dimitryivaniuta.linkorganizer.error.DatabaseException;
import com.github.dimitryivaniuta.linkorganizer.error.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Store and query engine of the audit log.
 *
 * <p>Writes run in their own transaction so a failing audit insert never joins (or dooms)
 * a caller's transaction. Reads surface storage failures as {@link DatabaseException};
 * only the request filter's write path swallows them.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    static final Set<String> KNOWN_METHODS =
            Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS", "HEAD");

    private static final Sort NEWEST_FIRST =
            Sort.by(Sort.Order.desc("requestTime"), Sort.Order.desc("id"));

    private final AuditRecordRepository repo;
    private final HeaderSanitizer sanitizer;
    private final AuditRecordMapper recordMapper;
    private final AuditProperties props;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditRecord log(AuditEntry entry) {
        if (entry == null
                || isBlank(entry.method())
                || isBlank(entry.endpoint())
                || entry.statusCode() == null
                || entry.statusCode() == 0) {
            throw new ValidationException("Method, endpoint, and status_code are required");
        }
        if (entry.statusCode() < 100 || entry.statusCode() > 599) {
            throw new ValidationException("status_code must be between 100 and 599, got " + entry.statusCode());
        }
        if (entry.durationMs() != null && entry.durationMs() < 0) {
            throw new ValidationException("duration_ms must not be negative");
        }

        int maxChars = props.getMaxPayloadChars();

        AuditRecord row = AuditRecord.builder()
                .method(AuditRecordMapper.truncatePlain(
                        entry.method().trim().toUpperCase(Locale.ROOT), AuditRecord.METHOD_LENGTH))
                .endpoint(AuditRecordMapper.truncatePlain(entry.endpoint(), AuditRecord.ENDPOINT_LENGTH))
                .requestDataJson(recordMapper.writeJson(entry.requestData(), maxChars))
                .requestParamsJson(recordMapper.writeJson(entry.requestParams(), maxChars))
                .requestHeadersJson(recordMapper.writeJson(sanitizer.sanitize(entry.requestHeaders()), maxChars))
                .clientIp(AuditRecordMapper.truncatePlain(entry.clientIp(), AuditRecord.CLIENT_IP_LENGTH))
                .userAgent(AuditRecordMapper.truncatePlain(entry.userAgent(), AuditRecord.USER_AGENT_LENGTH))
                .statusCode(entry.statusCode())
                .responseDataJson(recordMapper.writeJson(entry.responseData(), maxChars))
                .errorMessage(AuditRecordMapper.truncatePlain(entry.errorMessage(), maxChars))
                .errorType(AuditRecordMapper.truncatePlain(entry.errorType(), AuditRecord.ERROR_TYPE_LENGTH))
                .sessionId(AuditRecordMapper.truncatePlain(entry.sessionId(), AuditRecord.SESSION_ID_LENGTH))
                .userId(entry.userId())
                .requestTime(entry.requestTime() != null ? entry.requestTime() : Instant.now())
                .responseTime(entry.responseTime())
                .durationMs(entry.durationMs())
                .build();

        try {
            return repo.saveAndFlush(row);
        } catch (DataAccessException e) {
            throw new DatabaseException("Failed to log request: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<AuditRecord> findById(long id) {
        try {
            return repo.findById(id);
        } catch (DataAccessException e) {
            throw new DatabaseException("Failed to retrieve error log: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Paginated listing, newest first. {@code perPage} above the configured maximum is clamped;
     * a page past the end yields an empty list.
     */
    @Transactional(readOnly = true)
    public AuditPage<AuditRecord> search(AuditRecordFilter filter, int page, int perPage) {
        return findPage(filter, page, perPage, props.getQuery().getMaxPageSize());
    }

    /** Same as {@link #search} but bounded by the export cap instead of the listing cap. */
    @Transactional(readOnly = true)
    public AuditPage<AuditRecord> searchForExport(AuditRecordFilter filter, int limit) {
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1");
        }
        return findPage(filter, 1, limit, props.getQuery().getMaxExportLimit());
    }

    @Transactional(readOnly = true)
    public AuditStatistics statistics(Instant start, Instant end) {
        try {
            return repo.statistics(validated(AuditRecordFilter.between(start, end)), props.getQuery().getTopEndpoints());
        } catch (DataAccessException e) {
            throw new DatabaseException("Failed to retrieve error statistics: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Transactional
    public int deleteBefore(Instant cutoff) {
        if (cutoff == null) {
            throw new ValidationException("cutoff is required");
        }
        try {
            return repo.deleteRequestedBefore(cutoff);
        } catch (DataAccessException e) {
            throw new DatabaseException("Failed to delete old error logs: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /** Retention cleanup: keeps the last {@code days} days of records. */
    @Transactional
    public int deleteOlderThan(int days) {
        if (days < 1) {
            throw new ValidationException("Days must be at least 1");
        }
        return deleteBefore(Instant.now().minus(Duration.ofDays(days)));
    }

    @Transactional
    public boolean deleteById(long id) {
        try {
            if (!repo.existsById(id)) return false;
            repo.deleteById(id);
            return true;
        } catch (DataAccessException e) {
            throw new DatabaseException("Failed to delete error log: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private AuditPage<AuditRecord> findPage(AuditRecordFilter filter, int page, int perPage, int cap) {
        if (page < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (perPage < 1) {
            throw new ValidationException("per_page must be at least 1");
        }
        AuditRecordFilter f = validated(filter == null ? AuditRecordFilter.none() : filter);
        int size = Math.min(perPage, cap);

        try {
            if ((long) (page - 1) * size > Integer.MAX_VALUE) {
                return AuditPage.beyondEnd(repo.count(f.toSpecification()), page, size);
            }
            Page<AuditRecord> p = repo.findAll(f.toSpecification(), PageRequest.of(page - 1, size, NEWEST_FIRST));
            return AuditPage.of(p, page, size);
        } catch (DataAccessException e) {
            throw new DatabaseException("Failed to retrieve error logs: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static AuditRecordFilter validated(AuditRecordFilter f) {
        if (!isBlank(f.method()) && !KNOWN_METHODS.contains(f.method().trim().toUpperCase(Locale.ROOT))) {
            throw new ValidationException("method must be one of " + KNOWN_METHODS.stream().sorted().toList());
        }
        if (f.statusCode() != null && (f.statusCode() < 100 || f.statusCode() > 599)) {
            throw new ValidationException("status_code must be between 100 and 599");
        }
        if (f.start() != null && f.end() != null && f.start().isAfter(f.end())) {
            throw new ValidationException("start_date must not be after end_date");
        }
        return f;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
