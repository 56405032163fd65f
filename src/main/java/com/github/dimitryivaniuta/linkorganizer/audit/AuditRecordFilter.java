package com.github.dimitryivaniuta.linkorganizer.audit;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.Builder;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Filter over audit records. Every criterion is optional; absent criteria match everything.
 *
 * <p>{@link #toPredicate(Root, CriteriaBuilder)} is the single place the where-clause is built,
 * so listings and every statistics aggregate apply exactly the same restriction.
 */
@Builder
public record AuditRecordFilter(
        String method,
        String endpoint,
        Integer statusCode,
        String errorType,
        Instant start,
        Instant end
) {

    public static AuditRecordFilter none() {
        return AuditRecordFilter.builder().build();
    }

    public static AuditRecordFilter between(Instant start, Instant end) {
        return AuditRecordFilter.builder().start(start).end(end).build();
    }

    public Predicate toPredicate(Root<AuditRecord> root, CriteriaBuilder cb) {
        List<Predicate> parts = new ArrayList<>();

        if (hasText(method)) {
            parts.add(cb.equal(root.get("method"), method.trim().toUpperCase(Locale.ROOT)));
        }
        if (hasText(endpoint)) {
            parts.add(cb.like(root.get("endpoint"), "%" + escapeLike(endpoint.trim()) + "%", '\\'));
        }
        if (statusCode != null) {
            parts.add(cb.equal(root.get("statusCode"), statusCode));
        }
        if (hasText(errorType)) {
            parts.add(cb.equal(root.get("errorType"), errorType.trim()));
        }
        if (start != null) {
            parts.add(cb.greaterThanOrEqualTo(root.get("requestTime"), start));
        }
        if (end != null) {
            parts.add(cb.lessThanOrEqualTo(root.get("requestTime"), end));
        }
        return cb.and(parts.toArray(new Predicate[0]));
    }

    public Specification<AuditRecord> toSpecification() {
        return (root, query, cb) -> toPredicate(root, cb);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
