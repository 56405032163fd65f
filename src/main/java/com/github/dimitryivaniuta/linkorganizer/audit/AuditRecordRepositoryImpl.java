package com.github.dimitryivaniuta.linkorganizer.audit;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics fragment of {@link AuditRecordRepository}.
 *
 * <p>Each aggregate is its own criteria query; the filter predicate is rebuilt for every
 * query root from {@link AuditRecordFilter#toPredicate} rather than shared between queries.
 */
class AuditRecordRepositoryImpl implements AuditRecordRepositoryCustom {

    @PersistenceContext
    private EntityManager em;

    @Override
    public AuditStatistics statistics(AuditRecordFilter filter, int topEndpoints) {
        CriteriaBuilder cb = em.getCriteriaBuilder();

        long total = count(cb, filter);

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (Tuple t : grouped(cb, filter, "statusCode", false, -1)) {
            byStatus.put(String.valueOf(t.get(0)), t.get(1, Long.class));
        }

        Map<String, Long> byMethod = new LinkedHashMap<>();
        for (Tuple t : grouped(cb, filter, "method", false, -1)) {
            byMethod.put(t.get(0, String.class), t.get(1, Long.class));
        }

        Map<String, Long> byEndpoint = new LinkedHashMap<>();
        for (Tuple t : grouped(cb, filter, "endpoint", true, topEndpoints)) {
            byEndpoint.put(t.get(0, String.class), t.get(1, Long.class));
        }

        Double avg = averageDuration(cb, filter);

        return new AuditStatistics(total, byStatus, byMethod, byEndpoint, avg == null ? 0.0d : avg);
    }

    private long count(CriteriaBuilder cb, AuditRecordFilter filter) {
        CriteriaQuery<Long> q = cb.createQuery(Long.class);
        Root<AuditRecord> r = q.from(AuditRecord.class);
        q.select(cb.count(r)).where(filter.toPredicate(r, cb));
        Long n = em.createQuery(q).getSingleResult();
        return n == null ? 0L : n;
    }

    private List<Tuple> grouped(CriteriaBuilder cb,
                                AuditRecordFilter filter,
                                String attribute,
                                boolean byCountDesc,
                                int limit) {
        CriteriaQuery<Tuple> q = cb.createTupleQuery();
        Root<AuditRecord> r = q.from(AuditRecord.class);
        Path<Object> key = r.get(attribute);
        Expression<Long> cnt = cb.count(r);

        q.multiselect(key, cnt)
                .where(filter.toPredicate(r, cb))
                .groupBy(key);

        if (byCountDesc) {
            q.orderBy(cb.desc(cnt), cb.asc(key));
        } else {
            q.orderBy(cb.asc(key));
        }

        var typed = em.createQuery(q);
        if (limit > 0) {
            typed.setMaxResults(limit);
        }
        return typed.getResultList();
    }

    private Double averageDuration(CriteriaBuilder cb, AuditRecordFilter filter) {
        CriteriaQuery<Double> q = cb.createQuery(Double.class);
        Root<AuditRecord> r = q.from(AuditRecord.class);
        q.select(cb.avg(r.<Integer>get("durationMs"))).where(filter.toPredicate(r, cb));
        return em.createQuery(q).getSingleResult();
    }
}
