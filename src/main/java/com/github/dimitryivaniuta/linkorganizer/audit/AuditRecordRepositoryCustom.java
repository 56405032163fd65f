package com.github.dimitryivaniuta.linkorganizer.audit;

public interface AuditRecordRepositoryCustom {

    AuditStatistics statistics(AuditRecordFilter filter, int topEndpoints);
}
