package com.github.dimitryivaniuta.linkorganizer.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long>,
        AuditRecordRepositoryCustom,
        JpaSpecificationExecutor<AuditRecord> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from AuditRecord r
            where r.requestTime < :cutoff
            """)
    int deleteRequestedBefore(@Param("cutoff") Instant cutoff);
}
