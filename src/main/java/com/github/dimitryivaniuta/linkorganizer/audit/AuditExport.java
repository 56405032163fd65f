package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/** JSON export document: metadata plus the exported records, newest first. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditExport(ExportInfo exportInfo, List<AuditRecordResponse> errors) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExportInfo(String format, int totalRecords, Instant exportDate, DateRange dateRange) {}

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DateRange(Instant startDate, Instant endDate) {}
}
