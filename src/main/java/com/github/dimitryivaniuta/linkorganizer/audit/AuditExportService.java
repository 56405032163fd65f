package com.github.dimitryivaniuta.linkorganizer.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.github.dimitryivaniuta.linkorganizer.error.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Bulk export of the audit log, JSON or CSV. The record set is the first {@code limit}
 * records of the regular listing (newest first) for the given time window.
 */
@Service
@RequiredArgsConstructor
public class AuditExportService {

    public static final String JSON = "json";
    public static final String CSV = "csv";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema CSV_SCHEMA = CSV_MAPPER.schemaFor(AuditCsvRow.class).withHeader();

    // cells starting with one of these are evaluated as formulas by spreadsheet tools
    private static final String FORMULA_PREFIXES = "=+-@\t\r";

    private final AuditLogService auditLogService;
    private final AuditRecordMapper recordMapper;

    /** Normalizes the requested format, rejecting anything but json and csv. */
    public static String format(String requested) {
        String f = (requested == null || requested.isBlank()) ? JSON : requested.trim().toLowerCase(Locale.ROOT);
        if (!JSON.equals(f) && !CSV.equals(f)) {
            throw new ValidationException("Unsupported export format '" + requested + "', use json or csv");
        }
        return f;
    }

    public AuditExport exportJson(Instant start, Instant end, int limit) {
        List<AuditRecordResponse> rows = fetch(start, end, limit).stream()
                .map(recordMapper::toResponse)
                .toList();

        AuditExport.ExportInfo info = new AuditExport.ExportInfo(
                JSON, rows.size(), Instant.now(), new AuditExport.DateRange(start, end));
        return new AuditExport(info, rows);
    }

    public String exportCsv(Instant start, Instant end, int limit) {
        List<AuditCsvRow> rows = fetch(start, end, limit).stream()
                .map(this::toCsvRow)
                .toList();
        try {
            return CSV_MAPPER.writer(CSV_SCHEMA).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render CSV export", e);
        }
    }

    private List<AuditRecord> fetch(Instant start, Instant end, int limit) {
        return auditLogService.searchForExport(AuditRecordFilter.between(start, end), limit).records();
    }

    private AuditCsvRow toCsvRow(AuditRecord r) {
        return new AuditCsvRow(
                r.getId(),
                r.getMethod(),
                defuse(r.getEndpoint()),
                r.getStatusCode(),
                defuse(r.getErrorType()),
                defuse(r.getErrorMessage()),
                r.getRequestTime() == null ? null : r.getRequestTime().toString(),
                r.getResponseTime() == null ? null : r.getResponseTime().toString(),
                r.getDurationMs(),
                r.getClientIp(),
                defuse(r.getUserAgent()),
                recordMapper.compact(r.getRequestParamsJson()),
                recordMapper.compact(r.getRequestHeadersJson()),
                recordMapper.compact(r.getRequestDataJson()),
                recordMapper.compact(r.getResponseDataJson()),
                defuse(r.getSessionId()),
                r.getUserId()
        );
    }

    static String defuse(String value) {
        if (value == null || value.isEmpty()) return value;
        return FORMULA_PREFIXES.indexOf(value.charAt(0)) >= 0 ? "'" + value : value;
    }
}
