package com.github.dimitryivaniuta.linkorganizer.audit;

import com.github.dimitryivaniuta.linkorganizer.error.NotFoundException;
import com.github.dimitryivaniuta.linkorganizer.web.ApiResponse;
import com.github.dimitryivaniuta.linkorganizer.web.IsoDates;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Read and maintenance API over the audit log.
 */
@RestController
@RequestMapping("/api/errors")
@RequiredArgsConstructor
public class AuditLogController {

    static final String CSV_FILENAME = "errors-export.csv";

    private final AuditLogService auditLogService;
    private final AuditExportService exportService;
    private final AuditRecordMapper recordMapper;
    private final AuditProperties props;

    @GetMapping
    public ApiResponse<AuditPage<AuditRecordResponse>> list(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "per_page", required = false) Integer perPage,
            @RequestParam(name = "method", required = false) String method,
            @RequestParam(name = "endpoint", required = false) String endpoint,
            @RequestParam(name = "status_code", required = false) Integer statusCode,
            @RequestParam(name = "error_type", required = false) String errorType,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate
    ) {
        AuditRecordFilter filter = AuditRecordFilter.builder()
                .method(method)
                .endpoint(endpoint)
                .statusCode(statusCode)
                .errorType(errorType)
                .start(IsoDates.parse("start_date", startDate))
                .end(IsoDates.parse("end_date", endDate))
                .build();

        int size = perPage != null ? perPage : props.getQuery().getDefaultPageSize();
        AuditPage<AuditRecordResponse> result = auditLogService.search(filter, page, size)
                .map(recordMapper::toResponse);
        return ApiResponse.ok(result, "Error logs retrieved successfully");
    }

    @GetMapping("/{id}")
    public ApiResponse<AuditRecordResponse> get(@PathVariable("id") long id) {
        AuditRecord record = auditLogService.findById(id)
                .orElseThrow(() -> new NotFoundException("Error log not found"));
        return ApiResponse.ok(recordMapper.toResponse(record), "Error log retrieved successfully");
    }

    @GetMapping("/statistics")
    public ApiResponse<AuditStatistics> statistics(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate
    ) {
        Instant start = IsoDates.parse("start_date", startDate);
        Instant end = IsoDates.parse("end_date", endDate);
        return ApiResponse.ok(auditLogService.statistics(start, end), "Error statistics retrieved successfully");
    }

    @DeleteMapping("/cleanup")
    public ApiResponse<CleanupResult> cleanup(@RequestParam(name = "days", defaultValue = "30") int days) {
        int deleted = auditLogService.deleteOlderThan(days);
        return ApiResponse.ok(new CleanupResult(deleted, days),
                "Successfully deleted " + deleted + " old error logs");
    }

    @GetMapping("/export")
    public ResponseEntity<?> export(
            @RequestParam(name = "format", defaultValue = AuditExportService.JSON) String format,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        String f = AuditExportService.format(format);
        Instant start = IsoDates.parse("start_date", startDate);
        Instant end = IsoDates.parse("end_date", endDate);
        int max = limit != null ? limit : props.getQuery().getDefaultExportLimit();

        if (AuditExportService.CSV.equals(f)) {
            String csv = exportService.exportCsv(start, end, max);
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(CSV_FILENAME).build().toString())
                    .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                    .body(csv);
        }
        return ResponseEntity.ok(ApiResponse.ok(exportService.exportJson(start, end, max),
                "Error logs exported successfully"));
    }
}
