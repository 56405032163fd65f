package com.github.dimitryivaniuta.linkorganizer.audit;

import com.github.dimitryivaniuta.linkorganizer.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditLogController.class)
@Import({AuditRecordMapper.class, AuditLogControllerTest.Config.class})
class AuditLogControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(AuditProperties.class)
    static class Config {
    }

    @Autowired MockMvc mvc;

    @MockBean AuditLogService auditLogService;
    @MockBean AuditExportService exportService;

    @Test
    void listUsesDefaultPagingAndRendersSnakeCase() throws Exception {
        AuditRecord r = record(7L, "GET", "/api/links/{linkId}", 404);
        r.setErrorMessage("Link not found");
        r.setErrorType("HTTPError");
        r.setResponseDataJson("{\"success\":false,\"message\":\"Link not found\"}");
        when(auditLogService.search(any(), eq(1), eq(50)))
                .thenReturn(new AuditPage<>(List.of(r), 1, 1, 50, 1, false, false));

        mvc.perform(get("/api/errors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.errors[0].id").value(7))
                .andExpect(jsonPath("$.data.errors[0].status_code").value(404))
                .andExpect(jsonPath("$.data.errors[0].error_type").value("HTTPError"))
                .andExpect(jsonPath("$.data.errors[0].response_data.message").value("Link not found"))
                .andExpect(jsonPath("$.data.errors[0].request_data").isEmpty())
                .andExpect(jsonPath("$.data.per_page").value(50))
                .andExpect(jsonPath("$.data.has_next").value(false))
                .andExpect(jsonPath("$.data.has_prev").value(false));
    }

    @Test
    void listPassesFiltersThrough() throws Exception {
        when(auditLogService.search(any(), anyInt(), anyInt()))
                .thenReturn(new AuditPage<>(List.of(), 0, 2, 10, 0, false, true));

        mvc.perform(get("/api/errors")
                        .param("page", "2")
                        .param("per_page", "10")
                        .param("method", "post")
                        .param("endpoint", "links")
                        .param("status_code", "409")
                        .param("error_type", "HTTPError")
                        .param("start_date", "2024-01-01T00:00:00Z")
                        .param("end_date", "2024-01-31"))
                .andExpect(status().isOk());

        ArgumentCaptor<AuditRecordFilter> captor = ArgumentCaptor.forClass(AuditRecordFilter.class);
        verify(auditLogService).search(captor.capture(), eq(2), eq(10));
        AuditRecordFilter f = captor.getValue();
        assertThat(f.method()).isEqualTo("post");
        assertThat(f.endpoint()).isEqualTo("links");
        assertThat(f.statusCode()).isEqualTo(409);
        assertThat(f.errorType()).isEqualTo("HTTPError");
        assertThat(f.start()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(f.end()).isEqualTo(Instant.parse("2024-01-31T00:00:00Z"));
    }

    @Test
    void malformedDateIsBadRequestNamingTheField() throws Exception {
        mvc.perform(get("/api/errors").param("end_date", "31/01/2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message", containsString("end_date")));

        verifyNoInteractions(auditLogService);
    }

    @Test
    void nonNumericStatusCodeIsBadRequest() throws Exception {
        mvc.perform(get("/api/errors").param("status_code", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void serviceValidationFailureIsBadRequest() throws Exception {
        when(auditLogService.search(any(), anyInt(), anyInt()))
                .thenThrow(new ValidationException("page must be at least 1"));

        mvc.perform(get("/api/errors").param("page", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("page must be at least 1"));
    }

    @Test
    void getByIdReturnsRecordOr404() throws Exception {
        when(auditLogService.findById(1L)).thenReturn(Optional.of(record(1L, "GET", "/api/ping", 200)));
        when(auditLogService.findById(2L)).thenReturn(Optional.empty());

        mvc.perform(get("/api/errors/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.endpoint").value("/api/ping"));

        mvc.perform(get("/api/errors/2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Error log not found"));
    }

    @Test
    void statisticsRendersAggregates() throws Exception {
        Map<String, Long> top = new LinkedHashMap<>();
        top.put("/api/links", 3L);
        top.put("/api/categories", 1L);
        when(auditLogService.statistics(any(), any()))
                .thenReturn(new AuditStatistics(4, Map.of("200", 4L), Map.of("GET", 4L), top, 12.5));

        mvc.perform(get("/api/errors/statistics").param("start_date", "2024-01-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total_requests").value(4))
                .andExpect(jsonPath("$.data.status_code_counts['200']").value(4))
                .andExpect(jsonPath("$.data.top_endpoints['/api/links']").value(3))
                .andExpect(jsonPath("$.data.average_response_time_ms").value(12.5));

        verify(auditLogService).statistics(Instant.parse("2024-01-01T00:00:00Z"), null);
    }

    @Test
    void cleanupReportsDeletedCount() throws Exception {
        when(auditLogService.deleteOlderThan(30)).thenReturn(5);

        mvc.perform(delete("/api/errors/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deleted_count").value(5))
                .andExpect(jsonPath("$.data.days_kept").value(30));
    }

    @Test
    void cleanupWithNonPositiveDaysIsBadRequest() throws Exception {
        when(auditLogService.deleteOlderThan(0)).thenThrow(new ValidationException("Days must be at least 1"));

        mvc.perform(delete("/api/errors/cleanup").param("days", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Days must be at least 1"));
    }

    @Test
    void csvExportIsServedAsAttachment() throws Exception {
        when(exportService.exportCsv(any(), any(), eq(1000))).thenReturn("id,method\n1,GET\n");

        mvc.perform(get("/api/errors/export").param("format", "CSV"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("errors-export.csv")))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string("id,method\n1,GET\n"));
    }

    @Test
    void jsonExportIsWrappedInEnvelope() throws Exception {
        AuditExport export = new AuditExport(
                new AuditExport.ExportInfo("json", 0, Instant.parse("2024-02-01T00:00:00Z"),
                        new AuditExport.DateRange(null, null)),
                List.of());
        when(exportService.exportJson(null, null, 25)).thenReturn(export);

        mvc.perform(get("/api/errors/export").param("limit", "25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.export_info.format").value("json"))
                .andExpect(jsonPath("$.data.export_info.total_records").value(0))
                .andExpect(jsonPath("$.data.errors").isArray());
    }

    @Test
    void unknownExportFormatIsBadRequest() throws Exception {
        mvc.perform(get("/api/errors/export").param("format", "xml"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(exportService);
    }

    private static AuditRecord record(Long id, String method, String endpoint, int status) {
        return AuditRecord.builder()
                .id(id)
                .method(method)
                .endpoint(endpoint)
                .statusCode(status)
                .requestTime(Instant.parse("2024-01-10T08:00:00Z"))
                .build();
    }
}
