package com.github.dimitryivaniuta.linkorganizer;

import com.github.dimitryivaniuta.linkorganizer.infra.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
class AuditLogPostgresTest extends BaseIntegrationTest {

    @Autowired MockMvc mvc;

    @Test
    void auditTrailOnPostgres() throws Exception {
        mvc.perform(post("/api/categories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Dev\"}"))
                .andExpect(status().isCreated());
        mvc.perform(get("/api/categories/999")).andExpect(status().isNotFound());
        mvc.perform(get("/api/links").param("category_id", "1")).andExpect(status().isOk());

        Integer rows = jdbc.queryForObject("select count(*) from errors", Integer.class);
        assertThat(rows).isEqualTo(3);

        mvc.perform(get("/api/errors")
                        .param("endpoint", "categories")
                        .param("start_date", "2000-01-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(2))
                .andExpect(jsonPath("$.data.errors[0].endpoint").value("/api/categories/{categoryId}"))
                .andExpect(jsonPath("$.data.errors[0].error_message").value("Category not found"));

        mvc.perform(get("/api/errors/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.method_counts.GET").value(3))
                .andExpect(jsonPath("$.data.top_endpoints", org.hamcrest.Matchers.aMapWithSize(
                        org.hamcrest.Matchers.greaterThanOrEqualTo(3))));

        mvc.perform(get("/actuator/prometheus"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("link_organizer_audit_written_total")));
    }
}
