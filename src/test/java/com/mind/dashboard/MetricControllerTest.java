package com.mind.dashboard;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MetricControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void returnsMetricForAuthorizedCaller() throws Exception {
        mockMvc.perform(get("/api/metrics/telemetry.request_count")
                        .param("window", "today")
                        .header("X-Caller-Id", "dev-1")
                        .header("X-Caller-Role", "developer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metricId").value("telemetry.request_count"))
                .andExpect(jsonPath("$.value.shape").value("NUMBER"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void scopeViolationIsForbidden() throws Exception {
        mockMvc.perform(get("/api/metrics/grades.mean_score")
                        .header("X-Caller-Id", "dev-1")
                        .header("X-Caller-Role", "developer"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.kind").value("AUTHORIZATION"));
    }

    @Test
    void undeclaredParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/metrics/grades.mean_score")
                        .param("service", "api")
                        .header("X-Caller-Id", "admin-1")
                        .header("X-Caller-Role", "admin"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("VALIDATION"))
                .andExpect(jsonPath("$.error.parameter").value("service"));
    }

    @Test
    void unknownOrMissingRoleIsForbidden() throws Exception {
        mockMvc.perform(get("/api/metrics/grades.mean_score")
                        .header("X-Caller-Id", "x-1")
                        .header("X-Caller-Role", "superuser"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/metrics/grades.mean_score"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/metrics"))
                .andExpect(status().isForbidden());
    }

    @Test
    void catalogIsFilteredByRole() throws Exception {
        mockMvc.perform(get("/api/metrics")
                        .header("X-Caller-Id", "dev-1")
                        .header("X-Caller-Role", "developer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].recordType", everyItem(is("TELEMETRY"))));
    }

    @Test
    void cacheManagementIsAdminOnly() throws Exception {
        mockMvc.perform(delete("/api/metrics/cache")
                        .header("X-Caller-Id", "f-1")
                        .header("X-Caller-Role", "faculty"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("AUTHORIZATION"));
        mockMvc.perform(delete("/api/metrics/cache")
                        .header("X-Caller-Id", "admin-1")
                        .header("X-Caller-Role", "admin"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/metrics/cache/grades.mean_score")
                        .header("X-Caller-Id", "admin-1")
                        .header("X-Caller-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(0));
        mockMvc.perform(delete("/api/metrics/cache/grades.unknown")
                        .header("X-Caller-Id", "admin-1")
                        .header("X-Caller-Role", "admin"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/metrics/cache/stats")
                        .header("X-Caller-Id", "admin-1")
                        .header("X-Caller-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hits").exists());
    }
}
