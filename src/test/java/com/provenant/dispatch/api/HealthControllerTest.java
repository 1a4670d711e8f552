package com.provenant.dispatch.api;

import com.provenant.core.health.HealthCheckService;
import com.provenant.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when nothing is DOWN")
    void healthUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("database", HealthStatus.Status.UP, "H2", Map.of()),
                new HealthStatus("builders", HealthStatus.Status.DEGRADED, "2 of 3 builder nodes reachable",
                        Map.of("builder-c", "DOWN"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.database.status").value("UP"))
                .andExpect(jsonPath("$.components.builders.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.builders.metadata['builder-c']").value("DOWN"))
                .andExpect(jsonPath("$.components.database.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /health/ready returns 503 when the HSM is DOWN")
    void readyDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("hsm", HealthStatus.Status.DOWN, "HSM unreachable", Map.of())));

        mockMvc.perform(get("/api/v1/health/ready"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.hsm.detail").value("HSM unreachable"));
    }

    @Test
    @DisplayName("GET /health/live does not run component checks")
    void live() throws Exception {
        mockMvc.perform(get("/api/v1/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
        verifyNoInteractions(healthCheckService);
    }
}
