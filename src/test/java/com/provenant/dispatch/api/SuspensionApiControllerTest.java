package com.provenant.dispatch.api;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.SuspensionRecord;
import com.provenant.core.suspension.SuspensionController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SuspensionApiController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SuspensionApiControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String ARTIFACT = "sha256:" + "cd".repeat(32);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SuspensionController suspensions;

    @Test
    @DisplayName("POST /suspensions suspends an artifact")
    void suspendArtifact() throws Exception {
        when(suspensions.suspend(SuspensionRecord.TargetType.ARTIFACT, ARTIFACT, "malware report", "tok"))
                .thenReturn(new SuspensionRecord("susp-1", SuspensionRecord.TargetType.ARTIFACT, ARTIFACT,
                        SuspensionRecord.Action.SUSPEND, "malware report", "cert-dk", NOW));

        mockMvc.perform(post("/api/v1/suspensions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"artifact_id\":\"" + ARTIFACT + "\",\"reason\":\"malware report\","
                                + "\"authority_token\":\"tok\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.record_id").value("susp-1"))
                .andExpect(jsonPath("$.target_type").value("ARTIFACT"))
                .andExpect(jsonPath("$.action").value("SUSPEND"))
                .andExpect(jsonPath("$.authority").value("cert-dk"));
    }

    @Test
    @DisplayName("POST /suspensions/lift lifts an application suspension")
    void liftApplication() throws Exception {
        when(suspensions.lift(SuspensionRecord.TargetType.APPLICATION, "dk.digst.mitid", "resolved", "tok"))
                .thenReturn(new SuspensionRecord("susp-2", SuspensionRecord.TargetType.APPLICATION, "dk.digst.mitid",
                        SuspensionRecord.Action.LIFT, "resolved", "cert-dk", NOW));

        mockMvc.perform(post("/api/v1/suspensions/lift").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"application_id\":\"dk.digst.mitid\",\"reason\":\"resolved\","
                                + "\"authority_token\":\"tok\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("LIFT"));
    }

    @Test
    @DisplayName("both or neither target returns 400")
    void exactlyOneTarget() throws Exception {
        mockMvc.perform(post("/api/v1/suspensions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"artifact_id\":\"a\",\"application_id\":\"b\",\"reason\":\"r\",\"authority_token\":\"t\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/v1/suspensions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"r\",\"authority_token\":\"t\"}"))
                .andExpect(status().isBadRequest());

        verify(suspensions, never()).suspend(any(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("a missing reason returns 400")
    void reasonRequired() throws Exception {
        mockMvc.perform(post("/api/v1/suspensions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"artifact_id\":\"a\",\"authority_token\":\"t\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("an invalid authority token returns 401")
    void invalidToken() throws Exception {
        when(suspensions.suspend(any(), anyString(), anyString(), anyString()))
                .thenThrow(new ProvenantException(ErrorCode.UNAUTHORIZED, "Invalid suspension authority token"));

        mockMvc.perform(post("/api/v1/suspensions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"artifact_id\":\"a\",\"reason\":\"r\",\"authority_token\":\"forged\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("GET /suspensions/{artifactId} reports suspension status")
    void reportsSuspensionStatus() throws Exception {
        when(suspensions.isSuspended(ARTIFACT)).thenReturn(true);

        mockMvc.perform(get("/api/v1/suspensions/" + ARTIFACT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artifact_id").value(ARTIFACT))
                .andExpect(jsonPath("$.suspended").value(true));
    }
}
