package com.provenant.dispatch.api;

import com.provenant.core.keys.KeyHierarchyManager;
import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.SignedArtifact;
import com.provenant.core.signing.ArtifactRegistry;
import com.provenant.core.suspension.SuspensionController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ArtifactController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ArtifactControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String DIGEST = "sha256:" + "ef".repeat(32);
    private static final ArtifactSignature SIGNATURE =
            new ArtifactSignature("key-app", "Ed25519", DIGEST, "c2lnbmF0dXJl", NOW);
    private static final SignedArtifact ARTIFACT =
            new SignedArtifact(DIGEST, "dk.digst.mitid", "job-1", "sr-1", 1024, SIGNATURE, NOW);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ArtifactRegistry registry;

    @MockitoBean
    private SuspensionController suspensions;

    @MockitoBean
    private KeyHierarchyManager keyManager;

    @Test
    @DisplayName("GET /artifacts/{id} returns the record and suspension flag")
    void getArtifact() throws Exception {
        when(registry.find(DIGEST)).thenReturn(Optional.of(ARTIFACT));
        when(suspensions.isSuspended(DIGEST)).thenReturn(false);

        mockMvc.perform(get("/api/v1/artifacts/" + DIGEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artifact.artifact_id").value(DIGEST))
                .andExpect(jsonPath("$.artifact.signature.key_id").value("key-app"))
                .andExpect(jsonPath("$.suspended").value(false));
    }

    @Test
    @DisplayName("GET /artifacts/{id}/verification checks the signature")
    void verifySignature() throws Exception {
        when(registry.find(DIGEST)).thenReturn(Optional.of(ARTIFACT));
        when(keyManager.verify(SIGNATURE, DIGEST)).thenReturn(true);

        mockMvc.perform(get("/api/v1/artifacts/" + DIGEST + "/verification"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key_id").value("key-app"))
                .andExpect(jsonPath("$.valid").value(true));
    }

    @Test
    @DisplayName("GET /artifacts/{id} for an unpublished artifact returns 404")
    void unknownArtifact() throws Exception {
        when(registry.find("sha256:00")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/artifacts/sha256:00"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /artifacts/applications/{id} lists published artifacts")
    void forApplication() throws Exception {
        when(registry.forApplication("dk.digst.mitid")).thenReturn(List.of(ARTIFACT));

        mockMvc.perform(get("/api/v1/artifacts/applications/dk.digst.mitid"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].job_id").value("job-1"));
    }
}
