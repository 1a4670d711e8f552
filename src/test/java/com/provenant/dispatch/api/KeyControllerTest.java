package com.provenant.dispatch.api;

import com.provenant.core.error.AuthorizationMismatchException;
import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.KeyRevokedException;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.keys.KeyCeremony;
import com.provenant.core.keys.KeyHierarchyManager;
import com.provenant.core.model.KeyRecord;
import com.provenant.core.model.KeyRole;
import com.provenant.core.model.KeyState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(KeyController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class KeyControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private KeyHierarchyManager keyManager;

    private static KeyRecord key(String id, KeyRole role, String parent, KeyState state) {
        return new KeyRecord(id, role, "dk.digst.mitid", "hsm-" + id, "MCowBQYDK2VwAyEA", "Ed25519",
                parent, NOW, state, state == KeyState.REVOKED ? NOW : null);
    }

    @Test
    @DisplayName("POST /keys runs the ceremony and returns 201")
    void createKey() throws Exception {
        when(keyManager.createKey(any())).thenReturn(key("key-app", KeyRole.APP_SIGNING, "key-repo", KeyState.ACTIVE));

        mockMvc.perform(post("/api/v1/keys").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"APP_SIGNING\",\"scope\":\"dk.digst.mitid\","
                                + "\"parent_key_id\":\"key-repo\",\"approvals\":[\"jws-a\",\"jws-b\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.key_id").value("key-app"))
                .andExpect(jsonPath("$.parent_key_id").value("key-repo"))
                .andExpect(jsonPath("$.hsm_handle").value("hsm-key-app"))
                .andExpect(jsonPath("$.state").value("ACTIVE"));

        ArgumentCaptor<KeyCeremony> captor = ArgumentCaptor.forClass(KeyCeremony.class);
        verify(keyManager).createKey(captor.capture());
        assertEquals(KeyRole.APP_SIGNING, captor.getValue().role());
        assertEquals(List.of("jws-a", "jws-b"), captor.getValue().approvals());
    }

    @Test
    @DisplayName("POST /keys without a role returns 400")
    void createKeyWithoutRole() throws Exception {
        mockMvc.perform(post("/api/v1/keys").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"dk.digst.mitid\",\"approvals\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /keys under a revoked parent returns 403")
    void createKeyUnderRevokedParent() throws Exception {
        when(keyManager.createKey(any())).thenThrow(new KeyRevokedException("key-repo", "key-repo"));

        mockMvc.perform(post("/api/v1/keys").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"APP_SIGNING\",\"scope\":\"x\",\"parent_key_id\":\"key-repo\",\"approvals\":[]}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("KEY_REVOKED"));
    }

    @Test
    @DisplayName("POST /keys with missing ceremony approvals returns 403")
    void createKeyWithoutCeremony() throws Exception {
        when(keyManager.createKey(any())).thenThrow(new AuthorizationMismatchException("Missing approval from bob"));

        mockMvc.perform(post("/api/v1/keys").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\":\"ROOT\",\"scope\":\"provenant\",\"approvals\":[\"jws-a\"]}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("AUTHORIZATION_MISMATCH"));
    }

    @Test
    @DisplayName("POST /keys/{id}/revoke revokes with approvals")
    void revokeKey() throws Exception {
        when(keyManager.revoke(eq("key-app"), eq(List.of("jws-a", "jws-b")), eq("compromised")))
                .thenReturn(key("key-app", KeyRole.APP_SIGNING, "key-repo", KeyState.REVOKED));

        mockMvc.perform(post("/api/v1/keys/key-app/revoke").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"compromised\",\"approvals\":[\"jws-a\",\"jws-b\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("REVOKED"))
                .andExpect(jsonPath("$.revoked_at").exists());
    }

    @Test
    @DisplayName("revoking twice returns 409")
    void revokeTwice() throws Exception {
        when(keyManager.revoke(eq("key-app"), anyList(), eq("again")))
                .thenThrow(ProvenantException.conflict("Key key-app is already revoked"));

        mockMvc.perform(post("/api/v1/keys/key-app/revoke").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"again\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("GET /keys lists the hierarchy")
    void listKeys() throws Exception {
        when(keyManager.list()).thenReturn(List.of(
                key("key-root", KeyRole.ROOT, null, KeyState.ACTIVE),
                key("key-repo", KeyRole.REPOSITORY_SIGNING, "key-root", KeyState.ACTIVE)));

        mockMvc.perform(get("/api/v1/keys"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].role").value("REPOSITORY_SIGNING"));
    }

    @Test
    @DisplayName("GET /keys/{id} for an unknown key returns 404")
    void getUnknownKey() throws Exception {
        when(keyManager.get("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/keys/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(ErrorCode.NOT_FOUND.name()));
    }
}
