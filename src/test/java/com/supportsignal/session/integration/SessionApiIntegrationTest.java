package com.supportsignal.session.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportsignal.session.domain.UserRole;
import com.supportsignal.session.util.CorrelationIdFilter;
import com.supportsignal.session.util.RequestTokens;

/**
 * HTTP surface: status codes, error bodies, token headers and the security
 * filter chain.
 */
@AutoConfigureMockMvc
class SessionApiIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private Long adminId;
    private Long workerId;

    @BeforeEach
    void setUpUsers() {
        adminId = createUser("admin@supportsignal.test", UserRole.SYSTEM_ADMIN);
        workerId = createUser("worker@acme.test", UserRole.FRONTLINE_WORKER);
    }

    // =========================================================================
    // Sessions
    // =========================================================================

    @Test
    void createAndValidate_ShouldRoundTripThroughHeaders() throws Exception {
        // Given
        String token = login(workerId);

        // When / Then
        mockMvc.perform(get("/api/sessions/validate").header(RequestTokens.SESSION_TOKEN_HEADER, token))
            .andExpect(status().isOk())
            .andExpect(header().exists(CorrelationIdFilter.CORRELATION_ID_HEADER))
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.user.id").value(workerId))
            .andExpect(jsonPath("$.session.sessionId").isNumber())
            .andExpect(jsonPath("$.correlationId").isString());

        mockMvc.perform(get("/api/sessions/validate").header("Authorization", "Bearer " + token))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true));
    }

    @Test
    void validate_WithoutToken_ShouldAnswerInvalidNotError() throws Exception {
        mockMvc.perform(get("/api/sessions/validate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false))
            .andExpect(jsonPath("$.reason").value("Session not found"));
    }

    @Test
    void createSession_UnknownUser_ShouldReturnNotFound() throws Exception {
        mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\": 999999}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("NotFound"))
            .andExpect(jsonPath("$.message").value("User not found"));
    }

    @Test
    void createSession_MissingUserId_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rememberMe\": true}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void refresh_ExpiredSession_ShouldReturnUnauthorized() throws Exception {
        String token = login(workerId);
        clock.advance(Duration.ofHours(25));

        mockMvc.perform(post("/api/sessions/refresh").header(RequestTokens.SESSION_TOKEN_HEADER, token))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Expired"));
    }

    @Test
    void invalidate_ShouldSucceedTwice() throws Exception {
        String token = login(workerId);

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/sessions/invalidate")
                    .header(RequestTokens.SESSION_TOKEN_HEADER, token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"reason\": \"Password changed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        }
    }

    @Test
    void workflowState_ShouldBeSavedAndRecovered() throws Exception {
        String token = login(workerId);

        mockMvc.perform(put("/api/sessions/workflow-state")
                .header(RequestTokens.SESSION_TOKEN_HEADER, token)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflowType\": \"CHAT_SESSION\", \"workflowData\": {\"threadId\": \"t-9\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.workflowType").value("chat_session"));

        mockMvc.perform(get("/api/sessions/workflow-state")
                .header(RequestTokens.SESSION_TOKEN_HEADER, token)
                .param("workflowType", "CHAT_SESSION"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.found").value(true))
            .andExpect(jsonPath("$.workflowState.chat_session.threadId").value("t-9"));
    }

    // =========================================================================
    // Security chain
    // =========================================================================

    @Test
    void me_WithoutToken_ShouldReturnUnauthorized() throws Exception {
        mockMvc.perform(get("/api/sessions/me"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void me_WithRegularToken_ShouldDescribeOwner() throws Exception {
        String token = login(workerId);

        mockMvc.perform(get("/api/sessions/me").header(RequestTokens.SESSION_TOKEN_HEADER, token))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.userId").value(workerId))
            .andExpect(jsonPath("$.role").value("FRONTLINE_WORKER"))
            .andExpect(jsonPath("$.impersonating").value(false));
    }

    @Test
    void cleanup_ShouldRequireSystemAdmin() throws Exception {
        String workerToken = login(workerId);
        String adminToken = login(adminId);

        mockMvc.perform(post("/api/sessions/cleanup").header(RequestTokens.SESSION_TOKEN_HEADER, workerToken))
            .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/sessions/cleanup").header(RequestTokens.SESSION_TOKEN_HEADER, adminToken))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cleanedCount").value(0));
    }

    // =========================================================================
    // Impersonation
    // =========================================================================

    @Test
    void impersonation_ShouldSwitchEffectiveUserUntilEnded() throws Exception {
        // Given
        String adminToken = login(adminId);

        // When
        MvcResult started = mockMvc.perform(post("/api/impersonation/start")
                .header(RequestTokens.SESSION_TOKEN_HEADER, adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUserEmail\": \"worker@acme.test\", \"reason\": \"Ticket 4411\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.targetUser.id").value(workerId))
            .andReturn();
        String impersonationToken = readField(started, "impersonationToken");

        // Then
        mockMvc.perform(get("/api/sessions/me").header(RequestTokens.SESSION_TOKEN_HEADER, impersonationToken))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.userId").value(workerId))
            .andExpect(jsonPath("$.impersonating").value(true))
            .andExpect(jsonPath("$.impersonatorId").value(adminId));

        mockMvc.perform(get("/api/impersonation/status").header(RequestTokens.SESSION_TOKEN_HEADER, impersonationToken))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.adminUser.id").value(adminId))
            .andExpect(jsonPath("$.reason").value("Ticket 4411"));

        MvcResult ended = mockMvc.perform(post("/api/impersonation/end")
                .header(RequestTokens.SESSION_TOKEN_HEADER, impersonationToken))
            .andExpect(status().isOk())
            .andReturn();
        assertThat(readField(ended, "originalSessionToken")).isEqualTo(adminToken);

        mockMvc.perform(get("/api/sessions/me").header(RequestTokens.SESSION_TOKEN_HEADER, impersonationToken))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void startImpersonation_ByWorker_ShouldReturnForbidden() throws Exception {
        String workerToken = login(workerId);

        mockMvc.perform(post("/api/impersonation/start")
                .header(RequestTokens.SESSION_TOKEN_HEADER, workerToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUserEmail\": \"admin@supportsignal.test\", \"reason\": \"curious\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("Forbidden"));

        assertThat(countRows("SELECT COUNT(*) FROM impersonation_sessions")).isZero();
    }

    @Test
    void startImpersonation_WithoutReason_ShouldReturnBadRequest() throws Exception {
        String adminToken = login(adminId);

        mockMvc.perform(post("/api/impersonation/start")
                .header(RequestTokens.SESSION_TOKEN_HEADER, adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUserEmail\": \"worker@acme.test\", \"reason\": \"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("InvalidRequest"))
            .andExpect(jsonPath("$.message").value("Impersonation reason is required"));
    }

    @Test
    void endImpersonation_UnknownToken_ShouldReturnNotFound() throws Exception {
        mockMvc.perform(post("/api/impersonation/end").header(RequestTokens.SESSION_TOKEN_HEADER, "imp_nothing"))
            .andExpect(status().isNotFound());
    }

    @Test
    void emergencyTerminate_ShouldReportCount() throws Exception {
        String adminToken = login(adminId);
        mockMvc.perform(post("/api/impersonation/start")
                .header(RequestTokens.SESSION_TOKEN_HEADER, adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetUserEmail\": \"worker@acme.test\", \"reason\": \"Ticket\"}"))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/api/impersonation/emergency-terminate").header(RequestTokens.SESSION_TOKEN_HEADER, adminToken))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.terminatedCount").value(1));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private String login(Long userId) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\": " + userId + ", \"deviceType\": \"desktop\"}"))
            .andExpect(status().isCreated())
            .andReturn();
        return readField(result, "sessionToken");
    }

    private String readField(MvcResult result, String field) throws Exception {
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get(field).asText();
    }
}
