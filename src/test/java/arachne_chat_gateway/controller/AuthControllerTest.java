package arachne_chat_gateway.controller;

import arachne_chat_gateway.dto.response.SessionResponse;
import arachne_chat_gateway.exceptions.RefreshException;
import arachne_chat_gateway.security.AccessTokenFilter;
import arachne_chat_gateway.service.AuthSessionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AuthController.class,
        excludeAutoConfiguration = {
            org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration.class
        })
@AutoConfigureMockMvc(addFilters = false)
@org.springframework.context.annotation.Import(arachne_chat_gateway.exceptions.GlobalExceptionHandler.class)
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthSessionService authSessionService;

    @MockBean
    private AccessTokenFilter accessTokenFilter;

    @Test
    void shouldReturnRefreshedSession() throws Exception {
        SessionResponse session = SessionResponse.builder()
                .authenticated(true)
                .subject("user-1")
                .role("user")
                .admin(false)
                .expiresAt(Instant.parse("2026-10-19T12:30:00Z"))
                .expiresInSeconds(1800L)
                .build();
        when(authSessionService.refresh(any(), any())).thenReturn(session);

        mockMvc.perform(post("/api/auth/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true))
                .andExpect(jsonPath("$.subject").value("user-1"))
                .andExpect(jsonPath("$.expiresInSeconds").value(1800));

        verify(authSessionService, times(1)).refresh(any(), any());
    }

    @Test
    void shouldAnswerUnauthorizedWhenRefreshIsRejected() throws Exception {
        when(authSessionService.refresh(any(), any()))
                .thenThrow(new RefreshException("Refresh token rejeitado pelo backend", true));

        mockMvc.perform(post("/api/auth/refresh"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Não autenticado"))
                .andExpect(jsonPath("$.message").value("Sessão expirada. Faça login novamente."));
    }

    @Test
    void shouldLogoutWithNoContent() throws Exception {
        mockMvc.perform(post("/api/auth/logout"))
                .andExpect(status().isNoContent());

        verify(authSessionService).logout(any(), any());
    }

    @Test
    void shouldReportUnauthenticatedSession() throws Exception {
        when(authSessionService.currentSession(any(), any())).thenReturn(SessionResponse.unauthenticated());

        mockMvc.perform(get("/api/auth/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false))
                .andExpect(jsonPath("$.subject").doesNotExist());
    }
}
