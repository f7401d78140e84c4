package arachne_chat_gateway.session;

import arachne_chat_gateway.dto.response.RefreshTokenResponse;
import arachne_chat_gateway.exceptions.AuthException;
import arachne_chat_gateway.exceptions.RefreshException;
import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.model.TokenClaims;
import arachne_chat_gateway.model.TokenPair;
import arachne_chat_gateway.model.TokenVerificationResult;
import arachne_chat_gateway.security.TokenVerifier;
import arachne_chat_gateway.service.BackendAuthClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@org.mockito.junit.jupiter.MockitoSettings(strictness = org.mockito.quality.Strictness.LENIENT)
class SessionRefresherTest {

    private static final long EXPIRES_AT = Instant.parse("2026-10-19T13:00:00Z").getEpochSecond();

    @Mock
    private BackendAuthClient backendAuthClient;

    @Mock
    private TokenVerifier tokenVerifier;

    private SessionStore store;
    private SessionRefresher refresher;

    @BeforeEach
    void setUp() {
        store = new SessionStore();
        refresher = new SessionRefresher(store, backendAuthClient, tokenVerifier, 300);
        when(tokenVerifier.verify(anyString()))
                .thenReturn(TokenVerificationResult.invalid("Assinatura inválida"));
    }

    @Test
    void shouldRotateTokensOnSuccessfulRefresh() {
        store.seedRefreshToken("refresh-1");
        when(backendAuthClient.refresh("refresh-1"))
                .thenReturn(new RefreshTokenResponse("access-2", "refresh-2", "bearer"));
        when(tokenVerifier.verify("access-2")).thenReturn(TokenVerificationResult.valid(accessClaims("user-1")));

        RefreshOutcome outcome = refresher.refresh();

        assertTrue(outcome.isOk());
        assertTrue(outcome.getSession().isAuthenticated());
        assertEquals("user-1", outcome.getSession().getSubject());
        assertEquals("access-2", store.accessToken().orElseThrow());
        assertEquals("refresh-2", store.refreshToken().orElseThrow());
        assertFalse(refresher.isRefreshInFlight());
    }

    @Test
    void shouldKeepRefreshTokenWhenBackendDoesNotRotateIt() {
        store.seedRefreshToken("refresh-1");
        when(backendAuthClient.refresh("refresh-1"))
                .thenReturn(new RefreshTokenResponse("access-2", null, "bearer"));
        when(tokenVerifier.verify("access-2")).thenReturn(TokenVerificationResult.valid(accessClaims("user-1")));

        assertTrue(refresher.refresh().isOk());
        assertEquals("refresh-1", store.refreshToken().orElseThrow());
    }

    @Test
    void shouldClearStoreWhenBackendRejectsRefreshToken() {
        store.rotate(new TokenPair("access-1", "refresh-1"), accessClaims("user-1"));
        when(backendAuthClient.refresh("refresh-1"))
                .thenThrow(new RefreshException("Refresh token rejeitado pelo backend", true));

        RefreshOutcome outcome = refresher.refresh();

        assertFalse(outcome.isOk());
        assertTrue(outcome.isRejected());
        assertFalse(store.current().isAuthenticated());
        assertTrue(store.accessToken().isEmpty());
        assertTrue(store.refreshToken().isEmpty());
    }

    @Test
    void shouldClearStoreWhenBackendIsUnreachable() {
        store.seedRefreshToken("refresh-1");
        when(backendAuthClient.refresh("refresh-1"))
                .thenThrow(new RefreshException("Falha ao contatar o backend", false));

        RefreshOutcome outcome = refresher.refresh();

        assertFalse(outcome.isOk());
        assertFalse(outcome.isRejected());
        assertTrue(store.refreshToken().isEmpty());
    }

    @Test
    void shouldFailWhenIssuedAccessTokenCannotBeVerified() {
        store.seedRefreshToken("refresh-1");
        when(backendAuthClient.refresh("refresh-1"))
                .thenReturn(new RefreshTokenResponse("forged", "refresh-2", "bearer"));

        RefreshOutcome outcome = refresher.refresh();

        assertFalse(outcome.isOk());
        assertTrue(store.refreshToken().isEmpty());
    }

    @Test
    void shouldFailWithoutRefreshToken() {
        RefreshOutcome outcome = refresher.refresh();

        assertFalse(outcome.isOk());
        assertTrue(outcome.isRejected());
        verify(backendAuthClient, never()).refresh(anyString());
    }

    @Test
    void shouldShareSingleBackendCallBetweenConcurrentRefreshes() throws Exception {
        store.seedRefreshToken("refresh-1");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(backendAuthClient.refresh("refresh-1")).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return new RefreshTokenResponse("access-2", "refresh-2", "bearer");
        });
        when(tokenVerifier.verify("access-2")).thenReturn(TokenVerificationResult.valid(accessClaims("user-1")));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<RefreshOutcome>> results = new ArrayList<>();
            results.add(executor.submit(refresher::refresh));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(refresher.isRefreshInFlight());
            for (int i = 0; i < 7; i++) {
                results.add(executor.submit(refresher::refresh));
            }
            Thread.sleep(200);
            release.countDown();

            for (Future<RefreshOutcome> result : results) {
                RefreshOutcome outcome = result.get(5, TimeUnit.SECONDS);
                assertTrue(outcome.isOk());
                assertEquals("user-1", outcome.getSession().getSubject());
            }
        } finally {
            executor.shutdownNow();
        }

        verify(backendAuthClient, times(1)).refresh(anyString());
        assertFalse(refresher.isRefreshInFlight());
    }

    @Test
    void shouldReturnCurrentSessionWhenAccessTokenIsStillFresh() {
        store.rotate(new TokenPair("access-1", "refresh-1"), accessClaims("user-1"));
        when(tokenVerifier.isExpired(any(TokenClaims.class), anyLong())).thenReturn(false);

        Session session = refresher.ensureFresh();

        assertEquals("user-1", session.getSubject());
        verify(backendAuthClient, never()).refresh(anyString());
    }

    @Test
    void shouldRefreshWhenAccessTokenIsInsideBuffer() {
        store.rotate(new TokenPair("access-1", "refresh-1"), accessClaims("user-1"));
        when(tokenVerifier.isExpired(any(TokenClaims.class), eq(300L))).thenReturn(true);
        when(backendAuthClient.refresh("refresh-1"))
                .thenReturn(new RefreshTokenResponse("access-2", "refresh-2", "bearer"));
        when(tokenVerifier.verify("access-2")).thenReturn(TokenVerificationResult.valid(accessClaims("user-1")));

        Session session = refresher.ensureFresh();

        assertTrue(session.isAuthenticated());
        assertEquals("access-2", store.accessToken().orElseThrow());
    }

    @Test
    void shouldNotCallBackendWhenThereIsNothingToRefresh() {
        Session session = refresher.ensureFresh();

        assertFalse(session.isAuthenticated());
        verify(backendAuthClient, never()).refresh(anyString());
    }

    @Test
    void shouldClearStoreOnLogoutEvenWhenBackendFails() {
        store.rotate(new TokenPair("access-1", "refresh-1"), accessClaims("user-1"));
        doThrow(new AuthException("Backend não confirmou o logout")).when(backendAuthClient).notifyLogout("refresh-1");

        refresher.logout();

        assertFalse(store.current().isAuthenticated());
        assertTrue(store.refreshToken().isEmpty());
        verify(backendAuthClient).notifyLogout("refresh-1");
    }

    @Test
    void shouldKeepSessionClearedWhenRefreshInFlightSettlesAfterLogout() throws Exception {
        store.rotate(new TokenPair("access-1", "refresh-1"), accessClaims("user-1"));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(backendAuthClient.refresh("refresh-1")).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return new RefreshTokenResponse("access-2", "refresh-2", "bearer");
        });
        when(tokenVerifier.verify("access-2")).thenReturn(TokenVerificationResult.valid(accessClaims("user-1")));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RefreshOutcome> pending = executor.submit(refresher::refresh);
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            refresher.logout();
            assertFalse(store.current().isAuthenticated());
            release.countDown();

            RefreshOutcome outcome = pending.get(5, TimeUnit.SECONDS);
            assertFalse(outcome.isOk());
            assertFalse(outcome.getSession().isAuthenticated());
        } finally {
            executor.shutdownNow();
        }

        assertFalse(store.current().isAuthenticated());
        assertTrue(store.accessToken().isEmpty());
        assertTrue(store.refreshToken().isEmpty());
        verify(backendAuthClient).notifyLogout("refresh-1");
    }

    @Test
    void shouldNotClearNewSessionWhenStaleRefreshFails() throws Exception {
        store.rotate(new TokenPair("access-1", "refresh-1"), accessClaims("user-1"));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(backendAuthClient.refresh("refresh-1")).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            throw new RefreshException("Refresh token revogado", true);
        });
        when(tokenVerifier.verify("access-9")).thenReturn(TokenVerificationResult.valid(accessClaims("user-1")));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RefreshOutcome> pending = executor.submit(refresher::refresh);
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            refresher.logout();
            refresher.establish(new TokenPair("access-9", "refresh-9"));
            release.countDown();

            assertFalse(pending.get(5, TimeUnit.SECONDS).isOk());
        } finally {
            executor.shutdownNow();
        }

        assertTrue(store.current().isAuthenticated());
        assertEquals("access-9", store.accessToken().orElseThrow());
        assertEquals("refresh-9", store.refreshToken().orElseThrow());
    }

    @Test
    void shouldSkipBackendOnLogoutWithoutRefreshToken() {
        refresher.logout();

        verify(backendAuthClient, never()).notifyLogout(anyString());
        assertFalse(store.current().isAuthenticated());
    }

    @Test
    void shouldEstablishSessionFromPresentedAccessToken() {
        when(tokenVerifier.verify("access-1")).thenReturn(TokenVerificationResult.valid(accessClaims("user-1")));

        Session session = refresher.establish(new TokenPair("access-1", "refresh-1"));

        assertTrue(session.isAuthenticated());
        assertEquals("refresh-1", store.refreshToken().orElseThrow());
    }

    @Test
    void shouldSeedOnlyRefreshTokenWhenAccessTokenIsInvalid() {
        Session session = refresher.establish(new TokenPair("expired", "refresh-1"));

        assertFalse(session.isAuthenticated());
        assertTrue(store.accessToken().isEmpty());
        assertEquals("refresh-1", store.refreshToken().orElseThrow());
    }

    @Test
    void shouldNotOverwriteExistingSessionWhenEstablishing() {
        store.rotate(new TokenPair("access-1", "refresh-1"), accessClaims("user-1"));

        refresher.establish(new TokenPair("access-other", "refresh-other"));

        assertEquals("access-1", store.accessToken().orElseThrow());
        verify(tokenVerifier, never()).verify("access-other");
    }

    @Test
    void shouldRejectRefreshTypeTokenPresentedAsAccessToken() {
        TokenClaims refreshClaims = TokenClaims.builder()
                .subject("user-1").tokenType(TokenClaims.TYPE_REFRESH).expiresAt(EXPIRES_AT).build();
        when(tokenVerifier.verify("refresh-as-access")).thenReturn(TokenVerificationResult.valid(refreshClaims));

        Session session = refresher.establish(new TokenPair("refresh-as-access", null));

        assertFalse(session.isAuthenticated());
    }

    private static TokenClaims accessClaims(String subject) {
        return TokenClaims.builder()
                .subject(subject)
                .tokenType(TokenClaims.TYPE_ACCESS)
                .role("user")
                .superuser(false)
                .expiresAt(EXPIRES_AT)
                .build();
    }
}
