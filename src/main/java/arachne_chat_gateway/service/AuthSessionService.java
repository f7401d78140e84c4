package arachne_chat_gateway.service;

import arachne_chat_gateway.chat.ClientContext;
import arachne_chat_gateway.chat.ClientContextRegistry;
import arachne_chat_gateway.dto.response.SessionResponse;
import arachne_chat_gateway.exceptions.AuthException;
import arachne_chat_gateway.exceptions.RefreshException;
import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.model.TokenClaims;
import arachne_chat_gateway.model.TokenPair;
import arachne_chat_gateway.security.AuthenticatedUser;
import arachne_chat_gateway.security.TokenVerifier;
import arachne_chat_gateway.session.RefreshOutcome;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * The refresh/logout boundary: maps a request onto its client context and mirrors the context's token pair
 * into cookies.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthSessionService {

    private final ClientContextRegistry clientContextRegistry;
    private final TokenVerifier tokenVerifier;
    private final CookieService cookieService;
    private final GatewayMetricsService gatewayMetricsService;

    /**
     * Finds the context of the caller. Only a verified access token, or a verified refresh token when no
     * access token is accepted, can select a context.
     */
    public Optional<ClientContext> resolveContext(HttpServletRequest request) {
        TokenPair presented = cookieService.readPresented(request);
        Optional<String> subject = AuthenticatedUser.currentClaims().map(TokenClaims::getSubject);
        if (subject.isEmpty() && presented.hasRefreshToken()) {
            subject = tokenVerifier.verify(presented.getRefreshToken()).claims()
                    .filter(TokenClaims::isRefreshToken)
                    .map(TokenClaims::getSubject);
        }
        if (subject.isEmpty()) {
            return Optional.empty();
        }
        ClientContext context = clientContextRegistry.resolve(subject.get());
        context.getSessionRefresher().establish(presented);
        return Optional.of(context);
    }

    /**
     * Context of an authenticated caller with an access token that outlives the refresh buffer.
     *
     * @throws AuthException when no valid session can be produced; the cookies are cleared
     */
    public ClientContext requireFreshContext(HttpServletRequest request, HttpServletResponse response) {
        ClientContext context = resolveContext(request).orElseThrow(() -> {
            cookieService.clearSessionCookies(response);
            return new AuthException("Sessão inválida ou expirada");
        });

        if (!freshen(context, request, response).isAuthenticated()) {
            throw new AuthException("Sessão inválida ou expirada");
        }
        return context;
    }

    public SessionResponse refresh(HttpServletRequest request, HttpServletResponse response) {
        Optional<ClientContext> context = resolveContext(request);
        if (context.isEmpty()) {
            cookieService.clearSessionCookies(response);
            gatewayMetricsService.recordRefresh("rejected");
            throw new RefreshException("Refresh token ausente ou inválido", true);
        }

        RefreshOutcome outcome = context.get().getSessionRefresher().refresh();
        if (!outcome.isOk()) {
            cookieService.clearSessionCookies(response);
            gatewayMetricsService.recordRefresh(outcome.isRejected() ? "rejected" : "failed");
            throw new RefreshException("Não foi possível renovar a sessão", outcome.isRejected());
        }

        cookieService.writeSessionCookies(response, context.get().getSessionStore().tokens());
        gatewayMetricsService.recordRefresh("ok");
        return toResponse(outcome.getSession());
    }

    /**
     * Clears the local session and cookies whatever happens with the backend notification.
     */
    public void logout(HttpServletRequest request, HttpServletResponse response) {
        try {
            resolveContext(request).ifPresent(context -> context.getSessionRefresher().logout());
        } finally {
            cookieService.clearSessionCookies(response);
            gatewayMetricsService.recordLogout();
        }
    }

    public SessionResponse currentSession(HttpServletRequest request, HttpServletResponse response) {
        Optional<ClientContext> context = resolveContext(request);
        if (context.isEmpty()) {
            return SessionResponse.unauthenticated();
        }
        Session session = freshen(context.get(), request, response);
        return toResponse(session);
    }

    /**
     * Ensures the context's access token outlives the refresh buffer and mirrors the store's pair into the
     * cookies whenever the caller presented a different one, such as a second device still holding a refresh
     * token the shared context already rotated away.
     */
    private Session freshen(ClientContext context, HttpServletRequest request, HttpServletResponse response) {
        Session session = context.getSessionRefresher().ensureFresh();
        if (!session.isAuthenticated()) {
            cookieService.clearSessionCookies(response);
            return session;
        }
        TokenPair current = context.getSessionStore().tokens();
        if (!current.equals(cookieService.readPresented(request))) {
            cookieService.writeSessionCookies(response, current);
        }
        return session;
    }

    public SessionResponse toResponse(Session session) {
        if (session == null || !session.isAuthenticated()) {
            return SessionResponse.unauthenticated();
        }
        Long expiresIn = null;
        if (session.getExpiresAt() != null) {
            expiresIn = tokenVerifier.secondsUntilExpiry(TokenClaims.builder()
                    .expiresAt(session.getExpiresAt().getEpochSecond())
                    .build());
        }
        return SessionResponse.builder()
                .authenticated(true)
                .subject(session.getSubject())
                .role(session.getRole())
                .superuser(session.isSuperuser())
                .admin(TokenVerifier.isAdmin(session))
                .expiresAt(session.getExpiresAt())
                .expiresInSeconds(expiresIn)
                .build();
    }
}
