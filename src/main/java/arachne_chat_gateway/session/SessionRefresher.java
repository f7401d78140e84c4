package arachne_chat_gateway.session;

import arachne_chat_gateway.dto.response.RefreshTokenResponse;
import arachne_chat_gateway.exceptions.RefreshException;
import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.model.TokenClaims;
import arachne_chat_gateway.model.TokenPair;
import arachne_chat_gateway.model.TokenVerificationResult;
import arachne_chat_gateway.security.TokenVerifier;
import arachne_chat_gateway.service.BackendAuthClient;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The only writer of a {@link SessionStore}.
 *
 * <p>Concurrent refresh requests for the same store collapse into a single backend call whose outcome every
 * caller observes.
 */
@Slf4j
public class SessionRefresher {

    private final SessionStore store;
    private final BackendAuthClient backendAuthClient;
    private final TokenVerifier tokenVerifier;
    private final long refreshBufferSeconds;
    private final AtomicReference<CompletableFuture<RefreshOutcome>> inFlight = new AtomicReference<>();

    public SessionRefresher(SessionStore store,
                            BackendAuthClient backendAuthClient,
                            TokenVerifier tokenVerifier,
                            long refreshBufferSeconds) {
        this.store = store;
        this.backendAuthClient = backendAuthClient;
        this.tokenVerifier = tokenVerifier;
        this.refreshBufferSeconds = refreshBufferSeconds;
    }

    /**
     * Seeds an empty store from tokens presented by the client. A store that already holds a session, or at
     * least a refresh token, is authoritative and left untouched.
     */
    public synchronized Session establish(TokenPair presented) {
        if (store.current().isAuthenticated() || store.refreshToken().isPresent() || presented == null) {
            return store.current();
        }
        if (presented.hasAccessToken()) {
            TokenVerificationResult result = tokenVerifier.verify(presented.getAccessToken());
            Optional<TokenClaims> claims = result.claims().filter(TokenClaims::isAccessToken);
            if (claims.isPresent()) {
                store.rotate(presented, claims.get());
                log.debug("Session established from presented access token");
                return store.current();
            }
        }
        if (presented.hasRefreshToken()) {
            store.seedRefreshToken(presented.getRefreshToken());
            log.debug("Store seeded with presented refresh token only");
        }
        return store.current();
    }

    public RefreshOutcome refresh() {
        CompletableFuture<RefreshOutcome> ticket = new CompletableFuture<>();
        CompletableFuture<RefreshOutcome> running = inFlight.compareAndExchange(null, ticket);
        if (running != null) {
            log.debug("Joining refresh already in flight");
            return running.join();
        }

        RefreshOutcome outcome = RefreshOutcome.failed(false);
        try {
            outcome = rotate();
        } finally {
            inFlight.set(null);
            ticket.complete(outcome);
        }
        return outcome;
    }

    /**
     * Returns a session whose access token outlives the refresh buffer, refreshing first when needed.
     */
    public Session ensureFresh() {
        Session current = store.current();
        TokenClaims claims = store.accessClaims().orElse(null);
        if (current.isAuthenticated() && !tokenVerifier.isExpired(claims, refreshBufferSeconds)) {
            return current;
        }
        if (!current.isAuthenticated() && store.refreshToken().isEmpty()) {
            return current;
        }
        return refresh().getSession();
    }

    /**
     * Notifies the backend (best effort) and clears the store whatever the backend answers.
     */
    public void logout() {
        Optional<String> refreshToken = store.refreshToken();
        try {
            refreshToken.ifPresent(backendAuthClient::notifyLogout);
        } catch (RuntimeException e) {
            log.warn("Logout notification failed, clearing local session anyway: {}", e.getMessage());
        } finally {
            store.clear();
        }
    }

    public boolean isRefreshInFlight() {
        return inFlight.get() != null;
    }

    private RefreshOutcome rotate() {
        long generation = store.generation();
        Optional<String> currentRefreshToken = store.refreshToken();
        if (currentRefreshToken.isEmpty()) {
            log.info("Refresh requested without a refresh token, clearing session");
            store.clear();
            return RefreshOutcome.failed(true);
        }

        try {
            RefreshTokenResponse response = backendAuthClient.refresh(currentRefreshToken.get());
            TokenVerificationResult verified = tokenVerifier.verify(response.getAccessToken());
            TokenClaims claims = verified.claims()
                    .filter(TokenClaims::isAccessToken)
                    .orElseThrow(() -> new RefreshException(
                        "Access token emitido pelo backend não pôde ser verificado: " + verified.getError(), false));

            String nextRefreshToken = response.getRefreshToken() != null && !response.getRefreshToken().isBlank()
                    ? response.getRefreshToken()
                    : currentRefreshToken.get();
            if (!store.rotateIfCurrent(generation, new TokenPair(response.getAccessToken(), nextRefreshToken), claims)) {
                log.info("Session was cleared while refreshing, discarding rotated tokens");
                return RefreshOutcome.failed(true);
            }
            log.info("Session refreshed for subject {}", claims.getSubject());
            return RefreshOutcome.ok(store.current());
        } catch (RuntimeException e) {
            boolean rejected = e instanceof RefreshException && ((RefreshException) e).isRejected();
            log.warn("Refresh failed (rejected={}), clearing session: {}", rejected, e.getMessage());
            store.clearIfCurrent(generation);
            return RefreshOutcome.failed(rejected);
        }
    }
}
