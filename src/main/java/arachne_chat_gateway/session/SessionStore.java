package arachne_chat_gateway.session;

import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.model.TokenClaims;
import arachne_chat_gateway.model.TokenPair;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the token pair and derived identity of one client context.
 *
 * <p>Anyone may read a snapshot; only {@link SessionRefresher} writes (rotate, seed and clear). Every clear
 * starts a new generation, and a rotation prepared under an older generation is discarded.
 */
public class SessionStore {

    private final AtomicReference<Snapshot> state = new AtomicReference<>(Snapshot.empty(0));

    public Session current() {
        return state.get().session();
    }

    public Optional<String> accessToken() {
        return Optional.ofNullable(state.get().accessToken());
    }

    public Optional<String> refreshToken() {
        return Optional.ofNullable(state.get().refreshToken());
    }

    public Optional<TokenClaims> accessClaims() {
        return Optional.ofNullable(state.get().accessClaims());
    }

    public TokenPair tokens() {
        Snapshot snapshot = state.get();
        return new TokenPair(snapshot.accessToken(), snapshot.refreshToken());
    }

    long generation() {
        return state.get().generation();
    }

    void rotate(TokenPair pair, TokenClaims accessClaims) {
        state.updateAndGet(current -> current.rotated(pair, accessClaims));
    }

    /**
     * Installs the pair only if the store was not cleared since {@code expectedGeneration} was read.
     *
     * @return false when a clear got there first
     */
    boolean rotateIfCurrent(long expectedGeneration, TokenPair pair, TokenClaims accessClaims) {
        Snapshot current = state.get();
        while (current.generation() == expectedGeneration) {
            if (state.compareAndSet(current, current.rotated(pair, accessClaims))) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    void seedRefreshToken(String refreshToken) {
        state.updateAndGet(current ->
                new Snapshot(null, refreshToken, null, Session.anonymous(), current.generation()));
    }

    void clear() {
        state.updateAndGet(current -> Snapshot.empty(current.generation() + 1));
    }

    /**
     * Clears only if nothing cleared the store since {@code expectedGeneration} was read.
     */
    void clearIfCurrent(long expectedGeneration) {
        Snapshot current = state.get();
        while (current.generation() == expectedGeneration) {
            if (state.compareAndSet(current, Snapshot.empty(expectedGeneration + 1))) {
                return;
            }
            current = state.get();
        }
    }

    private record Snapshot(String accessToken, String refreshToken, TokenClaims accessClaims, Session session,
                            long generation) {

        static Snapshot empty(long generation) {
            return new Snapshot(null, null, null, Session.anonymous(), generation);
        }

        Snapshot rotated(TokenPair pair, TokenClaims claims) {
            return new Snapshot(pair.getAccessToken(), pair.getRefreshToken(), claims, Session.from(claims),
                    generation);
        }
    }
}
