package arachne_chat_gateway.chat;

import arachne_chat_gateway.config.AuthProperties;
import arachne_chat_gateway.config.ChatProperties;
import arachne_chat_gateway.security.TokenVerifier;
import arachne_chat_gateway.service.BackendAuthClient;
import arachne_chat_gateway.session.SessionRefresher;
import arachne_chat_gateway.session.SessionStore;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Client contexts keyed by verified subject. Idle contexts are evicted by the backing cache.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClientContextRegistry {

    private final Cache<String, ClientContext> clientContextCache;
    private final BackendAuthClient backendAuthClient;
    private final TokenVerifier tokenVerifier;
    private final AuthProperties authProperties;
    private final ChatProperties chatProperties;

    /**
     * @param subject the subject of an already verified token
     */
    public ClientContext resolve(String subject) {
        return clientContextCache.get(subject, this::create);
    }

    public Optional<ClientContext> find(String subject) {
        return Optional.ofNullable(clientContextCache.getIfPresent(subject));
    }

    public List<ClientContext> all() {
        return new ArrayList<>(clientContextCache.asMap().values());
    }

    private ClientContext create(String subject) {
        SessionStore store = new SessionStore();
        SessionRefresher refresher = new SessionRefresher(
                store, backendAuthClient, tokenVerifier, authProperties.getRefreshBufferSeconds());
        AttachmentTracker tracker = new AttachmentTracker(
                new HashSet<>(chatProperties.getAllowedMimeTypes()), chatProperties.getMaxTotalAttachmentBytes());
        log.info("Client context created for subject {}", subject);
        return new ClientContext(subject, store, refresher, tracker);
    }
}
