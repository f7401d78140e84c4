package arachne_chat_gateway.chat;

import arachne_chat_gateway.config.AuthProperties;
import arachne_chat_gateway.config.ChatProperties;
import arachne_chat_gateway.security.TokenVerifier;
import arachne_chat_gateway.service.BackendAuthClient;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ClientContextRegistryTest {

    private ClientContextRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ClientContextRegistry(
                Caffeine.newBuilder().maximumSize(100).build(),
                mock(BackendAuthClient.class),
                mock(TokenVerifier.class),
                new AuthProperties(),
                new ChatProperties());
    }

    @Test
    void shouldReuseContextForSameSubject() {
        ClientContext first = registry.resolve("user-1");
        ClientContext second = registry.resolve("user-1");

        assertSame(first, second);
        assertEquals("user-1", first.getSubject());
        assertFalse(first.getSessionStore().current().isAuthenticated());
    }

    @Test
    void shouldIsolateSubjects() {
        ClientContext first = registry.resolve("user-1");
        ClientContext second = registry.resolve("user-2");

        assertNotSame(first.getSessionStore(), second.getSessionStore());
        assertNotSame(first.getAttachments(), second.getAttachments());
        assertEquals(2, registry.all().size());
    }

    @Test
    void shouldFindOnlyExistingContexts() {
        assertTrue(registry.find("ninguem").isEmpty());

        registry.resolve("user-1");

        assertTrue(registry.find("user-1").isPresent());
    }
}
