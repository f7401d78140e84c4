package arachne_chat_gateway.service;

import arachne_chat_gateway.config.AuthProperties;
import arachne_chat_gateway.model.TokenPair;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CookieServiceTest {

    private AuthProperties authProperties;
    private CookieService cookieService;

    @BeforeEach
    void setUp() {
        authProperties = new AuthProperties();
        cookieService = new CookieService(authProperties);
    }

    @Test
    void shouldWriteHttpOnlyLaxCookiesWithConfiguredLifetimes() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookieService.writeSessionCookies(response, new TokenPair("access-1", "refresh-1"));

        List<String> cookies = response.getHeaders(HttpHeaders.SET_COOKIE);
        assertEquals(2, cookies.size());
        assertTrue(cookies.get(0).startsWith("access_token=access-1"));
        assertTrue(cookies.get(0).contains("Max-Age=1800"));
        assertTrue(cookies.get(1).startsWith("refresh_token=refresh-1"));
        assertTrue(cookies.get(1).contains("Max-Age=604800"));
        cookies.forEach(cookie -> {
            assertTrue(cookie.contains("HttpOnly"));
            assertTrue(cookie.contains("SameSite=Lax"));
            assertTrue(cookie.contains("Path=/"));
            assertFalse(cookie.contains("Secure"));
        });
    }

    @Test
    void shouldMarkCookiesSecureWhenConfigured() {
        authProperties.setSecureCookies(true);
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookieService.writeSessionCookies(response, new TokenPair("access-1", null));

        List<String> cookies = response.getHeaders(HttpHeaders.SET_COOKIE);
        assertEquals(1, cookies.size());
        assertTrue(cookies.get(0).contains("Secure"));
    }

    @Test
    void shouldExpireBothCookiesOnClear() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookieService.clearSessionCookies(response);

        List<String> cookies = response.getHeaders(HttpHeaders.SET_COOKIE);
        assertEquals(2, cookies.size());
        cookies.forEach(cookie -> assertTrue(cookie.contains("Max-Age=0")));
    }

    @Test
    void shouldReadPresentedTokensIgnoringBlankCookies() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("access_token", " "), new Cookie("refresh_token", "refresh-1"), new Cookie("other", "x"));

        TokenPair presented = cookieService.readPresented(request);

        assertFalse(presented.hasAccessToken());
        assertEquals("refresh-1", presented.getRefreshToken());
    }

    @Test
    void shouldReadNothingWithoutCookies() {
        TokenPair presented = cookieService.readPresented(new MockHttpServletRequest());

        assertFalse(presented.hasAccessToken());
        assertFalse(presented.hasRefreshToken());
    }
}
