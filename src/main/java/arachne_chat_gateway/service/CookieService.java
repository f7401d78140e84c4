package arachne_chat_gateway.service;

import arachne_chat_gateway.config.AuthProperties;
import arachne_chat_gateway.model.TokenPair;
import arachne_chat_gateway.security.AccessTokenFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Reads and writes the token cookies. Both are {@code HttpOnly} and {@code SameSite=Lax}.
 */
@Service
@RequiredArgsConstructor
public class CookieService {

    private static final String SAME_SITE = "Lax";

    private final AuthProperties authProperties;

    public TokenPair readPresented(HttpServletRequest request) {
        return new TokenPair(
                AccessTokenFilter.readCookie(request, AccessTokenFilter.ACCESS_TOKEN_COOKIE),
                AccessTokenFilter.readCookie(request, AccessTokenFilter.REFRESH_TOKEN_COOKIE));
    }

    public void writeSessionCookies(HttpServletResponse response, TokenPair tokens) {
        if (tokens.hasAccessToken()) {
            response.addHeader(HttpHeaders.SET_COOKIE, cookie(AccessTokenFilter.ACCESS_TOKEN_COOKIE,
                    tokens.getAccessToken(), authProperties.getAccessTokenMaxAgeSeconds()).toString());
        }
        if (tokens.hasRefreshToken()) {
            response.addHeader(HttpHeaders.SET_COOKIE, cookie(AccessTokenFilter.REFRESH_TOKEN_COOKIE,
                    tokens.getRefreshToken(), authProperties.getRefreshTokenMaxAgeSeconds()).toString());
        }
    }

    public void clearSessionCookies(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(AccessTokenFilter.ACCESS_TOKEN_COOKIE, "", 0).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(AccessTokenFilter.REFRESH_TOKEN_COOKIE, "", 0).toString());
    }

    private ResponseCookie cookie(String name, String value, long maxAgeSeconds) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(authProperties.isSecureCookies())
                .sameSite(SAME_SITE)
                .path(authProperties.getCookiePath())
                .maxAge(Duration.ofSeconds(maxAgeSeconds))
                .build();
    }
}
