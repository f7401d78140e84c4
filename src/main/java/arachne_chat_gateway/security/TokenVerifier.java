package arachne_chat_gateway.security;

import arachne_chat_gateway.config.AuthProperties;
import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.model.TokenClaims;
import arachne_chat_gateway.model.TokenVerificationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Verifies EdDSA (Ed25519) signed tokens issued by the agent backend.
 *
 * <p>The parsed public key is memoized against the raw PEM text it came from and re-parsed only when the
 * configured key material changes.
 */
@Slf4j
@Component
public class TokenVerifier {

    static final String ALGORITHM = "EdDSA";

    private static final String KEY_ALGORITHM = "Ed25519";
    private static final String ROLE_ADMIN = "admin";

    private final AuthProperties authProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicReference<ParsedKey> keyCache = new AtomicReference<>();

    public TokenVerifier(AuthProperties authProperties, ObjectMapper objectMapper, Clock clock) {
        this.authProperties = authProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TokenVerificationResult verify(String token) {
        return verify(token, authProperties.getPublicKey());
    }

    public TokenVerificationResult verify(String token, String publicKeyPem) {
        if (token == null || token.isBlank()) {
            return TokenVerificationResult.invalid("Token ausente");
        }
        if (publicKeyPem == null || publicKeyPem.isBlank()) {
            log.warn("Token rejected: no public key configured (auth.public-key)");
            return TokenVerificationResult.invalid("Chave pública não configurada");
        }

        String algorithm = headerAlgorithm(token);
        if (!ALGORITHM.equals(algorithm)) {
            log.debug("Token rejected: unexpected algorithm {}", algorithm);
            return TokenVerificationResult.invalid("Algoritmo não suportado");
        }

        PublicKey publicKey;
        try {
            publicKey = resolvePublicKey(publicKeyPem);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.error("Configured public key could not be parsed", e);
            return TokenVerificationResult.invalid("Chave pública inválida");
        }

        try {
            Claims claims = Jwts.parser()
                    .verifyWith(publicKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return TokenVerificationResult.valid(toTokenClaims(claims));
        } catch (ExpiredJwtException e) {
            return TokenVerificationResult.invalid("Token expirado");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            return TokenVerificationResult.invalid("Assinatura inválida");
        }
    }

    /**
     * Reads the claims without checking the signature.
     *
     * <p>Only for tokens whose provenance is already trusted, such as one this gateway just received from the
     * backend refresh endpoint. Never call it on a token taken from a request.
     *
     * @return the claims, or {@code null} when the token is not a well-formed JWT
     */
    public TokenClaims decodeUnsafe(String token) {
        String[] segments = split(token);
        if (segments == null) {
            return null;
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(segments[1]);
            return objectMapper.readValue(payload, TokenClaims.class);
        } catch (IOException | IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isExpired(TokenClaims claims) {
        return isExpired(claims, 0);
    }

    /**
     * @param bufferSeconds seconds before the real expiry from which the token already counts as expired
     */
    public boolean isExpired(TokenClaims claims, long bufferSeconds) {
        if (claims == null || claims.getExpiresAt() == null) {
            return true;
        }
        long nowSeconds = clock.instant().getEpochSecond();
        return claims.getExpiresAt() - bufferSeconds <= nowSeconds;
    }

    public long secondsUntilExpiry(TokenClaims claims) {
        if (claims == null || claims.getExpiresAt() == null) {
            return 0;
        }
        long remaining = claims.getExpiresAt() - clock.instant().getEpochSecond();
        return Math.max(0, remaining);
    }

    public static boolean isAdmin(TokenClaims claims) {
        return claims != null && isAdmin(claims.getRole(), Boolean.TRUE.equals(claims.getSuperuser()));
    }

    public static boolean isAdmin(Session session) {
        return session != null && session.isAuthenticated() && isAdmin(session.getRole(), session.isSuperuser());
    }

    private static boolean isAdmin(String role, boolean superuser) {
        return ROLE_ADMIN.equals(role) || superuser;
    }

    PublicKey resolvePublicKey(String publicKeyPem) throws GeneralSecurityException {
        String sanitized = sanitizePem(publicKeyPem);
        ParsedKey cached = keyCache.get();
        if (cached != null && cached.pem().equals(sanitized)) {
            return cached.key();
        }
        PublicKey parsed = parsePem(sanitized);
        keyCache.set(new ParsedKey(sanitized, parsed));
        log.info("Public key for token verification loaded");
        return parsed;
    }

    private static String sanitizePem(String pem) {
        return pem.replace("\\n", "\n").trim();
    }

    private static PublicKey parsePem(String pem) throws GeneralSecurityException {
        String base64 = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s", "");
        byte[] der = Base64.getDecoder().decode(base64);
        return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
    }

    private String headerAlgorithm(String token) {
        String[] segments = split(token);
        if (segments == null) {
            return null;
        }
        try {
            JsonNode header = objectMapper.readTree(
                    new String(Base64.getUrlDecoder().decode(segments[0]), StandardCharsets.UTF_8));
            JsonNode alg = header.get("alg");
            return alg != null && alg.isTextual() ? alg.asText() : null;
        } catch (IOException | IllegalArgumentException e) {
            return null;
        }
    }

    private static String[] split(String token) {
        if (token == null) {
            return null;
        }
        String[] segments = token.split("\\.", -1);
        return segments.length == 3 ? segments : null;
    }

    private static TokenClaims toTokenClaims(Claims claims) {
        Date expiration = claims.getExpiration();
        Date issuedAt = claims.getIssuedAt();
        return TokenClaims.builder()
                .subject(claims.getSubject())
                .tokenType(claims.get("type", String.class))
                .role(claims.get("role", String.class))
                .superuser(claims.get("is_superuser", Boolean.class))
                .expiresAt(expiration != null ? expiration.getTime() / 1000 : null)
                .issuedAt(issuedAt != null ? issuedAt.getTime() / 1000 : null)
                .build();
    }

    private record ParsedKey(String pem, PublicKey key) {
    }
}
