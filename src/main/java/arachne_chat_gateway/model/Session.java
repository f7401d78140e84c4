package arachne_chat_gateway.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of the identity derived from the current access token.
 */
@Value
@Builder
public class Session {

    private static final Session ANONYMOUS = Session.builder().authenticated(false).build();

    boolean authenticated;
    String subject;
    String role;
    boolean superuser;
    Instant expiresAt;

    public static Session anonymous() {
        return ANONYMOUS;
    }

    public static Session from(TokenClaims claims) {
        return Session.builder()
                .authenticated(true)
                .subject(claims.getSubject())
                .role(claims.getRole())
                .superuser(Boolean.TRUE.equals(claims.getSuperuser()))
                .expiresAt(claims.getExpiresAt() != null ? Instant.ofEpochSecond(claims.getExpiresAt()) : null)
                .build();
    }
}
