package arachne_chat_gateway.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TokenVerificationResult {

    private final boolean valid;
    private final TokenClaims payload;
    private final String error;

    public static TokenVerificationResult valid(TokenClaims payload) {
        return new TokenVerificationResult(true, payload, null);
    }

    public static TokenVerificationResult invalid(String error) {
        return new TokenVerificationResult(false, null, error);
    }

    public Optional<TokenClaims> claims() {
        return Optional.ofNullable(payload);
    }
}
