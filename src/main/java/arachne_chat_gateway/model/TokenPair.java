package arachne_chat_gateway.model;

import lombok.Value;

@Value
public class TokenPair {
    String accessToken;
    String refreshToken;

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    @Override
    public String toString() {
        return "TokenPair[access=" + (hasAccessToken() ? "***" : "-")
                + ", refresh=" + (hasRefreshToken() ? "***" : "-") + "]";
    }
}
