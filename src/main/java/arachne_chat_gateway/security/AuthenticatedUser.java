package arachne_chat_gateway.security;

import arachne_chat_gateway.exceptions.AuthException;
import arachne_chat_gateway.model.TokenClaims;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

public final class AuthenticatedUser {

    private AuthenticatedUser() {
    }

    public static Optional<TokenClaims> currentClaims() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof TokenClaims)) {
            return Optional.empty();
        }
        return Optional.of((TokenClaims) authentication.getPrincipal());
    }

    public static TokenClaims requireClaims() {
        return currentClaims().orElseThrow(() -> new AuthException("Usuário não autenticado"));
    }
}
