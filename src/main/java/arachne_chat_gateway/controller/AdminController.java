package arachne_chat_gateway.controller;

import arachne_chat_gateway.chat.ClientContext;
import arachne_chat_gateway.chat.ClientContextRegistry;
import arachne_chat_gateway.dto.response.ActiveSessionResponse;
import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.security.TokenVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Administração", description = "Visão dos contextos de cliente ativos (apenas administradores)")
public class AdminController {

    private final ClientContextRegistry clientContextRegistry;

    @Operation(summary = "Listar sessões ativas")
    @ApiResponse(responseCode = "200", description = "Sessões retornadas com sucesso")
    @ApiResponse(responseCode = "403", description = "Usuário não é administrador")
    @GetMapping("/sessions")
    public ResponseEntity<List<ActiveSessionResponse>> sessions() {
        List<ActiveSessionResponse> sessions = clientContextRegistry.all().stream()
                .map(AdminController::toResponse)
                .sorted(Comparator.comparing(ActiveSessionResponse::getSubject))
                .collect(Collectors.toList());
        return ResponseEntity.ok(sessions);
    }

    private static ActiveSessionResponse toResponse(ClientContext context) {
        Session session = context.getSessionStore().current();
        return ActiveSessionResponse.builder()
                .subject(context.getSubject())
                .authenticated(session.isAuthenticated())
                .role(session.getRole())
                .admin(TokenVerifier.isAdmin(session))
                .expiresAt(session.getExpiresAt())
                .streamState(context.streamState())
                .build();
    }
}
