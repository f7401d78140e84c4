package arachne_chat_gateway.controller;

import arachne_chat_gateway.dto.response.ErrorResponse;
import arachne_chat_gateway.dto.response.SessionResponse;
import arachne_chat_gateway.service.AuthSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Autenticação", description = "Renovação, encerramento e consulta da sessão baseada em cookies")
public class AuthController {

    private final AuthSessionService authSessionService;

    @Operation(
        summary = "Renovar sessão",
        description = "Rotaciona o par de tokens usando o cookie refresh_token e regrava os cookies. Chamadas concorrentes compartilham uma única rotação."
    )
    @ApiResponse(
        responseCode = "200",
        description = "Sessão renovada com sucesso"
    )
    @ApiResponse(
        responseCode = "401",
        description = "Refresh token ausente, inválido ou rejeitado; cookies removidos",
        content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
    )
    @PostMapping("/refresh")
    public ResponseEntity<SessionResponse> refresh(HttpServletRequest request, HttpServletResponse response) {
        return ResponseEntity.ok(authSessionService.refresh(request, response));
    }

    @Operation(
        summary = "Encerrar sessão",
        description = "Notifica o backend (melhor esforço) e sempre remove a sessão local e os cookies."
    )
    @ApiResponse(
        responseCode = "204",
        description = "Sessão encerrada"
    )
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request, HttpServletResponse response) {
        authSessionService.logout(request, response);
        return ResponseEntity.noContent().build();
    }

    @Operation(
        summary = "Consultar sessão",
        description = "Retorna a sessão atual. Renova o access token antes quando ele está perto de expirar."
    )
    @ApiResponse(
        responseCode = "200",
        description = "Sessão atual, ou authenticated=false"
    )
    @GetMapping("/session")
    public ResponseEntity<SessionResponse> session(HttpServletRequest request, HttpServletResponse response) {
        return ResponseEntity.ok(authSessionService.currentSession(request, response));
    }
}
