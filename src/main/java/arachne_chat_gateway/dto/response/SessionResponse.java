package arachne_chat_gateway.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Visão da sessão atual derivada do access token")
public class SessionResponse {

    @Schema(description = "Se existe uma sessão válida", example = "true")
    private boolean authenticated;

    @Schema(description = "Identificador do usuário (sub)", example = "6f1c2a7e-0b7d-4e4b-9a55-2d8f3b1e9c10")
    private String subject;

    @Schema(description = "Papel do usuário", example = "user")
    private String role;

    private Boolean superuser;

    @Schema(description = "Se o usuário tem acesso administrativo", example = "false")
    private Boolean admin;

    private Instant expiresAt;

    @Schema(description = "Segundos restantes até o access token expirar", example = "1740")
    private Long expiresInSeconds;

    public static SessionResponse unauthenticated() {
        return SessionResponse.builder().authenticated(false).build();
    }
}
