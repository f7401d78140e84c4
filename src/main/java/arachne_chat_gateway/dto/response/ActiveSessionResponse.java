package arachne_chat_gateway.dto.response;

import arachne_chat_gateway.model.StreamState;
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
@Schema(description = "Contexto de cliente ativo no gateway")
public class ActiveSessionResponse {
    private String subject;
    private boolean authenticated;
    private String role;
    private boolean admin;
    private Instant expiresAt;
    private StreamState streamState;
}
