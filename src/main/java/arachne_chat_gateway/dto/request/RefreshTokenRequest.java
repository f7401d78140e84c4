package arachne_chat_gateway.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Corpo enviado ao backend para rotacionar o par de tokens")
public class RefreshTokenRequest {

    @NotBlank(message = "Refresh token é obrigatório")
    @JsonProperty("refresh_token")
    @Schema(description = "Refresh token atual", example = "eyJhbGciOiJFZERTQSIsInR5cCI6IkpXVCJ9...")
    private String refreshToken;
}
