package arachne_chat_gateway.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anexo a registrar no rascunho da próxima mensagem")
public class AttachmentRequest {

    @NotBlank(message = "A chave do objeto é obrigatória")
    @Schema(description = "Chave do objeto no storage (sem prefixo do usuário)", example = "uploads/2026/10/foto.png")
    private String objectKey;

    @NotBlank(message = "O tipo do arquivo é obrigatório")
    @Schema(description = "Tipo MIME", example = "image/png")
    private String mimeType;

    @Positive(message = "O tamanho do arquivo deve ser positivo")
    @Schema(description = "Tamanho em bytes", example = "524288")
    private long sizeBytes;

    @Schema(description = "Nome original do arquivo", example = "foto.png")
    private String filename;
}
