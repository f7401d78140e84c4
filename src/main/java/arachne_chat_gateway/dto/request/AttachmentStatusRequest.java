package arachne_chat_gateway.dto.request;

import arachne_chat_gateway.model.AttachmentStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Atualização do estado de upload de um anexo")
public class AttachmentStatusRequest {

    @NotBlank(message = "A chave do objeto é obrigatória")
    private String objectKey;

    @NotNull(message = "O novo estado é obrigatório")
    @Schema(description = "uploading, uploaded ou error", example = "uploaded")
    private AttachmentStatus status;

    @Schema(description = "Mensagem de erro quando status = error")
    private String errorMessage;
}
