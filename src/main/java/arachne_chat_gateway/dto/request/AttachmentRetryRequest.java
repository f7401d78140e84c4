package arachne_chat_gateway.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentRetryRequest {

    @NotBlank(message = "A chave do objeto é obrigatória")
    private String objectKey;
}
