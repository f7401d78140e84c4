package arachne_chat_gateway.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Mensagem do usuário a ser enviada ao agente")
public class ChatPromptRequest {

    @NotBlank(message = "A mensagem não pode estar vazia")
    @Schema(description = "Texto da mensagem", example = "Resuma os três artigos mais citados sobre RAG")
    private String message;

    @Schema(description = "Conversa a continuar; ausente para iniciar uma nova")
    private String conversationId;

    @Schema(description = "Prompt de sistema usado apenas ao criar uma nova conversa")
    private String systemPrompt;
}
