package arachne_chat_gateway.dto.response;

import arachne_chat_gateway.model.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data of one SSE event: the protocol event type just applied and a snapshot of the tail message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatStreamUpdate {
    private String type;
    private String conversationId;
    private ChatMessage message;
}
