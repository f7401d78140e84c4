package arachne_chat_gateway.chat;

import arachne_chat_gateway.model.ChatMessage;
import arachne_chat_gateway.model.StreamState;

/**
 * Observer of a {@link ChatEventStream}. Snapshots are copies and safe to keep.
 */
public interface ChatStreamListener {

    void onEvent(String eventType, String conversationId, ChatMessage snapshot);

    void onTerminal(StreamState state, String conversationId, ChatMessage snapshot);
}
