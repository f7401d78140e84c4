package arachne_chat_gateway.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Getter
public class Conversation {

    @Setter
    private String conversationId;
    @Setter
    private String title;
    @Setter
    private boolean busy;
    private final List<ChatMessage> messages = new ArrayList<>();

    public void append(ChatMessage message) {
        messages.add(message);
    }

    public boolean remove(ChatMessage message) {
        return messages.removeIf(m -> m == message);
    }

    public Optional<ChatMessage> tail() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    public Optional<ChatMessage> streamingMessage() {
        return tail().filter(ChatMessage::isStreaming);
    }

    public List<ChatMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public Conversation copy() {
        Conversation copy = new Conversation();
        copy.conversationId = conversationId;
        copy.title = title;
        copy.busy = busy;
        messages.forEach(m -> copy.messages.add(m.copy()));
        return copy;
    }
}
