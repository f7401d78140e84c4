package arachne_chat_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One entry of a conversation. Content only changes while {@link #isStreaming()} is true.
 */
@Getter
public class ChatMessage {

    private final String id;
    private final MessageRole role;
    private final Instant createdAt;
    @JsonIgnore
    private final List<ContentPart> parts = new ArrayList<>();
    private final List<ToolCall> toolCalls = new ArrayList<>();
    private final List<Attachment> attachments = new ArrayList<>();
    private boolean streaming;
    private boolean thinkingStreaming;
    private boolean errored;
    private String errorMessage;
    @Setter
    private String savedId;
    @JsonIgnore
    private boolean outputFrozen;

    public ChatMessage(String id, MessageRole role, Instant createdAt) {
        this.id = id;
        this.role = role;
        this.createdAt = createdAt;
    }

    public static ChatMessage streamingAssistant(Instant now) {
        ChatMessage message = new ChatMessage(UUID.randomUUID().toString(), MessageRole.ASSISTANT, now);
        message.streaming = true;
        return message;
    }

    public static ChatMessage user(String text, List<Attachment> attachments, Instant now) {
        ChatMessage message = new ChatMessage(UUID.randomUUID().toString(), MessageRole.USER, now);
        ContentPart part = new ContentPart(PartKind.TEXT);
        part.append(text);
        message.parts.add(part);
        if (attachments != null) {
            attachments.forEach(a -> message.attachments.add(a.copy()));
        }
        return message;
    }

    public String getTextContent() {
        return join(PartKind.TEXT);
    }

    public String getThinkingContent() {
        String thinking = join(PartKind.THINKING);
        return thinking.isEmpty() ? null : thinking;
    }

    private String join(PartKind kind) {
        return parts.stream()
                .filter(p -> p.getKind() == kind)
                .map(ContentPart::text)
                .collect(Collectors.joining());
    }

    public Optional<ContentPart> lastPart(PartKind kind) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            if (parts.get(i).getKind() == kind) {
                return Optional.of(parts.get(i));
            }
        }
        return Optional.empty();
    }

    public Optional<ContentPart> currentPart() {
        return parts.isEmpty() ? Optional.empty() : Optional.of(parts.get(parts.size() - 1));
    }

    public ContentPart openPart(PartKind kind) {
        requireStreaming();
        ContentPart part = new ContentPart(kind);
        parts.add(part);
        thinkingStreaming = false;
        return part;
    }

    public void addToolCall(ToolCall toolCall) {
        requireStreaming();
        toolCalls.add(toolCall);
    }

    public void setThinkingStreaming(boolean thinkingStreaming) {
        requireStreaming();
        this.thinkingStreaming = thinkingStreaming;
    }

    /** Marks the streamed text as final; later text deltas are not applied. */
    public void freezeOutput() {
        requireStreaming();
        this.outputFrozen = true;
    }

    public void finish() {
        this.streaming = false;
        this.thinkingStreaming = false;
    }

    public void fail(String message) {
        finish();
        this.errored = true;
        this.errorMessage = message;
    }

    public List<ToolCall> getToolCalls() {
        return Collections.unmodifiableList(toolCalls);
    }

    public List<Attachment> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    private void requireStreaming() {
        if (!streaming) {
            throw new IllegalStateException("Message " + id + " is finalized and can no longer change");
        }
    }

    public ChatMessage copy() {
        ChatMessage copy = new ChatMessage(id, role, createdAt);
        parts.forEach(p -> copy.parts.add(p.copy()));
        toolCalls.forEach(t -> copy.toolCalls.add(t.copy()));
        attachments.forEach(a -> copy.attachments.add(a.copy()));
        copy.streaming = streaming;
        copy.thinkingStreaming = thinkingStreaming;
        copy.errored = errored;
        copy.errorMessage = errorMessage;
        copy.savedId = savedId;
        copy.outputFrozen = outputFrozen;
        return copy;
    }
}
