package arachne_chat_gateway.chat;

import arachne_chat_gateway.model.ChatMessage;
import arachne_chat_gateway.model.ContentPart;
import arachne_chat_gateway.model.Conversation;
import arachne_chat_gateway.model.PartKind;
import arachne_chat_gateway.model.ToolCall;
import arachne_chat_gateway.model.ToolCallStatus;
import arachne_chat_gateway.protocol.ProtocolEvent;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the streaming tail message of a {@link Conversation} and turns deltas into content.
 *
 * <p>Not thread-safe: callers serialize access, one event at a time, in arrival order.
 */
@Slf4j
public class MessageAssembler {

    private final Conversation conversation;
    private final Clock clock;
    private final Map<Integer, ToolCall> toolCallsByPartIndex = new HashMap<>();

    public MessageAssembler(Conversation conversation, Clock clock) {
        this.conversation = conversation;
        this.clock = clock;
    }

    public Optional<ChatMessage> current() {
        return conversation.streamingMessage();
    }

    /**
     * Starts a model request. A run that already has a streaming assistant message keeps appending to it, so
     * several model requests around tool calls still produce one message.
     */
    public ChatMessage beginModelRequest() {
        toolCallsByPartIndex.clear();
        return ensureStreaming();
    }

    public void openPart(int index, PartKind kind) {
        ChatMessage message = ensureStreaming();
        if (kind == PartKind.OTHER) {
            return;
        }
        message.openPart(kind);
        if (kind == PartKind.TOOL_CALL) {
            ToolCall placeholder = new ToolCall(null, null, null);
            message.addToolCall(placeholder);
            toolCallsByPartIndex.put(index, placeholder);
        }
    }

    public void appendText(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        ChatMessage message = ensureStreaming();
        if (message.isOutputFrozen()) {
            log.debug("Ignoring text delta after final output was frozen");
            return;
        }
        partFor(message, PartKind.TEXT).append(delta);
        if (message.isThinkingStreaming()) {
            message.setThinkingStreaming(false);
        }
    }

    public void appendThinking(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        ChatMessage message = ensureStreaming();
        partFor(message, PartKind.THINKING).append(delta);
        message.setThinkingStreaming(true);
    }

    /**
     * Creates a tool call on first mention or updates the one already known. Matching goes by id, then by
     * name, then onto an anonymous call opened by a tool part.
     */
    public ToolCall upsertToolCall(String toolCallId, String toolName, JsonNode args) {
        ChatMessage message = ensureStreaming();
        ToolCall toolCall = findActive(message, toolCallId, toolName)
                .or(() -> findAnonymous(message))
                .orElseGet(() -> {
                    ToolCall created = new ToolCall(toolCallId, toolName, args);
                    message.addToolCall(created);
                    return created;
                });
        toolCall.bindId(toolCallId);
        toolCall.rename(toolName);
        toolCall.replaceArgs(args);
        return toolCall;
    }

    public void appendToolArgs(int partIndex, String toolCallId, String toolName, String argsDelta) {
        ChatMessage message = ensureStreaming();
        ToolCall toolCall = toolCallsByPartIndex.get(partIndex);
        if (toolCall == null) {
            toolCall = upsertToolCall(toolCallId, toolName, null);
            toolCallsByPartIndex.put(partIndex, toolCall);
        } else {
            toolCall.bindId(toolCallId);
            toolCall.rename(toolName);
        }
        if (!toolCall.getStatus().isTerminal()) {
            toolCall.appendArgsDelta(argsDelta);
        }
        log.trace("Tool args delta applied to message {}", message.getId());
    }

    /** Advances every pending tool call of the current message to running. */
    public void startTools() {
        ChatMessage message = ensureStreaming();
        message.getToolCalls().forEach(call -> call.advanceTo(ToolCallStatus.RUNNING));
    }

    public ToolCall completeToolCall(String toolCallId, String toolName, JsonNode result, boolean failed) {
        ChatMessage message = ensureStreaming();
        ToolCall toolCall = findActive(message, toolCallId, toolName).orElseGet(() -> {
            log.debug("Tool result for unknown call {} / {}, recording it", toolCallId, toolName);
            ToolCall created = new ToolCall(toolCallId, toolName, null);
            message.addToolCall(created);
            return created;
        });
        if (toolCall.getStatus().isTerminal()) {
            return toolCall;
        }
        toolCall.attachResult(result);
        toolCall.advanceTo(failed ? ToolCallStatus.ERROR : ToolCallStatus.COMPLETED);
        return toolCall;
    }

    /**
     * Applies {@code final_result}: the output fills the text only when nothing was streamed, then the text is
     * frozen. Tool events are reconciled so a replay of a finished call changes nothing.
     */
    public void applyFinalResult(String output, List<ProtocolEvent.ToolEvent> toolEvents) {
        ChatMessage message = ensureStreaming();
        if (output != null && !output.isEmpty() && message.getTextContent().isEmpty() && !message.isOutputFrozen()) {
            message.openPart(PartKind.TEXT).append(output);
        }
        if (!message.isOutputFrozen()) {
            message.freezeOutput();
        }
        for (ProtocolEvent.ToolEvent event : toolEvents) {
            reconcile(message, event);
        }
    }

    /**
     * Ends the streaming message successfully.
     *
     * @return false when there was nothing left to finalize
     */
    public boolean finalizeMessage() {
        Optional<ChatMessage> streaming = conversation.streamingMessage();
        conversation.setBusy(false);
        toolCallsByPartIndex.clear();
        if (streaming.isEmpty()) {
            return false;
        }
        streaming.get().finish();
        return true;
    }

    /**
     * Ends the in-flight message as errored and keeps whatever it already holds. With no message in flight an
     * empty errored assistant message carries the error. Finalized history is never touched.
     */
    public ChatMessage markErrored(String errorMessage) {
        ChatMessage message = ensureStreaming();
        message.fail(errorMessage);
        conversation.setBusy(false);
        toolCallsByPartIndex.clear();
        return message;
    }

    private ChatMessage ensureStreaming() {
        return conversation.streamingMessage().orElseGet(() -> {
            ChatMessage message = ChatMessage.streamingAssistant(clock.instant());
            conversation.append(message);
            conversation.setBusy(true);
            return message;
        });
    }

    private static ContentPart partFor(ChatMessage message, PartKind kind) {
        return message.lastPart(kind).orElseGet(() -> message.openPart(kind));
    }

    private static Optional<ToolCall> findActive(ChatMessage message, String toolCallId, String toolName) {
        if (toolCallId != null) {
            Optional<ToolCall> byId = findById(message, toolCallId);
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (toolName == null) {
            return Optional.empty();
        }
        List<ToolCall> calls = message.getToolCalls();
        for (int i = calls.size() - 1; i >= 0; i--) {
            ToolCall call = calls.get(i);
            boolean idCompatible = toolCallId == null || call.getId() == null;
            if (idCompatible && toolName.equals(call.getName()) && !call.getStatus().isTerminal()) {
                return Optional.of(call);
            }
        }
        return Optional.empty();
    }

    private static Optional<ToolCall> findById(ChatMessage message, String toolCallId) {
        return message.getToolCalls().stream()
                .filter(call -> toolCallId.equals(call.getId()))
                .findFirst();
    }

    /** Oldest first: tool parts are announced in the same order the calls are later executed. */
    private static Optional<ToolCall> findAnonymous(ChatMessage message) {
        return message.getToolCalls().stream()
                .filter(call -> call.getId() == null && call.getName() == null)
                .filter(call -> !call.getStatus().isTerminal())
                .findFirst();
    }

    private void reconcile(ChatMessage message, ProtocolEvent.ToolEvent event) {
        Optional<ToolCall> existing = event.toolCallId() != null
                ? findById(message, event.toolCallId())
                : Optional.empty();
        if (existing.isEmpty()) {
            existing = findActive(message, event.toolCallId(), event.toolName());
        }
        if (existing.isEmpty() && event.toolCallId() == null) {
            existing = message.getToolCalls().stream()
                    .filter(call -> Objects.equals(call.getName(), event.toolName()))
                    .filter(call -> Objects.equals(call.getArgs(), event.args()))
                    .findFirst();
        }

        ToolCall toolCall = existing.orElseGet(() -> {
            ToolCall created = new ToolCall(event.toolCallId(), event.toolName(), event.args());
            message.addToolCall(created);
            return created;
        });
        if (toolCall.getStatus().isTerminal()) {
            return;
        }
        toolCall.bindId(event.toolCallId());
        toolCall.rename(event.toolName());
        if (toolCall.getArgs() == null) {
            toolCall.replaceArgs(event.args());
        }
        if (event.result() != null && !event.result().isNull()) {
            toolCall.attachResult(event.result());
        }
        ToolCallStatus target = event.status();
        if (target == null && toolCall.getResult() != null) {
            target = ToolCallStatus.COMPLETED;
        }
        if (target != null) {
            toolCall.advanceTo(target);
        }
    }
}
