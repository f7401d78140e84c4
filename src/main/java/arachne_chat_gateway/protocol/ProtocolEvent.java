package arachne_chat_gateway.protocol;

import arachne_chat_gateway.model.PartKind;
import arachne_chat_gateway.model.ToolCallStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One typed frame received from the agent socket.
 *
 * <p>Every variant has a matching method on {@link ProtocolEventHandler}.
 */
public sealed interface ProtocolEvent {

    /** Wire value of the {@code type} field. */
    String type();

    <R> R dispatch(ProtocolEventHandler<R> handler);

    default boolean isTerminal() {
        return false;
    }

    record UserPrompt(String content) implements ProtocolEvent {
        public String type() {
            return "user_prompt";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onUserPrompt(this);
        }
    }

    record UserPromptProcessed() implements ProtocolEvent {
        public String type() {
            return "user_prompt_processed";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onUserPromptProcessed(this);
        }
    }

    record ModelRequestStart() implements ProtocolEvent {
        public String type() {
            return "model_request_start";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onModelRequestStart(this);
        }
    }

    record PartStart(int index, PartKind kind, String partType) implements ProtocolEvent {
        public String type() {
            return "part_start";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onPartStart(this);
        }
    }

    record TextDelta(String delta) implements ProtocolEvent {
        public String type() {
            return "text_delta";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onTextDelta(this);
        }
    }

    record ThinkingDelta(String delta) implements ProtocolEvent {
        public String type() {
            return "thinking_delta";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onThinkingDelta(this);
        }
    }

    record ToolCallDelta(int index, String toolCallId, String toolName, String argsDelta) implements ProtocolEvent {
        public String type() {
            return "tool_call_delta";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onToolCallDelta(this);
        }
    }

    record CallToolsStart() implements ProtocolEvent {
        public String type() {
            return "call_tools_start";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onCallToolsStart(this);
        }
    }

    record ToolCallEvent(String toolCallId, String toolName, JsonNode args) implements ProtocolEvent {
        public String type() {
            return "tool_call";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onToolCall(this);
        }
    }

    record ToolResult(String toolCallId, String toolName, JsonNode result) implements ProtocolEvent {
        public String type() {
            return "tool_result";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onToolResult(this);
        }

        /** A result object carrying {@code "error": true} reports a failed tool run. */
        public boolean signalsFailure() {
            return result != null && result.isObject() && result.path("error").asBoolean(false);
        }
    }

    record FinalResultStart(String toolName) implements ProtocolEvent {
        public String type() {
            return "final_result_start";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onFinalResultStart(this);
        }
    }

    record FinalResult(String output, List<ToolEvent> toolEvents) implements ProtocolEvent {
        public FinalResult {
            toolEvents = toolEvents == null ? List.of() : List.copyOf(toolEvents);
        }

        public String type() {
            return "final_result";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onFinalResult(this);
        }
    }

    record Complete(String conversationId) implements ProtocolEvent {
        public String type() {
            return "complete";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onComplete(this);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Error(String message) implements ProtocolEvent {
        public String type() {
            return "error";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onError(this);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record ConversationCreated(String conversationId) implements ProtocolEvent {
        public String type() {
            return "conversation_created";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onConversationCreated(this);
        }
    }

    record ConversationUpdated(String conversationId, String title) implements ProtocolEvent {
        public String type() {
            return "conversation_updated";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onConversationUpdated(this);
        }
    }

    record MessageSaved(String messageId, String role) implements ProtocolEvent {
        public String type() {
            return "message_saved";
        }

        public <R> R dispatch(ProtocolEventHandler<R> handler) {
            return handler.onMessageSaved(this);
        }
    }

    /**
     * A tool call as reported inside {@code final_result.tool_events}. {@code status} is null when the frame
     * did not say.
     */
    record ToolEvent(String toolCallId, String toolName, JsonNode args, JsonNode result, ToolCallStatus status) {
    }
}
