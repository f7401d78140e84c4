package arachne_chat_gateway.protocol;

public interface ProtocolEventHandler<R> {

    R onUserPrompt(ProtocolEvent.UserPrompt event);

    R onUserPromptProcessed(ProtocolEvent.UserPromptProcessed event);

    R onModelRequestStart(ProtocolEvent.ModelRequestStart event);

    R onPartStart(ProtocolEvent.PartStart event);

    R onTextDelta(ProtocolEvent.TextDelta event);

    R onThinkingDelta(ProtocolEvent.ThinkingDelta event);

    R onToolCallDelta(ProtocolEvent.ToolCallDelta event);

    R onCallToolsStart(ProtocolEvent.CallToolsStart event);

    R onToolCall(ProtocolEvent.ToolCallEvent event);

    R onToolResult(ProtocolEvent.ToolResult event);

    R onFinalResultStart(ProtocolEvent.FinalResultStart event);

    R onFinalResult(ProtocolEvent.FinalResult event);

    R onComplete(ProtocolEvent.Complete event);

    R onError(ProtocolEvent.Error event);

    R onConversationCreated(ProtocolEvent.ConversationCreated event);

    R onConversationUpdated(ProtocolEvent.ConversationUpdated event);

    R onMessageSaved(ProtocolEvent.MessageSaved event);
}
