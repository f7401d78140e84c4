package arachne_chat_gateway.model;

public enum PartKind {
    TEXT,
    THINKING,
    TOOL_CALL,
    OTHER;

    public static PartKind fromPartType(String partType) {
        if (partType == null) {
            return OTHER;
        }
        return switch (partType) {
            case "TextPart" -> TEXT;
            case "ThinkingPart" -> THINKING;
            case "ToolCallPart", "BuiltinToolCallPart" -> TOOL_CALL;
            default -> OTHER;
        };
    }
}
