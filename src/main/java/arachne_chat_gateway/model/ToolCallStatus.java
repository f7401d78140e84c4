package arachne_chat_gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared in lifecycle order; a tool call only ever moves to a later constant.
 */
public enum ToolCallStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    public boolean canAdvanceTo(ToolCallStatus next) {
        return next != null && !isTerminal() && next.ordinal() > ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static ToolCallStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (ToolCallStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
