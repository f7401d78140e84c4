package arachne_chat_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

@Getter
public class ToolCall {

    private String id;
    private String name;
    private JsonNode args;
    @JsonIgnore
    private final StringBuilder argsBuffer = new StringBuilder();
    private JsonNode result;
    private ToolCallStatus status;

    public ToolCall(String id, String name, JsonNode args) {
        this.id = id;
        this.name = name;
        this.args = args;
        this.status = ToolCallStatus.PENDING;
    }

    private ToolCall(ToolCall source) {
        this.id = source.id;
        this.name = source.name;
        this.args = source.args;
        this.argsBuffer.append(source.argsBuffer);
        this.result = source.result;
        this.status = source.status;
    }

    /**
     * Moves the call forward in its lifecycle. Backward or sideways moves are ignored.
     *
     * @return true when the status changed
     */
    public boolean advanceTo(ToolCallStatus next) {
        if (!status.canAdvanceTo(next)) {
            return false;
        }
        status = next;
        return true;
    }

    /** Adopts the backend id for a call first seen through an anonymous delta. */
    public void bindId(String newId) {
        if (id == null && newId != null && !newId.isBlank()) {
            this.id = newId;
        }
    }

    public void rename(String newName) {
        if (newName != null && !newName.isBlank()) {
            this.name = newName;
        }
    }

    public void replaceArgs(JsonNode newArgs) {
        if (newArgs != null && !newArgs.isNull()) {
            this.args = newArgs;
        }
    }

    public void appendArgsDelta(String delta) {
        if (delta != null) {
            argsBuffer.append(delta);
        }
    }

    public void attachResult(JsonNode newResult) {
        if (result == null) {
            result = newResult;
        }
    }

    /** Raw argument text accumulated from streamed deltas, before the full arguments arrive. */
    public String getArgsText() {
        return argsBuffer.toString();
    }

    public ToolCall copy() {
        return new ToolCall(this);
    }
}
