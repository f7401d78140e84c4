package arachne_chat_gateway.protocol;

import arachne_chat_gateway.exceptions.StreamException;
import arachne_chat_gateway.model.PartKind;
import arachne_chat_gateway.model.ToolCallStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw socket frame {@code {type, data?, timestamp?}} into a {@link ProtocolEvent}.
 */
@Component
@RequiredArgsConstructor
public class ProtocolEventParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws StreamException on malformed JSON, a missing {@code type} or a type this gateway does not know
     */
    public ProtocolEvent parse(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new StreamException("Evento malformado recebido do agente", e);
        }
        if (root == null || !root.isObject()) {
            throw new StreamException("Evento malformado recebido do agente");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new StreamException("Evento sem campo 'type'");
        }
        JsonNode data = root.has("data") && root.get("data").isObject() ? root.get("data") : MissingNode.getInstance();

        String type = typeNode.asText();
        return switch (type) {
            case "user_prompt" -> new ProtocolEvent.UserPrompt(text(data, "content"));
            case "user_prompt_processed" -> new ProtocolEvent.UserPromptProcessed();
            case "model_request_start" -> new ProtocolEvent.ModelRequestStart();
            case "part_start" -> {
                String partType = text(data, "part_type");
                yield new ProtocolEvent.PartStart(data.path("index").asInt(0), PartKind.fromPartType(partType), partType);
            }
            case "text_delta" -> new ProtocolEvent.TextDelta(firstText(data, "delta", "content"));
            case "thinking_delta" -> new ProtocolEvent.ThinkingDelta(firstText(data, "delta", "content"));
            case "tool_call_delta" -> new ProtocolEvent.ToolCallDelta(
                    data.path("index").asInt(0),
                    text(data, "tool_call_id"),
                    text(data, "tool_name"),
                    argsDelta(data.get("args_delta")));
            case "call_tools_start" -> new ProtocolEvent.CallToolsStart();
            case "tool_call" -> new ProtocolEvent.ToolCallEvent(
                    text(data, "tool_call_id"),
                    text(data, "tool_name"),
                    parseArgs(data.get("args")));
            case "tool_result" -> new ProtocolEvent.ToolResult(
                    text(data, "tool_call_id"),
                    text(data, "tool_name"),
                    data.has("result") ? data.get("result") : data.get("content"));
            case "final_result_start" -> new ProtocolEvent.FinalResultStart(text(data, "tool_name"));
            case "final_result" -> new ProtocolEvent.FinalResult(text(data, "output"), toolEvents(data.get("tool_events")));
            case "complete" -> new ProtocolEvent.Complete(text(data, "conversation_id"));
            case "error" -> new ProtocolEvent.Error(text(data, "message"));
            case "conversation_created" -> new ProtocolEvent.ConversationCreated(text(data, "conversation_id"));
            case "conversation_updated" -> new ProtocolEvent.ConversationUpdated(
                    text(data, "conversation_id"), text(data, "title"));
            case "message_saved" -> new ProtocolEvent.MessageSaved(text(data, "message_id"), text(data, "role"));
            default -> throw new StreamException("Tipo de evento desconhecido: " + type);
        };
    }

    /** Tool arguments arrive either as an object or as a JSON-encoded string. */
    private JsonNode parseArgs(JsonNode args) {
        if (args == null || args.isNull()) {
            return null;
        }
        if (args.isTextual()) {
            try {
                return objectMapper.readTree(args.asText());
            } catch (JsonProcessingException e) {
                return args;
            }
        }
        return args;
    }

    private static String argsDelta(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private List<ProtocolEvent.ToolEvent> toolEvents(JsonNode node) {
        List<ProtocolEvent.ToolEvent> events = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return events;
        }
        for (JsonNode item : node) {
            if (!item.isObject()) {
                continue;
            }
            events.add(new ProtocolEvent.ToolEvent(
                    firstText(item, "id", "tool_call_id"),
                    firstText(item, "name", "tool_name"),
                    parseArgs(item.get("args")),
                    item.get("result"),
                    ToolCallStatus.fromWire(text(item, "status"))));
        }
        return events;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String firstText(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value != null ? value : text(node, fallback);
    }
}
