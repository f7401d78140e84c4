package arachne_chat_gateway.service;

import arachne_chat_gateway.chat.ChatConnector;
import arachne_chat_gateway.chat.ChatEventStream;
import arachne_chat_gateway.chat.ChatStreamListener;
import arachne_chat_gateway.chat.ClientContext;
import arachne_chat_gateway.config.ChatProperties;
import arachne_chat_gateway.dto.request.ChatPromptRequest;
import arachne_chat_gateway.dto.response.ChatStreamUpdate;
import arachne_chat_gateway.exceptions.StreamException;
import arachne_chat_gateway.model.Attachment;
import arachne_chat_gateway.model.ChatMessage;
import arachne_chat_gateway.model.Conversation;
import arachne_chat_gateway.model.StreamState;
import arachne_chat_gateway.protocol.ProtocolEventParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runs one chat turn against the agent and relays the assembled message to the browser as SSE.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatStreamService {

    private final ProtocolEventParser protocolEventParser;
    private final ChatConnector chatConnector;
    private final ScheduledExecutorService streamWatchdogScheduler;
    private final Clock clock;
    private final ChatProperties chatProperties;
    private final ObjectMapper objectMapper;
    private final GatewayMetricsService gatewayMetricsService;

    public SseEmitter openStream(ClientContext context, ChatPromptRequest request) {
        String message = request.getMessage().trim();
        if (message.length() > chatProperties.getMaxMessageLength()) {
            throw new IllegalArgumentException(String.format(
                "A mensagem excede o tamanho máximo de %d caracteres", chatProperties.getMaxMessageLength()));
        }

        SseEmitter emitter = new SseEmitter(Duration.ofSeconds(chatProperties.getSseTimeoutSeconds()).toMillis());
        SseRelay relay = new SseRelay(emitter, clock.millis());
        emitter.onTimeout(emitter::complete);

        ClientContext.Turn turn = context.startTurn(message, request.getConversationId(), clock.instant(),
                conversation -> new ChatEventStream(
                        conversation,
                        protocolEventParser,
                        chatConnector,
                        streamWatchdogScheduler,
                        Duration.ofSeconds(chatProperties.getStallTimeoutSeconds()),
                        clock,
                        relay));

        String frame = promptFrame(message, turn.conversationId(), request.getSystemPrompt(), turn.attachments());
        try {
            turn.stream().open(
                    context.getSessionStore().current(),
                    context.getSessionStore().accessToken().orElse(null),
                    frame);
        } catch (RuntimeException e) {
            context.abandon(turn);
            throw e;
        }
        gatewayMetricsService.recordStreamOpened();
        return emitter;
    }

    /**
     * @return false when no live stream exists for the context
     */
    public boolean cancel(ClientContext context) {
        return context.currentStream()
                .filter(stream -> !stream.getState().isTerminal())
                .map(ChatEventStream::cancel)
                .orElse(false);
    }

    public Conversation conversation(ClientContext context) {
        return context.conversationSnapshot();
    }

    public void resetConversation(ClientContext context) {
        context.resetConversation();
        log.info("Conversation reset for subject {}", context.getSubject());
    }

    String promptFrame(String message, String conversationId, String systemPrompt, List<Attachment> attachments) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("message", message);
        if (conversationId != null) {
            frame.put("conversation_id", conversationId);
        }
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            frame.put("system_prompt", systemPrompt);
        }
        if (!attachments.isEmpty()) {
            ArrayNode items = frame.putArray("attachments");
            for (Attachment attachment : attachments) {
                ObjectNode item = items.addObject();
                item.put("s3_key", attachment.getObjectKey());
                item.put("mime_type", attachment.getMimeType());
                item.put("size_bytes", attachment.getSizeBytes());
                if (attachment.getFilename() != null) {
                    item.put("filename", attachment.getFilename());
                }
            }
        }
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new StreamException("Falha ao montar a mensagem para o agente", e);
        }
    }

    /**
     * Forwards stream updates to one SSE emitter. A browser that went away stops receiving updates; the
     * turn itself keeps running so the conversation stays complete.
     */
    private class SseRelay implements ChatStreamListener {

        private final SseEmitter emitter;
        private final long startedAtMillis;
        private boolean clientGone;

        SseRelay(SseEmitter emitter, long startedAtMillis) {
            this.emitter = emitter;
            this.startedAtMillis = startedAtMillis;
        }

        @Override
        public void onEvent(String eventType, String conversationId, ChatMessage snapshot) {
            send(eventType, new ChatStreamUpdate(eventType, conversationId, snapshot));
        }

        @Override
        public void onTerminal(StreamState state, String conversationId, ChatMessage snapshot) {
            String eventType = state == StreamState.COMPLETED ? "complete" : "error";
            send(eventType, new ChatStreamUpdate(eventType, conversationId, snapshot));
            gatewayMetricsService.recordStreamTerminal(state, clock.millis() - startedAtMillis);
            if (!clientGone) {
                emitter.complete();
            }
        }

        private void send(String eventType, ChatStreamUpdate update) {
            if (clientGone) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().name(eventType).data(update, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                clientGone = true;
                log.debug("SSE client went away: {}", e.getMessage());
            }
        }
    }
}
