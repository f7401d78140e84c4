package arachne_chat_gateway.chat;

import arachne_chat_gateway.exceptions.AuthException;
import arachne_chat_gateway.exceptions.StreamException;
import arachne_chat_gateway.model.ChatMessage;
import arachne_chat_gateway.model.Conversation;
import arachne_chat_gateway.model.MessageRole;
import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.model.StreamState;
import arachne_chat_gateway.protocol.ProtocolEvent;
import arachne_chat_gateway.protocol.ProtocolEventHandler;
import arachne_chat_gateway.protocol.ProtocolEventParser;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One connection attempt to the agent: {@code IDLE -> CONNECTING -> STREAMING -> COMPLETED | ERRORED}.
 *
 * <p>Frames are applied to the conversation strictly in arrival order. All state changes happen while holding
 * the conversation's monitor, which is also what readers of the conversation synchronize on.
 */
@Slf4j
public class ChatEventStream implements ChatConnection.Handler {

    static final String CANCEL_FRAME = "{\"type\":\"cancel\"}";
    static final long WATCHDOG_PERIOD_MILLIS = 1000;

    private static final String MSG_CANCELLED = "Geração cancelada";
    private static final String MSG_STALLED = "O agente parou de responder";
    private static final String MSG_CONNECTION_LOST = "Conexão com o agente perdida";
    private static final String MSG_CLOSED_EARLY = "Conexão encerrada antes do fim da resposta";
    private static final String MSG_AGENT_ERROR = "Erro no agente";

    private final Conversation conversation;
    private final MessageAssembler assembler;
    private final ProtocolEventParser parser;
    private final ChatConnector connector;
    private final ScheduledExecutorService scheduler;
    private final Duration stallTimeout;
    private final Clock clock;
    private final ChatStreamListener listener;
    private final EventApplier applier = new EventApplier();

    private StreamState state = StreamState.IDLE;
    private ChatConnection connection;
    private ScheduledFuture<?> watchdog;
    private Instant lastEventAt;
    private boolean cancelRequested;
    private String errorMessage;

    public ChatEventStream(Conversation conversation,
                           ProtocolEventParser parser,
                           ChatConnector connector,
                           ScheduledExecutorService scheduler,
                           Duration stallTimeout,
                           Clock clock,
                           ChatStreamListener listener) {
        this.conversation = conversation;
        this.assembler = new MessageAssembler(conversation, clock);
        this.parser = parser;
        this.connector = connector;
        this.scheduler = scheduler;
        this.stallTimeout = stallTimeout;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Opens the connection and sends the prompt frame.
     *
     * @throws AuthException when the session is not currently valid; the stream stays {@code IDLE}
     */
    public void open(Session session, String accessToken, String promptFrame) {
        synchronized (conversation) {
            if (state != StreamState.IDLE) {
                throw new IllegalStateException("Stream already opened, state=" + state);
            }
            if (session == null || !session.isAuthenticated() || accessToken == null
                    || session.getExpiresAt() == null || !session.getExpiresAt().isAfter(clock.instant())) {
                throw new AuthException("Sessão inválida ou expirada");
            }

            state = StreamState.CONNECTING;
            lastEventAt = clock.instant();
            watchdog = scheduler.scheduleWithFixedDelay(
                    this::checkStall, WATCHDOG_PERIOD_MILLIS, WATCHDOG_PERIOD_MILLIS, TimeUnit.MILLISECONDS);
            log.info("Opening agent stream for subject {}", session.getSubject());

            try {
                connection = connector.connect(accessToken, this);
                if (!state.isTerminal()) {
                    connection.send(promptFrame);
                }
            } catch (RuntimeException e) {
                log.error("Failed to open agent stream", e);
                fail(e instanceof StreamException ? e.getMessage() : MSG_CONNECTION_LOST);
            }
        }
    }

    /**
     * Asks the backend to stop generating. The stream stays open until the backend acknowledges.
     *
     * @return false when there is no live connection to cancel
     */
    public boolean cancel() {
        synchronized (conversation) {
            if (state.isTerminal() || connection == null) {
                return false;
            }
            cancelRequested = true;
            try {
                connection.send(CANCEL_FRAME);
                log.info("Cancellation sent to agent");
            } catch (RuntimeException e) {
                log.warn("Could not deliver cancellation, ending stream: {}", e.getMessage());
                fail(MSG_CANCELLED);
            }
            return true;
        }
    }

    @Override
    public void onFrame(String frame) {
        synchronized (conversation) {
            if (state.isTerminal()) {
                log.debug("Frame ignored, stream already {}", state);
                return;
            }
            ProtocolEvent event;
            try {
                event = parser.parse(frame);
            } catch (StreamException e) {
                log.warn("Protocol violation from agent: {}", e.getMessage());
                fail(e.getMessage());
                return;
            }
            apply(event);
        }
    }

    @Override
    public void onClose(Throwable error) {
        synchronized (conversation) {
            if (state.isTerminal()) {
                return;
            }
            if (cancelRequested) {
                fail(MSG_CANCELLED);
            } else if (error != null) {
                log.warn("Agent connection dropped: {}", error.getMessage());
                fail(MSG_CONNECTION_LOST);
            } else {
                fail(MSG_CLOSED_EARLY);
            }
        }
    }

    public StreamState getState() {
        synchronized (conversation) {
            return state;
        }
    }

    public String getErrorMessage() {
        synchronized (conversation) {
            return errorMessage;
        }
    }

    void checkStall() {
        synchronized (conversation) {
            if (state.isTerminal()) {
                return;
            }
            if (!Duration.between(lastEventAt, clock.instant()).minus(stallTimeout).isNegative()) {
                log.warn("No agent event for {}s, ending stream", stallTimeout.toSeconds());
                fail(MSG_STALLED);
            }
        }
    }

    private void apply(ProtocolEvent event) {
        if (state == StreamState.CONNECTING) {
            state = StreamState.STREAMING;
        }
        lastEventAt = clock.instant();
        event.dispatch(applier);

        if (event.isTerminal()) {
            return;
        }
        listener.onEvent(event.type(), conversation.getConversationId(), tailSnapshot());
    }

    private void complete() {
        assembler.finalizeMessage();
        terminate(StreamState.COMPLETED);
    }

    private void fail(String message) {
        errorMessage = message;
        assembler.markErrored(message);
        terminate(StreamState.ERRORED);
    }

    private void terminate(StreamState terminalState) {
        state = terminalState;
        if (watchdog != null) {
            watchdog.cancel(false);
        }
        if (connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.debug("Error closing agent connection: {}", e.getMessage());
            }
        }
        log.info("Agent stream ended with state {}", terminalState);
        listener.onTerminal(terminalState, conversation.getConversationId(), tailSnapshot());
    }

    private ChatMessage tailSnapshot() {
        return conversation.tail().map(ChatMessage::copy).orElse(null);
    }

    private class EventApplier implements ProtocolEventHandler<Void> {

        @Override
        public Void onUserPrompt(ProtocolEvent.UserPrompt event) {
            conversation.setBusy(true);
            return null;
        }

        @Override
        public Void onUserPromptProcessed(ProtocolEvent.UserPromptProcessed event) {
            conversation.setBusy(true);
            return null;
        }

        @Override
        public Void onModelRequestStart(ProtocolEvent.ModelRequestStart event) {
            assembler.beginModelRequest();
            return null;
        }

        @Override
        public Void onPartStart(ProtocolEvent.PartStart event) {
            assembler.openPart(event.index(), event.kind());
            return null;
        }

        @Override
        public Void onTextDelta(ProtocolEvent.TextDelta event) {
            assembler.appendText(event.delta());
            return null;
        }

        @Override
        public Void onThinkingDelta(ProtocolEvent.ThinkingDelta event) {
            assembler.appendThinking(event.delta());
            return null;
        }

        @Override
        public Void onToolCallDelta(ProtocolEvent.ToolCallDelta event) {
            assembler.appendToolArgs(event.index(), event.toolCallId(), event.toolName(), event.argsDelta());
            return null;
        }

        @Override
        public Void onCallToolsStart(ProtocolEvent.CallToolsStart event) {
            assembler.startTools();
            return null;
        }

        @Override
        public Void onToolCall(ProtocolEvent.ToolCallEvent event) {
            assembler.upsertToolCall(event.toolCallId(), event.toolName(), event.args());
            return null;
        }

        @Override
        public Void onToolResult(ProtocolEvent.ToolResult event) {
            assembler.completeToolCall(event.toolCallId(), event.toolName(), event.result(), event.signalsFailure());
            return null;
        }

        @Override
        public Void onFinalResultStart(ProtocolEvent.FinalResultStart event) {
            // Text may still stream after this; the output is frozen by final_result.
            assembler.current().ifPresent(message -> log.debug("Final result starting for {}", message.getId()));
            return null;
        }

        @Override
        public Void onFinalResult(ProtocolEvent.FinalResult event) {
            assembler.applyFinalResult(event.output(), event.toolEvents());
            return null;
        }

        @Override
        public Void onComplete(ProtocolEvent.Complete event) {
            if (conversation.getConversationId() == null && event.conversationId() != null) {
                conversation.setConversationId(event.conversationId());
            }
            complete();
            return null;
        }

        @Override
        public Void onError(ProtocolEvent.Error event) {
            String message = event.message() == null || event.message().isBlank() ? MSG_AGENT_ERROR : event.message();
            fail(message);
            return null;
        }

        @Override
        public Void onConversationCreated(ProtocolEvent.ConversationCreated event) {
            conversation.setConversationId(event.conversationId());
            return null;
        }

        @Override
        public Void onConversationUpdated(ProtocolEvent.ConversationUpdated event) {
            if (event.conversationId() != null) {
                conversation.setConversationId(event.conversationId());
            }
            if (event.title() != null) {
                conversation.setTitle(event.title());
            }
            return null;
        }

        @Override
        public Void onMessageSaved(ProtocolEvent.MessageSaved event) {
            MessageRole role = "user".equalsIgnoreCase(event.role()) ? MessageRole.USER : MessageRole.ASSISTANT;
            List<ChatMessage> messages = conversation.getMessages();
            for (int i = messages.size() - 1; i >= 0; i--) {
                ChatMessage message = messages.get(i);
                if (message.getRole() == role && message.getSavedId() == null) {
                    message.setSavedId(event.messageId());
                    break;
                }
            }
            return null;
        }
    }
}
