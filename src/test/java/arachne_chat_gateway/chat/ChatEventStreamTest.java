package arachne_chat_gateway.chat;

import arachne_chat_gateway.exceptions.AuthException;
import arachne_chat_gateway.exceptions.StreamException;
import arachne_chat_gateway.model.ChatMessage;
import arachne_chat_gateway.model.Conversation;
import arachne_chat_gateway.model.Session;
import arachne_chat_gateway.model.StreamState;
import arachne_chat_gateway.protocol.ProtocolEventParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@org.mockito.junit.jupiter.MockitoSettings(strictness = org.mockito.quality.Strictness.LENIENT)
class ChatEventStreamTest {

    private static final String PROMPT_FRAME = "{\"message\":\"Oi\"}";

    @Mock
    private ChatConnector connector;

    @Mock
    private ChatConnection connection;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ScheduledFuture<?> watchdog;

    @Mock
    private ChatStreamListener listener;

    private MutableClock clock;
    private Conversation conversation;
    private ChatEventStream stream;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        conversation = new Conversation();
        conversation.append(ChatMessage.user("Oi", List.of(), clock.instant()));
        conversation.setBusy(true);

        when(connector.connect(anyString(), any(ChatConnection.Handler.class))).thenReturn(connection);
        doReturn(watchdog).when(scheduler)
                .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

        stream = new ChatEventStream(conversation, new ProtocolEventParser(new ObjectMapper()), connector,
                scheduler, Duration.ofSeconds(120), clock, listener);
    }

    @Test
    void shouldSendPromptAndCompleteOnCompleteEvent() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);

        assertEquals(StreamState.CONNECTING, stream.getState());
        verify(connector).connect("access-1", stream);
        verify(connection).send(PROMPT_FRAME);

        stream.onFrame("{\"type\":\"conversation_created\",\"data\":{\"conversation_id\":\"conv-1\"}}");
        assertEquals(StreamState.STREAMING, stream.getState());
        stream.onFrame("{\"type\":\"model_request_start\"}");
        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\"Olá!\"}}");
        stream.onFrame("{\"type\":\"complete\",\"data\":{\"conversation_id\":\"conv-1\"}}");

        assertEquals(StreamState.COMPLETED, stream.getState());
        assertEquals("conv-1", conversation.getConversationId());
        assertFalse(conversation.isBusy());
        ChatMessage reply = conversation.getMessages().get(1);
        assertEquals("Olá!", reply.getTextContent());
        assertFalse(reply.isStreaming());

        ArgumentCaptor<ChatMessage> snapshot = ArgumentCaptor.forClass(ChatMessage.class);
        verify(listener).onTerminal(eq(StreamState.COMPLETED), eq("conv-1"), snapshot.capture());
        assertEquals("Olá!", snapshot.getValue().getTextContent());
        verify(listener, times(3)).onEvent(anyString(), any(), any());
        verify(connection).close();
        verify(watchdog).cancel(false);
    }

    @Test
    void shouldRefuseToOpenWithExpiredSession() {
        Session expired = Session.builder()
                .authenticated(true)
                .subject("user-1")
                .expiresAt(clock.instant().minusSeconds(1))
                .build();

        assertThrows(AuthException.class, () -> stream.open(expired, "access-1", PROMPT_FRAME));
        assertThrows(AuthException.class, () -> stream.open(Session.anonymous(), "access-1", PROMPT_FRAME));

        assertEquals(StreamState.IDLE, stream.getState());
        verify(connector, never()).connect(anyString(), any());
    }

    @Test
    void shouldRefuseToOpenTwice() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);

        assertThrows(IllegalStateException.class, () -> stream.open(validSession(), "access-1", PROMPT_FRAME));
    }

    @Test
    void shouldKeepPartialContentOnAgentError() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);
        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\"meia resp\"}}");
        stream.onFrame("{\"type\":\"error\",\"data\":{\"message\":\"Limite excedido\"}}");

        assertEquals(StreamState.ERRORED, stream.getState());
        assertEquals("Limite excedido", stream.getErrorMessage());
        ChatMessage reply = conversation.getMessages().get(1);
        assertTrue(reply.isErrored());
        assertEquals("meia resp", reply.getTextContent());
        assertFalse(conversation.getMessages().get(0).isErrored());
        verify(listener).onTerminal(eq(StreamState.ERRORED), any(), any(ChatMessage.class));
    }

    @Test
    void shouldErrorWhenConnectionClosesBeforeTerminalEvent() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);
        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\"x\"}}");

        stream.onClose(null);

        assertEquals(StreamState.ERRORED, stream.getState());
        assertEquals("Conexão encerrada antes do fim da resposta", stream.getErrorMessage());
    }

    @Test
    void shouldReportLostConnectionOnTransportError() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);

        stream.onClose(new java.io.IOException("reset"));

        assertEquals("Conexão com o agente perdida", stream.getErrorMessage());
    }

    @Test
    void shouldSendCancelFrameAndEndAsCancelled() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);
        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\"parcial\"}}");

        assertTrue(stream.cancel());
        verify(connection).send(ChatEventStream.CANCEL_FRAME);
        assertEquals(StreamState.STREAMING, stream.getState());

        stream.onClose(null);

        assertEquals(StreamState.ERRORED, stream.getState());
        assertEquals("Geração cancelada", stream.getErrorMessage());
        assertEquals("parcial", conversation.getMessages().get(1).getTextContent());
    }

    @Test
    void shouldNotCancelFinishedStream() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);
        stream.onFrame("{\"type\":\"complete\"}");

        assertFalse(stream.cancel());
        verify(connection, never()).send(ChatEventStream.CANCEL_FRAME);
    }

    @Test
    void shouldIgnoreFramesAfterTerminalState() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);
        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\"fim\"}}");
        stream.onFrame("{\"type\":\"complete\"}");

        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\" depois\"}}");
        stream.onFrame("{\"type\":\"error\",\"data\":{\"message\":\"tarde demais\"}}");
        stream.onClose(new java.io.IOException("reset"));

        assertEquals(StreamState.COMPLETED, stream.getState());
        assertEquals(2, conversation.getMessages().size());
        assertEquals("fim", conversation.getMessages().get(1).getTextContent());
        verify(listener, times(1)).onTerminal(any(), any(), any());
    }

    @Test
    void shouldErrorWhenAgentStalls() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);
        ArgumentCaptor<Runnable> watchdogTask = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(watchdogTask.capture(),
                eq(ChatEventStream.WATCHDOG_PERIOD_MILLIS), eq(ChatEventStream.WATCHDOG_PERIOD_MILLIS),
                eq(TimeUnit.MILLISECONDS));

        clock.advance(Duration.ofSeconds(60));
        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\"a\"}}");
        clock.advance(Duration.ofSeconds(119));
        watchdogTask.getValue().run();
        assertEquals(StreamState.STREAMING, stream.getState());

        clock.advance(Duration.ofSeconds(1));
        watchdogTask.getValue().run();

        assertEquals(StreamState.ERRORED, stream.getState());
        assertEquals("O agente parou de responder", stream.getErrorMessage());
        verify(connection).close();
    }

    @Test
    void shouldErrorOnMalformedFrame() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);

        stream.onFrame("{\"type\":\"mystery\"}");

        assertEquals(StreamState.ERRORED, stream.getState());
        assertEquals("Tipo de evento desconhecido: mystery", stream.getErrorMessage());
    }

    @Test
    void shouldErrorWhenConnectionCannotBeOpened() {
        when(connector.connect(anyString(), any(ChatConnection.Handler.class)))
                .thenThrow(new StreamException("Agente indisponível"));

        stream.open(validSession(), "access-1", PROMPT_FRAME);

        assertEquals(StreamState.ERRORED, stream.getState());
        assertEquals("Agente indisponível", stream.getErrorMessage());
        assertTrue(conversation.getMessages().get(1).isErrored());
    }

    @Test
    void shouldApplyConversationMetadata() {
        stream.open(validSession(), "access-1", PROMPT_FRAME);
        stream.onFrame("{\"type\":\"conversation_created\",\"data\":{\"conversation_id\":\"conv-9\"}}");
        stream.onFrame("{\"type\":\"conversation_updated\",\"data\":{\"title\":\"Receitas\"}}");
        stream.onFrame("{\"type\":\"message_saved\",\"data\":{\"message_id\":\"m-user\",\"role\":\"user\"}}");
        stream.onFrame("{\"type\":\"text_delta\",\"data\":{\"delta\":\"ok\"}}");
        stream.onFrame("{\"type\":\"message_saved\",\"data\":{\"message_id\":\"m-bot\",\"role\":\"assistant\"}}");

        assertEquals("conv-9", conversation.getConversationId());
        assertEquals("Receitas", conversation.getTitle());
        assertEquals("m-user", conversation.getMessages().get(0).getSavedId());
        assertEquals("m-bot", conversation.getMessages().get(1).getSavedId());
    }

    private Session validSession() {
        return Session.builder()
                .authenticated(true)
                .subject("user-1")
                .role("user")
                .expiresAt(clock.instant().plusSeconds(900))
                .build();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
