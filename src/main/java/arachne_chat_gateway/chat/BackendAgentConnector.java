package arachne_chat_gateway.chat;

import arachne_chat_gateway.exceptions.StreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opens the agent WebSocket of the backend. The access token travels in the handshake's
 * {@code Authorization} header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendAgentConnector implements ChatConnector {

    private final WebSocketClient agentWebSocketClient;

    @Value("${backend.ws-url}")
    private String agentWsUrl;

    @Override
    public ChatConnection connect(String accessToken, ChatConnection.Handler handler) {
        if (agentWsUrl == null || agentWsUrl.isBlank()) {
            throw new StreamException("backend.ws-url não configurado");
        }
        URI uri = URI.create(agentWsUrl);
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);

        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        AtomicBoolean closed = new AtomicBoolean();

        Disposable subscription = agentWebSocketClient.execute(uri, headers, session ->
                session.send(outbound.asFlux().map(session::textMessage))
                        .and(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(handler::onFrame)
                                .doFinally(signal -> outbound.tryEmitComplete())
                                .then()))
                .subscribe(
                        unused -> { },
                        error -> {
                            if (closed.compareAndSet(false, true)) {
                                log.warn("Agent socket failed: {}", error.getMessage());
                                handler.onClose(error);
                            }
                        },
                        () -> {
                            if (closed.compareAndSet(false, true)) {
                                log.debug("Agent socket closed by backend");
                                handler.onClose(null);
                            }
                        });

        log.debug("Agent socket opening to {}", uri);
        return new SocketConnection(outbound, subscription, closed);
    }

    private static final class SocketConnection implements ChatConnection {

        private final Sinks.Many<String> outbound;
        private final Disposable subscription;
        private final AtomicBoolean closed;

        private SocketConnection(Sinks.Many<String> outbound, Disposable subscription, AtomicBoolean closed) {
            this.outbound = outbound;
            this.subscription = subscription;
            this.closed = closed;
        }

        @Override
        public void send(String frame) {
            if (closed.get()) {
                throw new StreamException("Conexão com o agente já encerrada");
            }
            Sinks.EmitResult result = outbound.tryEmitNext(frame);
            if (result.isFailure()) {
                throw new StreamException("Não foi possível enviar ao agente: " + result);
            }
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                outbound.tryEmitComplete();
                subscription.dispose();
            }
        }
    }
}
