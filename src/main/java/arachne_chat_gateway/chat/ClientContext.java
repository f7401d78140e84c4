package arachne_chat_gateway.chat;

import arachne_chat_gateway.exceptions.ConflictException;
import arachne_chat_gateway.model.Attachment;
import arachne_chat_gateway.model.ChatMessage;
import arachne_chat_gateway.model.Conversation;
import arachne_chat_gateway.model.StreamState;
import arachne_chat_gateway.session.SessionRefresher;
import arachne_chat_gateway.session.SessionStore;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Everything the gateway keeps for one authenticated subject: its session, its conversation, the draft
 * attachments and at most one live stream.
 */
public class ClientContext {

    @Getter
    private final String subject;
    @Getter
    private final SessionStore sessionStore;
    @Getter
    private final SessionRefresher sessionRefresher;
    @Getter
    private final AttachmentTracker attachments;

    private Conversation conversation = new Conversation();
    private ChatEventStream stream;

    public ClientContext(String subject,
                         SessionStore sessionStore,
                         SessionRefresher sessionRefresher,
                         AttachmentTracker attachments) {
        this.subject = subject;
        this.sessionStore = sessionStore;
        this.sessionRefresher = sessionRefresher;
        this.attachments = attachments;
    }

    /**
     * Opens a new turn: switches conversation when another one is requested, moves the uploaded draft
     * attachments onto the user's message and installs the stream built for the turn.
     *
     * @throws ConflictException when a stream is still live for this context
     * @throws arachne_chat_gateway.exceptions.AttachmentException when a draft attachment is not uploaded yet
     */
    public synchronized Turn startTurn(String text, String requestedConversationId, Instant now,
                                       Function<Conversation, ChatEventStream> streamFactory) {
        if (hasLiveStream()) {
            throw new ConflictException("Já existe uma resposta em andamento para esta conversa");
        }
        if (requestedConversationId != null && conversation.getConversationId() != null
                && !requestedConversationId.equals(conversation.getConversationId())) {
            conversation = new Conversation();
        }
        List<Attachment> sent = attachments.drainForSend();
        ChatMessage userMessage = ChatMessage.user(text, sent, now);
        synchronized (conversation) {
            if (conversation.getConversationId() == null) {
                conversation.setConversationId(requestedConversationId);
            }
            conversation.append(userMessage);
            conversation.setBusy(true);
        }
        stream = streamFactory.apply(conversation);
        return new Turn(stream, sent, conversation.getConversationId(), userMessage);
    }

    /**
     * Undoes a turn whose stream never got past {@code IDLE}: the user message leaves the conversation and
     * its attachments go back to the draft.
     */
    public synchronized void abandon(Turn turn) {
        if (stream != turn.stream() || stream.getState() != StreamState.IDLE) {
            return;
        }
        stream = null;
        synchronized (conversation) {
            conversation.remove(turn.userMessage());
            conversation.setBusy(false);
        }
        attachments.restore(turn.attachments());
    }

    public synchronized Optional<ChatEventStream> currentStream() {
        return Optional.ofNullable(stream);
    }

    public synchronized boolean hasLiveStream() {
        return stream != null && !stream.getState().isTerminal();
    }

    public synchronized StreamState streamState() {
        return stream == null ? StreamState.IDLE : stream.getState();
    }

    public synchronized Conversation conversationSnapshot() {
        synchronized (conversation) {
            return conversation.copy();
        }
    }

    /**
     * Drops the conversation and starts an empty one.
     *
     * @throws ConflictException while a stream is live
     */
    public synchronized void resetConversation() {
        if (hasLiveStream()) {
            throw new ConflictException("Não é possível iniciar nova conversa durante uma resposta");
        }
        conversation = new Conversation();
        stream = null;
    }

    public record Turn(ChatEventStream stream, List<Attachment> attachments, String conversationId,
                       ChatMessage userMessage) {
    }
}
