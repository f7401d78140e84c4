package arachne_chat_gateway.chat;

public interface ChatConnector {

    /**
     * Opens a connection authenticated with the given access token.
     *
     * @throws arachne_chat_gateway.exceptions.StreamException when the connection cannot be established
     */
    ChatConnection connect(String accessToken, ChatConnection.Handler handler);
}
