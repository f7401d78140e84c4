package arachne_chat_gateway.chat;

/**
 * An open, bidirectional connection to the agent backend carrying JSON text frames.
 */
public interface ChatConnection {

    void send(String frame);

    void close();

    /**
     * Receives what the backend pushes. Calls arrive in delivery order.
     */
    interface Handler {

        void onFrame(String frame);

        /**
         * @param error the transport failure, or {@code null} when the backend closed normally
         */
        void onClose(Throwable error);
    }
}
