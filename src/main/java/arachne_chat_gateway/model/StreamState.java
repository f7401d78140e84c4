package arachne_chat_gateway.model;

public enum StreamState {
    IDLE,
    CONNECTING,
    STREAMING,
    COMPLETED,
    ERRORED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED;
    }
}
