package arachne_chat_gateway.exceptions;

/**
 * Rotation of the token pair failed. {@code rejected} distinguishes a backend refusal of the refresh token
 * from a transport failure; both end the local session.
 */
public class RefreshException extends RuntimeException {

    private final boolean rejected;

    public RefreshException(String message, boolean rejected) {
        super(message);
        this.rejected = rejected;
    }

    public RefreshException(String message, boolean rejected, Throwable cause) {
        super(message, cause);
        this.rejected = rejected;
    }

    public boolean isRejected() {
        return rejected;
    }
}
