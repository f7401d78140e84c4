package arachne_chat_gateway.exceptions;

public class StreamException extends RuntimeException {
    
    public StreamException(String message) {
        super(message);
    }
    
    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
