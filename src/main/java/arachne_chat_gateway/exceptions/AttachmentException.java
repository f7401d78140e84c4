package arachne_chat_gateway.exceptions;

public class AttachmentException extends RuntimeException {
    
    public AttachmentException(String message) {
        super(message);
    }
    
    public AttachmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
