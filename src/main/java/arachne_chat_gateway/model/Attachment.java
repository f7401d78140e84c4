package arachne_chat_gateway.model;

import lombok.Getter;

@Getter
public class Attachment {

    private final String objectKey;
    private final String mimeType;
    private final long sizeBytes;
    private final String filename;
    private AttachmentStatus status;
    private String errorMessage;

    public Attachment(String objectKey, String mimeType, long sizeBytes, String filename) {
        this.objectKey = objectKey;
        this.mimeType = mimeType;
        this.sizeBytes = sizeBytes;
        this.filename = filename;
        this.status = AttachmentStatus.PENDING;
    }

    private Attachment(Attachment source) {
        this(source.objectKey, source.mimeType, source.sizeBytes, source.filename);
        this.status = source.status;
        this.errorMessage = source.errorMessage;
    }

    /**
     * Applies a forward transition ({@code pending -> uploading -> uploaded|error}).
     *
     * @return false when the transition would go backwards or leave a terminal state
     */
    public boolean transitionTo(AttachmentStatus next, String message) {
        boolean allowed = switch (status) {
            case PENDING -> next == AttachmentStatus.UPLOADING || next == AttachmentStatus.ERROR;
            case UPLOADING -> next == AttachmentStatus.UPLOADED || next == AttachmentStatus.ERROR;
            case UPLOADED, ERROR -> false;
        };
        if (!allowed) {
            return false;
        }
        this.status = next;
        this.errorMessage = next == AttachmentStatus.ERROR ? message : null;
        return true;
    }

    /** Starts a new attempt for an errored attachment. */
    public boolean restart() {
        if (status != AttachmentStatus.ERROR) {
            return false;
        }
        this.status = AttachmentStatus.PENDING;
        this.errorMessage = null;
        return true;
    }

    public Attachment copy() {
        return new Attachment(this);
    }
}
