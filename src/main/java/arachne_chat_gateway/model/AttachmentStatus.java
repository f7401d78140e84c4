package arachne_chat_gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AttachmentStatus {
    PENDING,
    UPLOADING,
    UPLOADED,
    ERROR;

    /** Counts towards the aggregate size cap of the draft message. */
    public boolean occupiesQuota() {
        return this != ERROR;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AttachmentStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        return AttachmentStatus.valueOf(value.trim().toUpperCase());
    }
}
