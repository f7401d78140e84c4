package arachne_chat_gateway.model;

import lombok.Getter;

/**
 * A contiguous span of one content kind inside a streaming message.
 */
@Getter
public class ContentPart {

    private final PartKind kind;
    private final StringBuilder content = new StringBuilder();

    public ContentPart(PartKind kind) {
        this.kind = kind;
    }

    public void append(String delta) {
        content.append(delta);
    }

    public String text() {
        return content.toString();
    }

    public ContentPart copy() {
        ContentPart copy = new ContentPart(kind);
        copy.content.append(content);
        return copy;
    }
}
