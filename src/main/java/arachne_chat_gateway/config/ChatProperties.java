package arachne_chat_gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "chat")
@Getter
@Setter
public class ChatProperties {
    private int stallTimeoutSeconds = 120;
    private long sseTimeoutSeconds = 600;
    private long maxTotalAttachmentBytes = 20L * 1024 * 1024;
    private List<String> allowedMimeTypes = new ArrayList<>(List.of(
            "image/png",
            "image/jpeg",
            "image/webp",
            "image/heic",
            "image/heif"
    ));
    private int maxMessageLength = 100000;
    private long contextCacheMaxSize = 10000;
    private long contextIdleMinutes = 60;
}
