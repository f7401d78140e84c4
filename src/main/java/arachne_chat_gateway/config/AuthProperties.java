package arachne_chat_gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "auth")
@Getter
@Setter
public class AuthProperties {
    private String publicKey = "";
    private long accessTokenMaxAgeSeconds = 1800;
    private long refreshTokenMaxAgeSeconds = 604800;
    private long refreshBufferSeconds = 300;
    private boolean secureCookies = false;
    private String cookiePath = "/";
}
