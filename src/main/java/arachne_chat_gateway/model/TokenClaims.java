package arachne_chat_gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Claims carried by the access and refresh tokens issued by the agent backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenClaims {

    public static final String TYPE_ACCESS = "access";
    public static final String TYPE_REFRESH = "refresh";

    @JsonProperty("sub")
    private String subject;

    @JsonProperty("type")
    private String tokenType;

    @JsonProperty("role")
    private String role;

    @JsonProperty("is_superuser")
    private Boolean superuser;

    /** Epoch seconds. */
    @JsonProperty("exp")
    private Long expiresAt;

    @JsonProperty("iat")
    private Long issuedAt;

    public boolean isAccessToken() {
        return TYPE_ACCESS.equals(tokenType);
    }

    public boolean isRefreshToken() {
        return TYPE_REFRESH.equals(tokenType);
    }
}
