package arachne_chat_gateway.service;

import arachne_chat_gateway.dto.request.RefreshTokenRequest;
import arachne_chat_gateway.dto.response.RefreshTokenResponse;
import arachne_chat_gateway.exceptions.AuthException;
import arachne_chat_gateway.exceptions.RefreshException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the backend auth endpoints used by the session layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackendAuthClient {

    static final String REFRESH_PATH = "/api/v1/auth/refresh";
    static final String LOGOUT_PATH = "/api/v1/auth/logout";

    private static final String LOG_KEY_STATUS_CODE = "statusCode";
    private static final String LOG_KEY_DURATION_MS = "durationMs";

    private final WebClient backendWebClient;

    @Value("${backend.timeout-seconds:10}")
    private long timeoutSeconds;

    /**
     * Exchanges a refresh token for a new pair. Never retried: a refresh token may be single-use on the backend.
     *
     * @throws RefreshException with {@code rejected=true} when the backend answered 4xx
     */
    public RefreshTokenResponse refresh(String refreshToken) {
        long startTime = System.currentTimeMillis();
        try {
            RefreshTokenResponse response = backendWebClient.post()
                    .uri(REFRESH_PATH)
                    .bodyValue(new RefreshTokenRequest(refreshToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError,
                        resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> {
                                log.warn("Backend rejected refresh token", Map.of(
                                    LOG_KEY_STATUS_CODE, resp.statusCode().value()
                                ));
                                return new RefreshException("Refresh token rejeitado pelo backend", true);
                            }))
                    .bodyToMono(RefreshTokenResponse.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            if (response == null || response.getAccessToken() == null || response.getAccessToken().isBlank()) {
                throw new RefreshException("Resposta de refresh sem access token", false);
            }

            log.info("Backend refresh completed", Map.of(
                LOG_KEY_DURATION_MS, System.currentTimeMillis() - startTime,
                "rotatedRefreshToken", response.getRefreshToken() != null
            ));
            return response;
        } catch (RefreshException e) {
            throw e;
        } catch (WebClientResponseException e) {
            log.error("Backend refresh HTTP error", Map.of(
                LOG_KEY_STATUS_CODE, e.getStatusCode().value(),
                LOG_KEY_DURATION_MS, System.currentTimeMillis() - startTime
            ), e);
            throw new RefreshException(
                String.format("Backend indisponível para refresh (HTTP %d)", e.getStatusCode().value()), false, e);
        } catch (Exception e) {
            log.error("Backend refresh failed", Map.of(
                LOG_KEY_DURATION_MS, System.currentTimeMillis() - startTime,
                "errorType", e.getClass().getName()
            ), e);
            throw new RefreshException("Falha de comunicação com o backend durante o refresh", false, e);
        }
    }

    @Retryable(
        retryFor = {WebClientRequestException.class},
        maxAttempts = 2,
        backoff = @Backoff(delay = 200)
    )
    public void notifyLogout(String refreshToken) {
        backendWebClient.post()
                .uri(LOGOUT_PATH)
                .bodyValue(new RefreshTokenRequest(refreshToken))
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();
        log.debug("Backend acknowledged logout");
    }

    @Recover
    public void recoverLogout(WebClientRequestException e, String refreshToken) {
        log.warn("Backend logout notification failed after retries", Map.of(
            "message", String.valueOf(e.getMessage())
        ));
        throw new AuthException("Backend não confirmou o logout", e);
    }
}
