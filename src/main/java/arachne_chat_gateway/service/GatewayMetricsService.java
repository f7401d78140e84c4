package arachne_chat_gateway.service;

import arachne_chat_gateway.model.StreamState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayMetricsService {

    private final MeterRegistry meterRegistry;
    private final Cache<String, Counter> counterCache = Caffeine.newBuilder()
            .maximumSize(500)
            .expireAfterWrite(1, TimeUnit.HOURS)
            .build();
    private final Cache<String, Timer> timerCache = Caffeine.newBuilder()
            .maximumSize(500)
            .expireAfterWrite(1, TimeUnit.HOURS)
            .build();

    /**
     * @param outcome {@code ok}, {@code rejected} or {@code failed}
     */
    public void recordRefresh(String outcome) {
        try {
            getCounter("gateway.session.refresh", "outcome", outcome).increment();
        } catch (Exception e) {
            log.warn("Failed to record refresh metric", e);
        }
    }

    public void recordLogout() {
        try {
            getCounter("gateway.session.logout").increment();
        } catch (Exception e) {
            log.warn("Failed to record logout metric", e);
        }
    }

    public void recordStreamOpened() {
        try {
            getCounter("gateway.stream.opened").increment();
        } catch (Exception e) {
            log.warn("Failed to record stream opened metric", e);
        }
    }

    public void recordStreamTerminal(StreamState state, long durationMs) {
        try {
            String stateTag = state.name().toLowerCase();
            getCounter("gateway.stream.terminal", "state", stateTag).increment();
            getTimer("gateway.stream.duration", "state", stateTag).record(durationMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.warn("Failed to record stream terminal metric", e);
        }
    }

    public void recordAttachmentRejected(String reason) {
        try {
            getCounter("gateway.attachments.rejected", "reason", reason).increment();
        } catch (Exception e) {
            log.warn("Failed to record attachment rejection metric", e);
        }
    }

    private Counter getCounter(String name, String... tags) {
        try {
            String key = name + ":" + String.join(":", tags);
            return counterCache.get(key, k -> {
                Counter.Builder builder = Counter.builder(name);
                for (int i = 0; i + 1 < tags.length; i += 2) {
                    builder.tag(tags[i], tags[i + 1]);
                }
                return builder.register(meterRegistry);
            });
        } catch (Exception e) {
            log.warn("Failed to get or create counter: " + name, e);
            return Counter.builder(name).register(new SimpleMeterRegistry());
        }
    }

    private Timer getTimer(String name, String... tags) {
        try {
            String key = name + ":" + String.join(":", tags);
            return timerCache.get(key, k -> {
                Timer.Builder builder = Timer.builder(name);
                for (int i = 0; i + 1 < tags.length; i += 2) {
                    builder.tag(tags[i], tags[i + 1]);
                }
                return builder.register(meterRegistry);
            });
        } catch (Exception e) {
            log.warn("Failed to get or create timer: " + name, e);
            return Timer.builder(name).register(new SimpleMeterRegistry());
        }
    }
}
