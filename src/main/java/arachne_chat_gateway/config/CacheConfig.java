package arachne_chat_gateway.config;

import arachne_chat_gateway.chat.ClientContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    @Bean
    public Cache<String, ClientContext> clientContextCache(ChatProperties chatProperties) {
        return Caffeine.newBuilder()
                .maximumSize(chatProperties.getContextCacheMaxSize())
                .expireAfterAccess(chatProperties.getContextIdleMinutes(), TimeUnit.MINUTES)
                .recordStats()
                .build();
    }
}
