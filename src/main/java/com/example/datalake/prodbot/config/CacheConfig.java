package com.example.datalake.prodbot.config;

import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.model.EngineResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    /** Command responses keyed by {@code command:productId:params}; LRU-bounded. */
    @Bean
    public Cache<String, EngineResponse> commandResponseCache(BotProperties props) {
        return Caffeine.newBuilder()
                .maximumSize(props.responseCacheSize())
                .build();
    }

    @Bean
    public Cache<String, ConversationContext> sessionCache(BotProperties props) {
        return Caffeine.newBuilder()
                .maximumSize(props.maxSessions())
                .expireAfterAccess(props.sessionTimeout())
                .build();
    }
}
