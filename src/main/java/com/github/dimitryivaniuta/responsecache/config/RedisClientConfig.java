package com.github.dimitryivaniuta.responsecache.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Lettuce tuning for the Redis-backed store. Host, port and credentials stay in spring.data.redis.*.
 *
 * Short command timeout: a slow Redis must turn into a cache miss quickly, not a slow request.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "response-cache", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisClientConfig {

    @Bean
    public LettuceClientConfigurationBuilderCustomizer responseCacheLettuceCustomizer() {
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(2))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(Duration.ofSeconds(1)))
                .build();

        log.info("Configured Lettuce client options for response cache store");
        return builder -> builder
                .clientOptions(clientOptions)
                .commandTimeout(Duration.ofSeconds(1));
    }
}
