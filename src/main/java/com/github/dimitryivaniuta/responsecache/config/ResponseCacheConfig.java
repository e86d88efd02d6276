package com.github.dimitryivaniuta.responsecache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.responsecache.cache.RequestFingerprinter;
import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheSettings;
import com.github.dimitryivaniuta.responsecache.cache.RouteFilter;
import com.github.dimitryivaniuta.responsecache.metrics.ResponseCacheMetrics;
import com.github.dimitryivaniuta.responsecache.store.CacheStoreAdapter;
import com.github.dimitryivaniuta.responsecache.store.HashStoreClient;
import com.github.dimitryivaniuta.responsecache.store.LocalHashStoreClient;
import com.github.dimitryivaniuta.responsecache.store.RedisHashStoreClient;
import com.github.dimitryivaniuta.responsecache.web.ResponseCacheFilter;
import com.github.dimitryivaniuta.responsecache.web.ResponseCacheHandler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the response cache:
 * - store client selected by "response-cache.store" (redis | local)
 * - settings validated once here, so configuration mistakes stop the application at startup
 * - write-back executor owned by the store adapter (async by default; sync keeps tests deterministic)
 * - servlet filter registration
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ResponseCacheProperties.class)
public class ResponseCacheConfig {

    @Bean
    @ConditionalOnProperty(prefix = "response-cache", name = "store", havingValue = "redis", matchIfMissing = true)
    public HashStoreClient redisHashStoreClient(StringRedisTemplate redisTemplate) {
        log.info("Response cache store: redis");
        return new RedisHashStoreClient(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "response-cache", name = "store", havingValue = "local")
    public HashStoreClient localHashStoreClient(ResponseCacheProperties props) {
        log.info("Response cache store: local (maximumSize={})", props.getLocal().getMaximumSize());
        return new LocalHashStoreClient(props.getLocal().getMaximumSize());
    }

    @Bean
    public ResponseCacheSettings responseCacheSettings(ResponseCacheProperties props, HashStoreClient client) {
        return ResponseCacheSettings.builder()
                .ttlSeconds(props.getTtl())
                .enabled(props.isEnabled())
                .includeBody(props.isIncludeBody())
                .disabled(props.getDisabled())
                .headers(props.getHeaders())
                .explicit(props.getExplicit())
                .client(client)
                .build();
    }

    @Bean
    public ResponseCacheMetrics responseCacheMetrics(MeterRegistry registry) {
        return new ResponseCacheMetrics(registry);
    }

    /**
     * The write-back executor is owned by the adapter and closed with it. It is not a bean,
     * so Boot's applicationTaskExecutor stays the one used for @Async and MVC async.
     */
    @Bean
    public CacheStoreAdapter cacheStoreAdapter(ResponseCacheSettings settings,
                                               ObjectMapper objectMapper,
                                               ResponseCacheProperties props,
                                               ResponseCacheMetrics metrics) {
        return new CacheStoreAdapter(settings.client(), objectMapper, writeBackExecutor(props.getWriteBack()), metrics);
    }

    static TaskExecutor writeBackExecutor(ResponseCacheProperties.WriteBack wb) {
        if (!wb.isAsync()) {
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("response-cache-write-");
        executor.setCorePoolSize(wb.getPoolSize());
        executor.setMaxPoolSize(wb.getPoolSize());
        executor.setQueueCapacity(wb.getQueueCapacity());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean
    public ResponseCacheHandler responseCacheHandler(ResponseCacheSettings settings,
                                                     CacheStoreAdapter store,
                                                     ObjectMapper objectMapper,
                                                     ResponseCacheMetrics metrics) {
        return new ResponseCacheHandler(
                settings,
                new RouteFilter(settings),
                new RequestFingerprinter(settings, objectMapper),
                store,
                objectMapper,
                metrics
        );
    }

    @Bean
    public FilterRegistrationBean<ResponseCacheFilter> responseCacheFilter(ResponseCacheHandler handler,
                                                                           ObjectMapper objectMapper,
                                                                           ResponseCacheProperties props) {
        FilterRegistrationBean<ResponseCacheFilter> reg =
                new FilterRegistrationBean<>(new ResponseCacheFilter(handler, objectMapper));
        reg.setName("responseCacheFilter");
        reg.setOrder(props.getFilterOrder());
        reg.addUrlPatterns("/*");
        return reg;
    }
}
