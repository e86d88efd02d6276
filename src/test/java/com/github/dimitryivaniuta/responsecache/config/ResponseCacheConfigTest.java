package com.github.dimitryivaniuta.responsecache.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheConfigTest {

    @Test
    void writeBackExecutor_shouldBeSyncWhenAsyncDisabled() {
        ResponseCacheProperties.WriteBack wb = new ResponseCacheProperties.WriteBack();
        wb.setAsync(false);

        assertThat(ResponseCacheConfig.writeBackExecutor(wb)).isInstanceOf(SyncTaskExecutor.class);
    }

    @Test
    void writeBackExecutor_shouldBeBoundedPoolWhenAsync() {
        ResponseCacheProperties.WriteBack wb = new ResponseCacheProperties.WriteBack();
        wb.setAsync(true);
        wb.setPoolSize(3);
        wb.setQueueCapacity(10);

        TaskExecutor executor = ResponseCacheConfig.writeBackExecutor(wb);
        try {
            assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
            ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) executor;
            assertThat(pool.getCorePoolSize()).isEqualTo(3);
            assertThat(pool.getMaxPoolSize()).isEqualTo(3);
            assertThat(pool.getThreadPoolExecutor().getQueue().remainingCapacity()).isEqualTo(10);
            assertThat(pool.getThreadNamePrefix()).isEqualTo("response-cache-write-");
        } finally {
            ((ThreadPoolTaskExecutor) executor).shutdown();
        }
    }
}
