package org.stocktake.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(StockTakeProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 同步线程：单线程，保证同一时间只有一个后台同步在跑
     */
    @Bean
    public TaskExecutor syncTaskExecutor(StockTakeProperties properties) {
        if (!properties.getSync().isAsyncDrain()) {
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("stocktake-sync-");
        // 队列满时丢弃：已排队的同步会处理所有积压写入
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        // initialize() 由容器在 afterPropertiesSet 中调用
        return executor;
    }
}
