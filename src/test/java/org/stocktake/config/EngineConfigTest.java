package org.stocktake.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 同步线程配置：后台模式为单线程池，测试模式在调用线程内执行
 */
class EngineConfigTest {

    private final EngineConfig engineConfig = new EngineConfig();

    @Test
    void asyncDrainRunsOnSingleNamedThread() throws Exception {
        StockTakeProperties properties = new StockTakeProperties();
        properties.getSync().setAsyncDrain(true);

        TaskExecutor taskExecutor = engineConfig.syncTaskExecutor(properties);

        assertTrue(taskExecutor instanceof ThreadPoolTaskExecutor);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) taskExecutor;
        assertEquals(1, executor.getCorePoolSize());
        assertEquals(1, executor.getMaxPoolSize());
        executor.initialize();
        try {
            CountDownLatch done = new CountDownLatch(1);
            AtomicReference<String> threadName = new AtomicReference<>();
            executor.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                done.countDown();
            });
            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertTrue(threadName.get().startsWith("stocktake-sync-"));
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void inlineDrainUsesCallerThread() {
        StockTakeProperties properties = new StockTakeProperties();
        properties.getSync().setAsyncDrain(false);

        TaskExecutor taskExecutor = engineConfig.syncTaskExecutor(properties);

        assertTrue(taskExecutor instanceof SyncTaskExecutor);
        AtomicReference<Thread> runner = new AtomicReference<>();
        taskExecutor.execute(() -> runner.set(Thread.currentThread()));
        assertEquals(Thread.currentThread(), runner.get());
    }
}
