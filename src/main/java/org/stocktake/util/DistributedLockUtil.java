package org.stocktake.util;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 设备级锁
 * - 配置了 Redisson 时使用分布式可重入锁（多个进程共用同一本地库时）
 * - 未配置时直接放行，由引擎自身的同步保证单设备单执行者
 */
@Slf4j
@Component
public class DistributedLockUtil {

    private static final String LOCK_KEY_PREFIX = "stocktake:lock:";

    private final RedissonClient redissonClient;

    public DistributedLockUtil(@Autowired(required = false) RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    public boolean tryLock(String resourceKey, long waitTime, TimeUnit unit) {
        if (redissonClient == null) {
            return true;
        }
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        try {
            return lock.tryLock(waitTime, unit.toMillis(waitTime) * 3, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void unlock(String resourceKey) {
        if (redissonClient == null) {
            return;
        }
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        } else {
            log.debug("[锁已释放或不属于当前线程] resourceKey={}", resourceKey);
        }
    }

    private static String buildLockKey(String resourceKey) {
        return LOCK_KEY_PREFIX + resourceKey;
    }
}
