package org.stocktake.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 幂等性工具类
 * - 配置了 Redis 时使用 SETNX 记录凭证，多进程共享
 * - 未配置 Redis 时退化为进程内记录
 * - 用于"每个会话只提醒一次"等一次性动作
 */
@Slf4j
@Component
public class IdempotentUtil {

    private static final String IDEMPOTENT_KEY_PREFIX = "stocktake:idempotent:";
    // 默认过期时间（秒）：7天
    private static final long DEFAULT_EXPIRE_TIME = 7 * 24 * 3600;

    private final RedisTemplate<String, Object> redisTemplate;
    private final Map<String, Long> localMarks = new ConcurrentHashMap<>();

    public IdempotentUtil(@Autowired(required = false) RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public boolean isOperated(String businessId, String operationType) {
        String key = buildKey(businessId, operationType);
        if (redisTemplate == null) {
            return localMarks.containsKey(key);
        }
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    /**
     * 原子地标记操作已执行
     *
     * @return true: 首次标记；false: 已存在
     */
    public boolean markAsOperated(String businessId, String operationType) {
        String key = buildKey(businessId, operationType);
        long now = System.currentTimeMillis();
        if (redisTemplate == null) {
            return localMarks.putIfAbsent(key, now) == null;
        }
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key, now, DEFAULT_EXPIRE_TIME, TimeUnit.SECONDS);
        return Boolean.TRUE.equals(success);
    }

    private String buildKey(String businessId, String operationType) {
        return IDEMPOTENT_KEY_PREFIX + operationType + ":" + businessId;
    }
}
