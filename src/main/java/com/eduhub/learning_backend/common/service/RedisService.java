package com.eduhub.learning_backend.common.service;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class RedisService {

    // 仅当值与持有者 token 一致时删除，避免误删他人的租约
    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * 检查指定的键是否存在于 Redis 中。
     * @param key 键
     * @return 如果存在返回 true
     */
    public boolean hasKey(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    /**
     * 尝试获取独占租约（SET NX PX）。
     * @param key   租约键
     * @param token 持有者标识，释放时校验
     * @param ttl   租约时长，进程崩溃后自动过期
     * @return 获取成功返回 true
     */
    public boolean tryAcquireLease(String key, String token, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, token, ttl));
    }

    /**
     * 释放租约；仅持有者可释放。
     * @return 实际删除返回 true
     */
    public boolean releaseLease(String key, String token) {
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), token);
        return deleted != null && deleted > 0;
    }
}
