package com.supplyhub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Redis 原语封装：只提供键值级操作，业务键名放在各游戏的 RedisKeys 里组织。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {

    private final RedisTemplate<String, Object> redis;

    /**
     * 写入键值（带 TTL）
     */
    public void setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
    }

    /**
     * 读取并按类型转换；类型不符视为不存在
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    public boolean del(String key) {
        return Boolean.TRUE.equals(redis.delete(key));
    }
}
