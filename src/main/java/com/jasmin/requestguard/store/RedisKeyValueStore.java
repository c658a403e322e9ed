package com.jasmin.requestguard.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis implementation of {@link KeyValueStore}. Round-trips are bounded by the Lettuce command
 * timeout ({@code spring.data.redis.timeout}); any driver failure surfaces as
 * {@link StoreUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    static final RedisScript<List<Object>> INCREMENT_SCRIPT = loadLuaScript("lua/counter_increment.lua");

    private final StringRedisTemplate redis;

    @Override
    public StoreCounter increment(String key, Duration ttl, TtlPolicy policy) {
        List<Object> result = call("increment " + key, () -> redis.execute(
                INCREMENT_SCRIPT,
                List.of(key),
                String.valueOf(ttl.toMillis()),
                policy == TtlPolicy.ON_EVERY_WRITE ? "1" : "0"
        ));

        if (result == null || result.size() < 2) {
            throw new StoreUnavailableException("Unexpected reply from counter script for " + key, null);
        }
        long count = toLong(result.get(0));
        long ttlMillis = toLong(result.get(1));
        return new StoreCounter(count, Duration.ofMillis(Math.max(0L, ttlMillis)));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("get " + key, () -> redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set " + key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long millis = call("ttl " + key, () -> redis.getExpire(key, TimeUnit.MILLISECONDS));
        // -2 = missing, -1 = no expiry
        if (millis == null || millis < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(call("delete " + key, () -> redis.delete(key)));
    }

    private <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }

    static RedisScript<List<Object>> loadLuaScript(String path) {
        DefaultRedisScript<List<Object>> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource(path)));
        script.setResultType(listResultType());
        return script;
    }

    // the script returns a multi-bulk reply; List.class carries no element type
    @SuppressWarnings("unchecked")
    private static Class<List<Object>> listResultType() {
        return (Class<List<Object>>) (Class<?>) List.class;
    }
}
