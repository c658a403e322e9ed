package com.jasmin.requestguard.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisKeyValueStore")
class RedisKeyValueStoreTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> valueOps;

    @InjectMocks
    private RedisKeyValueStore store;

    @Test
    @DisplayName("Increment runs the counter script with TTL millis and policy flag")
    @SuppressWarnings("unchecked")
    void incrementUsesScript() {
        when(redis.execute(any(RedisScript.class), anyList(), eq("60000"), eq("0")))
                .thenReturn(List.of(4L, 42000L));

        StoreCounter counter = store.increment("ratelimit:ip:1.2.3.4:/api/:count", Duration.ofSeconds(60), TtlPolicy.ON_FIRST_WRITE);

        assertThat(counter.getCount()).isEqualTo(4);
        assertThat(counter.getTtl()).isEqualTo(Duration.ofSeconds(42));
    }

    @Test
    @SuppressWarnings("unchecked")
    void incrementRefreshFlag() {
        when(redis.execute(any(RedisScript.class), anyList(), eq("86400000"), eq("1")))
                .thenReturn(List.of(1L, 86400000L));

        assertThat(store.increment("waf:violation_count:1.2.3.4", Duration.ofHours(24), TtlPolicy.ON_EVERY_WRITE).getCount())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Driver failures become StoreUnavailableException")
    void translatesFailures() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waf:ip_block:1.2.3.4")).thenThrow(new QueryTimeoutException("timed out"));

        assertThatThrownBy(() -> store.get("waf:ip_block:1.2.3.4"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }

    @Test
    void translatesConnectionFailures() {
        when(redis.delete("k")).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.delete("k")).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("Missing or non-expiring keys have no TTL")
    void ttlNegativeIsEmpty() {
        when(redis.getExpire("missing", TimeUnit.MILLISECONDS)).thenReturn(-2L);
        when(redis.getExpire("forever", TimeUnit.MILLISECONDS)).thenReturn(-1L);
        when(redis.getExpire("live", TimeUnit.MILLISECONDS)).thenReturn(1500L);

        assertThat(store.ttl("missing")).isEmpty();
        assertThat(store.ttl("forever")).isEmpty();
        assertThat(store.ttl("live")).contains(Duration.ofMillis(1500));
    }

    @Test
    void setWritesWithTtl() {
        when(redis.opsForValue()).thenReturn(valueOps);

        store.set("waf:ip_block:1.2.3.4", "1", Duration.ofSeconds(600));

        verify(valueOps).set("waf:ip_block:1.2.3.4", "1", Duration.ofSeconds(600));
    }

    @Test
    void existsFollowsGet() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("present")).thenReturn("1");

        assertThat(store.exists("present")).isTrue();
        assertThat(store.exists("absent")).isFalse();
    }

    @Test
    @DisplayName("Counter script is loaded from the classpath and typed as a list reply")
    void counterScriptLoaded() {
        RedisScript<List<Object>> script = RedisKeyValueStore.INCREMENT_SCRIPT;

        assertThat(script.getResultType()).isEqualTo(List.class);
        assertThat(script.getScriptAsString()).contains("INCR").contains("PEXPIRE");
        assertThat(script.getSha1()).hasSize(40);
    }
}
