package com.spendmonitor.monitor.infrastructure.redis;

import com.spendmonitor.monitor.domain.enrichment.SpendLedger;
import com.spendmonitor.monitor.domain.exceptions.TransientBackendException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Spend totals under {@code enrichment:spend:{yyyy-MM}}. INCRBY keeps concurrent
 * instances consistent; keys outlive their month long enough for reporting.
 */
@Component
@RequiredArgsConstructor
public class RedisSpendLedger implements SpendLedger {

    static final String KEY_PREFIX = "enrichment:spend:";
    private static final Duration RETENTION = Duration.ofDays(62);

    private final StringRedisTemplate redisTemplate;

    @Override
    public long add(String periodKey, long micros) {
        try {
            var key = KEY_PREFIX + periodKey;
            var total = redisTemplate.opsForValue().increment(key, micros);
            if (total != null && total == micros) {
                redisTemplate.expire(key, RETENTION);
            }
            return total == null ? 0L : total;
        } catch (DataAccessException e) {
            throw TransientBackendException.of("spendLedger.add", e);
        }
    }

    @Override
    public long total(String periodKey) {
        try {
            var value = redisTemplate.opsForValue().get(KEY_PREFIX + periodKey);
            return value == null ? 0L : Long.parseLong(value);
        } catch (DataAccessException e) {
            throw TransientBackendException.of("spendLedger.total", e);
        }
    }

    @Override
    public void reset(String periodKey) {
        try {
            redisTemplate.delete(KEY_PREFIX + periodKey);
        } catch (DataAccessException e) {
            throw TransientBackendException.of("spendLedger.reset", e);
        }
    }
}
