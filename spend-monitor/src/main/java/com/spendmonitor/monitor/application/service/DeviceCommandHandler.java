package com.spendmonitor.monitor.application.service;

import com.spendmonitor.monitor.application.config.SpendMonitorProperties;
import com.spendmonitor.monitor.domain.device.DeviceRegistration;
import com.spendmonitor.monitor.domain.device.DeviceRegistry;
import com.spendmonitor.monitor.domain.device.InvalidTokenCleanupResult;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import java.util.Collection;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeviceCommandHandler {

    private static final Duration RATE_LIMIT_WINDOW = Duration.ofMinutes(1);

    private final DeviceRegistry deviceRegistry;
    private final StringRedisTemplate redisTemplate;
    private final SpendMonitorProperties properties;
    private final Counter devicesRegisteredCounter;
    private final Counter devicesRemovedCounter;

    public DeviceRegistration register(String deviceToken, String userId) {
        checkRateLimit(userId == null ? "anonymous" : userId);
        var registration = deviceRegistry.register(deviceToken, userId);
        devicesRegisteredCounter.increment();
        return registration;
    }

    public DeviceRegistration updateToken(String endpointRef, String newToken) {
        return deviceRegistry.updateToken(endpointRef, newToken);
    }

    public void remove(String endpointRef) {
        deviceRegistry.remove(endpointRef);
        devicesRemovedCounter.increment();
    }

    public InvalidTokenCleanupResult cleanup(Collection<String> endpointRefs) {
        var result = endpointRefs == null || endpointRefs.isEmpty()
                ? deviceRegistry.removeInvalidTokens()
                : deviceRegistry.removeInvalidTokens(endpointRefs);
        devicesRemovedCounter.increment(result.removed().size());
        return result;
    }

    private void checkRateLimit(String userId) {
        var key = properties.devices().keyPrefix() + "rate:registrations:" + userId;
        var count = redisTemplate.opsForValue().increment(key);
        if (count != null && count == 1L) {
            redisTemplate.expire(key, RATE_LIMIT_WINDOW);
        }
        var max = properties.devices().registrationsPerMinute();
        if (count != null && count > max) {
            throw RateLimitExceededException.registrationLimit(max);
        }
    }
}
