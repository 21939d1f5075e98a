package com.spendmonitor.monitor.infrastructure.redis;

import com.spendmonitor.common.json.JacksonConfig;
import com.spendmonitor.monitor.application.config.SpendMonitorProperties;
import com.spendmonitor.monitor.domain.device.DeviceRegistration;
import com.spendmonitor.monitor.domain.device.DeviceRegistrationStore;
import com.spendmonitor.monitor.domain.exceptions.TransientBackendException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Registrations as JSON strings under {@code {prefix}device:{token}}, a reverse index
 * {@code {prefix}endpoint:{ref}} holding the token, and a set {@code {prefix}devices}
 * of all tokens.
 */
@Slf4j
@Component
public class RedisDeviceRegistrationStore implements DeviceRegistrationStore {

    private static final ObjectMapper MAPPER = JacksonConfig.createObjectMapper();

    private final StringRedisTemplate redisTemplate;
    private final String prefix;

    public RedisDeviceRegistrationStore(StringRedisTemplate redisTemplate, SpendMonitorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.prefix = properties.devices().keyPrefix();
    }

    @Override
    public Optional<DeviceRegistration> findByToken(String deviceToken) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(deviceKey(deviceToken)))
                    .flatMap(this::read);
        } catch (DataAccessException e) {
            throw TransientBackendException.of("findByToken", e);
        }
    }

    @Override
    public Optional<DeviceRegistration> findByEndpoint(String endpointRef) {
        try {
            var token = redisTemplate.opsForValue().get(endpointKey(endpointRef));
            return token == null ? Optional.empty() : findByToken(token);
        } catch (DataAccessException e) {
            throw TransientBackendException.of("findByEndpoint", e);
        }
    }

    @Override
    public List<DeviceRegistration> findAll() {
        try {
            var tokens = redisTemplate.opsForSet().members(allKey());
            if (tokens == null || tokens.isEmpty()) {
                return List.of();
            }
            var keys = tokens.stream().map(this::deviceKey).toList();
            var values = redisTemplate.opsForValue().multiGet(keys);
            if (values == null) {
                return List.of();
            }
            var registrations = new ArrayList<DeviceRegistration>(values.size());
            values.stream()
                    .filter(Objects::nonNull)
                    .map(this::read)
                    .flatMap(Optional::stream)
                    .forEach(registrations::add);
            registrations.sort(Comparator.comparing(DeviceRegistration::deviceToken));
            return registrations;
        } catch (DataAccessException e) {
            throw TransientBackendException.of("findAll", e);
        }
    }

    @Override
    public void save(DeviceRegistration registration) {
        var json = MAPPER.writeValueAsString(registration);
        try {
            redisTemplate.opsForValue().set(deviceKey(registration.deviceToken()), json);
            if (registration.platformEndpointRef() != null) {
                redisTemplate.opsForValue().set(endpointKey(registration.platformEndpointRef()),
                        registration.deviceToken());
            }
            redisTemplate.opsForSet().add(allKey(), registration.deviceToken());
        } catch (DataAccessException e) {
            throw TransientBackendException.of("save", e);
        }
    }

    @Override
    public void delete(String deviceToken) {
        try {
            var existing = findByToken(deviceToken);
            redisTemplate.delete(deviceKey(deviceToken));
            redisTemplate.opsForSet().remove(allKey(), deviceToken);
            existing.map(DeviceRegistration::platformEndpointRef)
                    .filter(ref -> deviceToken.equals(redisTemplate.opsForValue().get(endpointKey(ref))))
                    .ifPresent(ref -> redisTemplate.delete(endpointKey(ref)));
        } catch (DataAccessException e) {
            throw TransientBackendException.of("delete", e);
        }
    }

    private Optional<DeviceRegistration> read(String json) {
        try {
            return Optional.of(MAPPER.readValue(json, DeviceRegistration.class));
        } catch (JacksonException e) {
            log.warn("Skipping unreadable device registration: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String deviceKey(String token) {
        return prefix + "device:" + token;
    }

    private String endpointKey(String endpointRef) {
        return prefix + "endpoint:" + endpointRef;
    }

    private String allKey() {
        return prefix + "devices";
    }
}
