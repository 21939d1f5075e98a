package com.spendmonitor.monitor.domain.device;

import com.spendmonitor.monitor.domain.exceptions.DeviceNotFoundException;
import com.spendmonitor.monitor.domain.exceptions.InvalidDeviceTokenException;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import com.spendmonitor.monitor.domain.resilience.ExecutionContext;
import com.spendmonitor.monitor.domain.resilience.RetryPolicy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lifecycle of push device bindings.
 *
 * <p>A registration is created on the first valid {@link #register}, moves to a new token
 * on {@link #updateToken}, is marked inactive once the push provider confirms it invalid
 * and is only physically deleted by {@link #remove} or {@link #removeInvalidTokens}.
 * Registering the same token again, from any number of callers at once, converges on the
 * single endpoint the provider keeps for that token.
 *
 * <p>Every provider call goes through the {@link RetryPolicy} with its own 30 second
 * deadline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeviceRegistry {

    static final Duration BACKEND_CALL_TIMEOUT = Duration.ofSeconds(30);

    private final PushBackend pushBackend;
    private final DeviceRegistrationStore store;
    private final RetryPolicy retryPolicy;
    private final DeviceHealthSettings healthSettings;
    private final Clock clock;

    public void validateToken(String token) {
        if (!DeviceTokens.isWellFormed(token)) {
            throw InvalidDeviceTokenException.of(token);
        }
    }

    public DeviceRegistration register(String token, String ownerId) {
        validateToken(token);
        var endpointRef = backendCall("createPlatformEndpoint",
                () -> pushBackend.createOrReuseEndpoint(token, ownerId));
        var now = clock.instant();

        var stored = store.findByToken(token);
        var existing = stored
                .filter(DeviceRegistration::active)
                .filter(r -> endpointRef.equals(r.platformEndpointRef()));
        DeviceRegistration registration;
        if (existing.isPresent()) {
            var current = existing.get();
            registration = current.toBuilder()
                    .ownerId(ownerId != null ? ownerId : current.ownerId())
                    .lastUpdated(now)
                    .build();
            log.debug("Device already registered: endpoint={} token={}", endpointRef, DeviceTokens.preview(token));
        } else {
            // the provider may hand back an endpoint it disabled earlier
            backendCall("setEndpointAttributes", () -> {
                pushBackend.updateEndpoint(endpointRef, token, true);
                return null;
            });
            if (stored.isPresent() && !endpointRef.equals(stored.get().platformEndpointRef())) {
                // drops the endpoint index of the binding the provider no longer knows
                store.delete(token);
                log.info("Replacing stale endpoint {} for token {}",
                        stored.get().platformEndpointRef(), DeviceTokens.preview(token));
            }
            registration = DeviceRegistration.builder()
                    .deviceToken(token)
                    .platformEndpointRef(endpointRef)
                    .ownerId(ownerId)
                    .registrationDate(now)
                    .lastUpdated(now)
                    .active(true)
                    .build();
            log.info("Device registered: endpoint={} token={} owner={}",
                    endpointRef, DeviceTokens.preview(token), ownerId);
        }
        store.save(registration);
        return registration;
    }

    public DeviceRegistration updateToken(String endpointRef, String newToken) {
        validateToken(newToken);
        var existing = store.findByEndpoint(endpointRef)
                .orElseThrow(() -> DeviceNotFoundException.forEndpoint(endpointRef));

        backendCall("setEndpointAttributes", () -> {
            pushBackend.updateEndpoint(endpointRef, newToken, true);
            return null;
        });
        if (!existing.deviceToken().equals(newToken)) {
            store.delete(existing.deviceToken());
        }
        var updated = existing.toBuilder()
                .deviceToken(newToken)
                .lastUpdated(clock.instant())
                .active(true)
                .build();
        store.save(updated);
        log.info("Device token rotated: endpoint={} from={} to={}",
                endpointRef, DeviceTokens.preview(existing.deviceToken()), DeviceTokens.preview(newToken));
        return updated;
    }

    public void remove(String endpointRef) {
        backendCall("deleteEndpoint", () -> {
            pushBackend.deleteEndpoint(endpointRef);
            return null;
        });
        store.findByEndpoint(endpointRef).ifPresent(r -> store.delete(r.deviceToken()));
        log.info("Device removed: endpoint={}", endpointRef);
    }

    public void markInactive(String endpointRef) {
        store.findByEndpoint(endpointRef)
                .filter(DeviceRegistration::active)
                .ifPresent(r -> {
                    store.save(r.toBuilder().active(false).lastUpdated(clock.instant()).build());
                    log.info("Device marked inactive: endpoint={} token={}",
                            endpointRef, DeviceTokens.preview(r.deviceToken()));
                });
    }

    /**
     * Removes every endpoint the provider confirms invalid: disabled, carrying a malformed
     * token, or gone. Per-entry failures are collected, never thrown.
     */
    public InvalidTokenCleanupResult removeInvalidTokens(Collection<String> endpointRefs) {
        var removed = new ArrayList<String>();
        var errors = new ArrayList<InvalidTokenCleanupResult.CleanupError>();
        for (var endpointRef : endpointRefs) {
            try {
                var attributes = backendCall("getEndpointAttributes",
                        () -> pushBackend.getEndpointAttributes(endpointRef));
                var invalid = attributes.isEmpty()
                        || !attributes.get().enabled()
                        || !DeviceTokens.isWellFormed(attributes.get().token());
                if (!invalid) {
                    continue;
                }
                markInactive(endpointRef);
                remove(endpointRef);
                removed.add(endpointRef);
            } catch (SpendMonitorException e) {
                log.warn("Cleanup failed for endpoint {}: {}", endpointRef, e.getMessage());
                errors.add(new InvalidTokenCleanupResult.CleanupError(endpointRef, e.kind(), e.getMessage()));
            }
        }
        log.info("Invalid token cleanup: checked={} removed={} errors={}",
                endpointRefs.size(), removed.size(), errors.size());
        return new InvalidTokenCleanupResult(removed, errors);
    }

    public InvalidTokenCleanupResult removeInvalidTokens() {
        return removeInvalidTokens(store.findAll().stream().map(DeviceRegistration::platformEndpointRef).toList());
    }

    public List<DeviceRegistration> activeRegistrations() {
        return store.findAll().stream().filter(DeviceRegistration::active).toList();
    }

    public List<DeviceRegistration> findByOwner(String ownerId) {
        return store.findAll().stream()
                .filter(r -> Objects.equals(ownerId, r.ownerId()))
                .toList();
    }

    public PushHealthReport healthCheck() {
        var now = clock.instant();
        var registrations = store.findAll();
        var active = (int) registrations.stream().filter(DeviceRegistration::active).count();
        var invalid = registrations.size() - active;
        var recommendations = new ArrayList<String>();
        var overall = HealthStatus.HEALTHY;
        Long certificateDays = null;

        PlatformApplicationStatus platform = null;
        try {
            platform = backendCall("getPlatformApplicationAttributes", pushBackend::getPlatformApplicationStatus);
        } catch (SpendMonitorException e) {
            log.error("Push platform health probe failed: {}", e.getMessage());
            overall = HealthStatus.CRITICAL;
            recommendations.add("Push platform is unreachable: " + e.getMessage());
        }

        if (platform != null) {
            if (!platform.enabled()) {
                overall = HealthStatus.CRITICAL;
                recommendations.add("Platform application is disabled; re-enable it to resume push delivery");
            }
            if (platform.certificateExpiry() != null) {
                certificateDays = Duration.between(now, platform.certificateExpiry()).toDays();
                if (!platform.certificateExpiry().isAfter(now)) {
                    overall = HealthStatus.CRITICAL;
                    recommendations.add("APNs certificate has expired; upload a renewed certificate");
                } else if (certificateDays < healthSettings.certificateUrgentDays()) {
                    overall = overall.worst(HealthStatus.WARNING);
                    recommendations.add("APNs certificate expires in " + certificateDays + " days; renew it now");
                } else if (certificateDays < healthSettings.certificateWarningDays()) {
                    overall = overall.worst(HealthStatus.WARNING);
                    recommendations.add("APNs certificate expires in " + certificateDays + " days; plan its renewal");
                }
            }
        }

        if (!registrations.isEmpty()) {
            double invalidRatio = (double) invalid / registrations.size();
            if (invalidRatio > healthSettings.invalidEndpointCriticalRatio()) {
                overall = HealthStatus.CRITICAL;
                recommendations.add(invalid + " of " + registrations.size()
                        + " endpoints are invalid, above the critical ratio of "
                        + healthSettings.invalidEndpointCriticalRatio() + "; run token cleanup");
            } else if (invalidRatio > healthSettings.invalidEndpointWarningRatio()) {
                overall = overall.worst(HealthStatus.WARNING);
                recommendations.add(invalid + " of " + registrations.size() + " endpoints are invalid; run token cleanup");
            }
        }

        var report = PushHealthReport.builder()
                .overall(overall)
                .certificateDaysRemaining(certificateDays)
                .activeEndpointCount(active)
                .invalidEndpointCount(invalid)
                .recommendations(List.copyOf(recommendations))
                .checkedAt(now)
                .build();
        log.info("Push health check: overall={} active={} invalid={} certificateDays={}",
                overall, active, invalid, certificateDays);
        return report;
    }

    private <T> T backendCall(String operation, Callable<T> call) {
        return retryPolicy.execute(operation, call, ExecutionContext.withTimeout(clock, BACKEND_CALL_TIMEOUT))
                .getOrThrow();
    }
}
