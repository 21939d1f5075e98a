package com.spendmonitor.monitor.domain.device;

import java.util.List;
import java.util.Optional;

/**
 * Key-value store of registrations keyed by device token, with a secondary lookup by
 * endpoint.
 */
public interface DeviceRegistrationStore {

    Optional<DeviceRegistration> findByToken(String deviceToken);

    Optional<DeviceRegistration> findByEndpoint(String endpointRef);

    List<DeviceRegistration> findAll();

    void save(DeviceRegistration registration);

    void delete(String deviceToken);
}
