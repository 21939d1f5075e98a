package com.spendmonitor.monitor.domain.device;

import java.util.Optional;

/**
 * Push provider holding one endpoint per device token.
 */
public interface PushBackend {

    /**
     * Returns the endpoint bound to the token, creating it if needed. Repeated calls with
     * the same token return the same endpoint.
     */
    String createOrReuseEndpoint(String deviceToken, String ownerId);

    void updateEndpoint(String endpointRef, String deviceToken, boolean enabled);

    /**
     * Succeeds when the endpoint does not exist.
     */
    void deleteEndpoint(String endpointRef);

    /**
     * Empty when the endpoint no longer exists.
     */
    Optional<EndpointAttributes> getEndpointAttributes(String endpointRef);

    /**
     * @throws com.spendmonitor.monitor.domain.exceptions.EndpointDisabledException when the
     *     provider reports the endpoint as disabled
     */
    void publishToEndpoint(String endpointRef, String payloadJson);

    PlatformApplicationStatus getPlatformApplicationStatus();
}
