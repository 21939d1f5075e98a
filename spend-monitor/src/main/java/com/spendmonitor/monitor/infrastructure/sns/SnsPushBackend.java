package com.spendmonitor.monitor.infrastructure.sns;

import com.spendmonitor.common.json.JacksonConfig;
import com.spendmonitor.monitor.application.config.SpendMonitorProperties;
import com.spendmonitor.monitor.domain.device.EndpointAttributes;
import com.spendmonitor.monitor.domain.device.PlatformApplicationStatus;
import com.spendmonitor.monitor.domain.device.PushBackend;
import com.spendmonitor.monitor.domain.exceptions.BackendRejectedException;
import com.spendmonitor.monitor.domain.exceptions.EndpointDisabledException;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import com.spendmonitor.monitor.domain.exceptions.TransientBackendException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.CreatePlatformEndpointRequest;
import software.amazon.awssdk.services.sns.model.DeleteEndpointRequest;
import software.amazon.awssdk.services.sns.model.GetEndpointAttributesRequest;
import software.amazon.awssdk.services.sns.model.GetPlatformApplicationAttributesRequest;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.SetEndpointAttributesRequest;
import tools.jackson.databind.ObjectMapper;

/**
 * APNS delivery through SNS platform endpoints.
 */
@Slf4j
@Component
public class SnsPushBackend implements PushBackend {

    static final String APNS_KEY = "APNS";
    static final String CERTIFICATE_EXPIRY_ATTRIBUTE = "AppleCertificateExpiryDate";

    private static final ObjectMapper MAPPER = JacksonConfig.createObjectMapper();
    private static final Pattern EXISTING_ENDPOINT =
            Pattern.compile("Endpoint (arn:aws:sns:\\S+) already exists");

    private final SnsClient snsClient;
    private final String platformApplicationArn;

    public SnsPushBackend(SnsClient snsClient, SpendMonitorProperties properties) {
        this.snsClient = snsClient;
        this.platformApplicationArn = properties.devices().platformApplicationArn();
    }

    @Override
    public String createOrReuseEndpoint(String deviceToken, String ownerId) {
        var request = CreatePlatformEndpointRequest.builder()
                .platformApplicationArn(platformApplicationArn)
                .token(deviceToken);
        if (ownerId != null) {
            request.customUserData(ownerId);
        }
        try {
            return snsClient.createPlatformEndpoint(request.build()).endpointArn();
        } catch (AwsServiceException e) {
            // same token registered with different user data
            var existing = existingEndpoint(e);
            if (existing.isPresent()) {
                log.debug("Reusing endpoint {} for token", existing.get());
                return existing.get();
            }
            throw translate("createPlatformEndpoint", e, null);
        } catch (SdkException e) {
            throw translate("createPlatformEndpoint", e, null);
        }
    }

    @Override
    public void updateEndpoint(String endpointRef, String deviceToken, boolean enabled) {
        try {
            snsClient.setEndpointAttributes(SetEndpointAttributesRequest.builder()
                    .endpointArn(endpointRef)
                    .attributes(Map.of("Token", deviceToken, "Enabled", Boolean.toString(enabled)))
                    .build());
        } catch (SdkException e) {
            throw translate("setEndpointAttributes", e, endpointRef);
        }
    }

    @Override
    public void deleteEndpoint(String endpointRef) {
        try {
            snsClient.deleteEndpoint(DeleteEndpointRequest.builder().endpointArn(endpointRef).build());
        } catch (SdkException e) {
            if (isNotFound(e)) {
                return;
            }
            throw translate("deleteEndpoint", e, endpointRef);
        }
    }

    @Override
    public Optional<EndpointAttributes> getEndpointAttributes(String endpointRef) {
        try {
            var attributes = snsClient.getEndpointAttributes(GetEndpointAttributesRequest.builder()
                            .endpointArn(endpointRef)
                            .build())
                    .attributes();
            return Optional.of(new EndpointAttributes(
                    endpointRef,
                    attributes.get("Token"),
                    !"false".equalsIgnoreCase(attributes.getOrDefault("Enabled", "true"))));
        } catch (SdkException e) {
            if (isNotFound(e)) {
                return Optional.empty();
            }
            throw translate("getEndpointAttributes", e, endpointRef);
        }
    }

    @Override
    public void publishToEndpoint(String endpointRef, String payloadJson) {
        try {
            snsClient.publish(PublishRequest.builder()
                    .targetArn(endpointRef)
                    .messageStructure("json")
                    .message(envelope(payloadJson))
                    .messageAttributes(Map.of(
                            "AWS.SNS.MOBILE.APNS.PUSH_TYPE",
                            MessageAttributeValue.builder().dataType("String").stringValue("alert").build()))
                    .build());
        } catch (SdkException e) {
            throw translate("publish", e, endpointRef);
        }
    }

    @Override
    public PlatformApplicationStatus getPlatformApplicationStatus() {
        try {
            var attributes = snsClient.getPlatformApplicationAttributes(GetPlatformApplicationAttributesRequest.builder()
                            .platformApplicationArn(platformApplicationArn)
                            .build())
                    .attributes();
            return new PlatformApplicationStatus(
                    platform(),
                    !"false".equalsIgnoreCase(attributes.getOrDefault("Enabled", "true")),
                    parseExpiry(attributes.get(CERTIFICATE_EXPIRY_ATTRIBUTE)));
        } catch (SdkException e) {
            throw translate("getPlatformApplicationAttributes", e, null);
        }
    }

    /**
     * Wraps the APNS payload in the per-platform message structure SNS expects. Both the
     * production and sandbox keys carry the same payload.
     */
    static String envelope(String payloadJson) {
        var envelope = new LinkedHashMap<String, String>();
        envelope.put("default", payloadJson);
        envelope.put(APNS_KEY, payloadJson);
        envelope.put("APNS_SANDBOX", payloadJson);
        return MAPPER.writeValueAsString(envelope);
    }

    static Optional<String> existingEndpoint(AwsServiceException e) {
        if (!"InvalidParameter".equals(errorCode(e))) {
            return Optional.empty();
        }
        var matcher = EXISTING_ENDPOINT.matcher(String.valueOf(e.awsErrorDetails().errorMessage()));
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    static SpendMonitorException translate(String operation, SdkException e, String endpointRef) {
        if (e instanceof SdkClientException) {
            return TransientBackendException.of(operation, e);
        }
        if (!(e instanceof AwsServiceException service)) {
            return BackendRejectedException.of(operation, e);
        }
        var code = errorCode(service);
        if ("EndpointDisabled".equals(code) && endpointRef != null) {
            return EndpointDisabledException.of(endpointRef, e);
        }
        if (service.isThrottlingException() || "Throttled".equals(code)) {
            return RateLimitExceededException.throttled(operation);
        }
        if (service.statusCode() >= 500 || "InternalError".equals(code)) {
            return TransientBackendException.of(operation, e);
        }
        return BackendRejectedException.of(operation, e);
    }

    private static boolean isNotFound(SdkException e) {
        return e instanceof AwsServiceException service
                && ("NotFound".equals(errorCode(service)) || service.statusCode() == 404);
    }

    private static String errorCode(AwsServiceException e) {
        return e.awsErrorDetails() == null ? null : e.awsErrorDetails().errorCode();
    }

    private String platform() {
        var parts = platformApplicationArn.split(":app/");
        if (parts.length == 2) {
            var platform = parts[1].split("/")[0];
            if (!platform.isBlank()) {
                return platform;
            }
        }
        return APNS_KEY;
    }

    private static Instant parseExpiry(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable certificate expiry '{}' on platform application", value);
            return null;
        }
    }
}
