package com.spendmonitor.common.push;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Builder;

/**
 * APNs wire payload for a spend alert. Serialized form must stay within
 * {@link #MAX_SERIALIZED_BYTES}.
 */
@Builder(toBuilder = true)
public record NotificationPayload(Aps aps, CustomData customData) {

    public static final int MAX_SERIALIZED_BYTES = 4096;

    @Builder(toBuilder = true)
    public record Aps(
            ApsAlert alert,
            int badge,
            String sound,
            @JsonProperty("content-available") int contentAvailable) {}

    @Builder(toBuilder = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ApsAlert(String title, String body, String subtitle) {}

    @Builder(toBuilder = true)
    public record CustomData(
            BigDecimal spendAmount,
            BigDecimal threshold,
            BigDecimal exceedAmount,
            String topService,
            String alertId) {}
}
