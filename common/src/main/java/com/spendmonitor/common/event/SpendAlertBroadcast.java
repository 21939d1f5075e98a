package com.spendmonitor.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

/**
 * Fan-out message published to the broadcast channel for every alert.
 */
@Builder(toBuilder = true)
public record SpendAlertBroadcast(
        @JsonProperty("alert_id") String alertId,
        @JsonProperty("alert_level") AlertLevel alertLevel,
        String subject,
        String message,
        @JsonProperty("sms_message") String smsMessage,
        @JsonProperty("total_cost") BigDecimal totalCost,
        BigDecimal threshold,
        @JsonProperty("exceed_amount") BigDecimal exceedAmount,
        @JsonProperty("published_at") Instant publishedAt) {}
