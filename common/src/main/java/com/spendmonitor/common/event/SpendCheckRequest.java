package com.spendmonitor.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;

/**
 * Trigger for one spend-monitor run. Threshold and period are optional overrides;
 * when absent the configured threshold and the current month-to-date period apply.
 */
@Builder(toBuilder = true)
public record SpendCheckRequest(
        @JsonProperty("request_id") String requestId,
        BigDecimal threshold,
        @JsonProperty("period_start") LocalDate periodStart,
        @JsonProperty("period_end") LocalDate periodEnd,
        @JsonProperty("requested_at") Instant requestedAt) {

    public boolean hasPeriod() {
        return periodStart != null && periodEnd != null;
    }
}
