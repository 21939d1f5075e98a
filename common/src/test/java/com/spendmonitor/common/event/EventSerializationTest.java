package com.spendmonitor.common.event;

import com.spendmonitor.common.json.JacksonConfig;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class EventSerializationTest {

    private final ObjectMapper mapper = JacksonConfig.createObjectMapper();

    @Test
    void spendCheckRequestUsesSnakeCaseFields() {
        var request = SpendCheckRequest.builder()
                .requestId("req_01")
                .threshold(new BigDecimal("10.00"))
                .periodStart(LocalDate.parse("2026-10-01"))
                .periodEnd(LocalDate.parse("2026-10-16"))
                .requestedAt(Instant.parse("2026-10-16T08:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(request);

        assertThat(json).contains("\"request_id\":\"req_01\"");
        assertThat(json).contains("\"period_start\":\"2026-10-01\"");
        var deserialized = mapper.readValue(json, SpendCheckRequest.class);
        assertThat(deserialized).isEqualTo(request);
        assertThat(deserialized.hasPeriod()).isTrue();
    }

    @Test
    void spendCheckRequestToleratesMissingOverridesAndUnknownFields() {
        var json = """
                {"request_id":"req_02","requested_at":"2026-10-16T08:00:00Z","source":"cron"}
                """;

        var request = mapper.readValue(json, SpendCheckRequest.class);

        assertThat(request.requestId()).isEqualTo("req_02");
        assertThat(request.threshold()).isNull();
        assertThat(request.hasPeriod()).isFalse();
    }

    @Test
    void broadcastCarriesAlertLevelAndAmounts() {
        var broadcast = SpendAlertBroadcast.builder()
                .alertId("spend-alert-1")
                .alertLevel(AlertLevel.CRITICAL)
                .subject("AWS Spend Alert: $5.50 over budget")
                .message("body")
                .smsMessage("sms")
                .totalCost(new BigDecimal("15.50"))
                .threshold(new BigDecimal("10.00"))
                .exceedAmount(new BigDecimal("5.50"))
                .publishedAt(Instant.parse("2026-10-16T08:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(broadcast);

        assertThat(json).contains("\"alert_level\":\"CRITICAL\"");
        var deserialized = mapper.readValue(json, SpendAlertBroadcast.class);
        assertThat(deserialized.totalCost()).isEqualByComparingTo("15.50");
        assertThat(deserialized.alertLevel()).isEqualTo(AlertLevel.CRITICAL);
    }
}
