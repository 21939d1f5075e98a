package com.spendmonitor.monitor.domain.cost;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Inclusive start, exclusive end, matching how cost-and-usage APIs bound a query.
 */
public record BillingPeriod(LocalDate start, LocalDate end) {

    public static BillingPeriod monthToDate(LocalDate today) {
        var start = YearMonth.from(today).atDay(1);
        var end = today.equals(start) ? today.plusDays(1) : today;
        return new BillingPeriod(start, end);
    }

    public boolean isValid() {
        return start != null && end != null && start.isBefore(end);
    }
}
