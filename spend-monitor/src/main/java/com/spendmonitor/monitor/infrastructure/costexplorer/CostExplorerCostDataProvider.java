package com.spendmonitor.monitor.infrastructure.costexplorer;

import com.spendmonitor.monitor.domain.cost.BillingPeriod;
import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import com.spendmonitor.monitor.domain.cost.CostDataProvider;
import com.spendmonitor.monitor.domain.exceptions.BackendRejectedException;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import com.spendmonitor.monitor.domain.exceptions.TransientBackendException;
import com.spendmonitor.monitor.domain.exceptions.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.DateInterval;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageRequest;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageResponse;
import software.amazon.awssdk.services.costexplorer.model.Granularity;
import software.amazon.awssdk.services.costexplorer.model.GroupDefinition;
import software.amazon.awssdk.services.costexplorer.model.GroupDefinitionType;
import software.amazon.awssdk.services.costexplorer.model.ResultByTime;

/**
 * Per-service blended cost from Cost Explorer. Services with no spend in the period are
 * left out of the breakdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CostExplorerCostDataProvider implements CostDataProvider {

    static final String METRIC = "BlendedCost";
    static final String CURRENCY = "USD";
    static final String UNKNOWN_SERVICE = "Unknown Service";

    private final CostExplorerClient client;
    private final Clock clock;

    @Override
    public CostAnalysis getCosts(BillingPeriod period) {
        if (!period.isValid()) {
            throw ValidationException.of("Billing period start must be before its end: " + period);
        }
        var months = query(period);
        var breakdown = new HashMap<String, BigDecimal>();
        months.values().forEach(month -> month.forEach((service, cost) -> breakdown.merge(service, cost, BigDecimal::add)));
        return toAnalysis(period, breakdown);
    }

    @Override
    public List<CostAnalysis> getHistoricalCosts(BillingPeriod current, int months) {
        if (months <= 0) {
            return List.of();
        }
        var first = YearMonth.from(current.start()).minusMonths(months);
        var range = new BillingPeriod(first.atDay(1), YearMonth.from(current.start()).atDay(1));
        var byMonth = query(range);

        var history = new ArrayList<CostAnalysis>(months);
        for (var i = 0; i < months; i++) {
            var month = first.plusMonths(i);
            var period = new BillingPeriod(month.atDay(1), month.plusMonths(1).atDay(1));
            history.add(toAnalysis(period, byMonth.getOrDefault(month.atDay(1), Map.of())));
        }
        return history;
    }

    /**
     * Linear extrapolation of month-to-date spend over the whole month. Periods that are
     * not a partial single month project to their own total.
     */
    static BigDecimal projectMonthly(BigDecimal total, BillingPeriod period) {
        var month = YearMonth.from(period.start());
        var elapsed = ChronoUnit.DAYS.between(period.start(), period.end());
        var monthEnd = month.plusMonths(1).atDay(1);
        if (!period.start().equals(month.atDay(1)) || period.end().isAfter(monthEnd) || elapsed <= 0) {
            return total.setScale(2, RoundingMode.HALF_UP);
        }
        return total.multiply(BigDecimal.valueOf(month.lengthOfMonth()))
                .divide(BigDecimal.valueOf(elapsed), 2, RoundingMode.HALF_UP);
    }

    private CostAnalysis toAnalysis(BillingPeriod period, Map<String, BigDecimal> breakdown) {
        var total = breakdown.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return CostAnalysis.builder()
                .totalCost(total)
                .serviceBreakdown(breakdown)
                .period(period)
                .projectedMonthly(projectMonthly(total, period))
                .currency(CURRENCY)
                .lastUpdated(clock.instant())
                .build();
    }

    private Map<LocalDate, Map<String, BigDecimal>> query(BillingPeriod period) {
        var byMonth = new LinkedHashMap<LocalDate, Map<String, BigDecimal>>();
        String nextPageToken = null;
        do {
            var response = fetch(period, nextPageToken);
            for (var result : response.resultsByTime()) {
                collect(result, byMonth);
            }
            nextPageToken = response.nextPageToken();
        } while (nextPageToken != null && !nextPageToken.isEmpty());
        log.debug("Fetched costs for {} to {} across {} month(s)", period.start(), period.end(), byMonth.size());
        return byMonth;
    }

    private GetCostAndUsageResponse fetch(BillingPeriod period, String nextPageToken) {
        try {
            return client.getCostAndUsage(GetCostAndUsageRequest.builder()
                    .timePeriod(DateInterval.builder()
                            .start(period.start().toString())
                            .end(period.end().toString())
                            .build())
                    .granularity(Granularity.MONTHLY)
                    .metrics(METRIC)
                    .groupBy(GroupDefinition.builder()
                            .type(GroupDefinitionType.DIMENSION)
                            .key("SERVICE")
                            .build())
                    .nextPageToken(nextPageToken)
                    .build());
        } catch (SdkException e) {
            throw translate(e);
        }
    }

    private static void collect(ResultByTime result, Map<LocalDate, Map<String, BigDecimal>> byMonth) {
        var monthStart = YearMonth.from(LocalDate.parse(result.timePeriod().start())).atDay(1);
        var services = byMonth.computeIfAbsent(monthStart, k -> new HashMap<>());
        for (var group : result.groups()) {
            var service = group.keys().isEmpty() ? UNKNOWN_SERVICE : group.keys().get(0);
            var metric = group.metrics().get(METRIC);
            if (metric == null || metric.amount() == null) {
                continue;
            }
            var cost = new BigDecimal(metric.amount());
            if (cost.signum() > 0) {
                services.merge(service, cost, BigDecimal::add);
            }
        }
    }

    static SpendMonitorException translate(SdkException e) {
        if (e instanceof SdkClientException) {
            return TransientBackendException.of("getCostAndUsage", e);
        }
        if (e instanceof AwsServiceException service) {
            var code = service.awsErrorDetails() == null ? null : service.awsErrorDetails().errorCode();
            if (service.isThrottlingException() || "LimitExceededException".equals(code)) {
                return RateLimitExceededException.throttled("getCostAndUsage");
            }
            if (service.statusCode() >= 500 || "DataUnavailableException".equals(code)) {
                return TransientBackendException.of("getCostAndUsage", e);
            }
        }
        return BackendRejectedException.of("getCostAndUsage", e);
    }
}
