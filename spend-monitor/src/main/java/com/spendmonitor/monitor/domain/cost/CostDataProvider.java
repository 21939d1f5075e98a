package com.spendmonitor.monitor.domain.cost;

import java.util.List;

/**
 * Source of cost-and-usage data. Implementations throw
 * {@code TransientBackendException} for failures worth retrying.
 */
public interface CostDataProvider {

    CostAnalysis getCosts(BillingPeriod period);

    /**
     * Previous complete months, oldest first, used as a baseline for anomaly detection.
     */
    List<CostAnalysis> getHistoricalCosts(BillingPeriod current, int months);
}
