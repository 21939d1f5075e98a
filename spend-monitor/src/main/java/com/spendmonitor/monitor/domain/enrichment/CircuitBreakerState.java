package com.spendmonitor.monitor.domain.enrichment;

import java.math.BigDecimal;

public record CircuitBreakerState(String periodKey, BigDecimal cumulativeCost, BigDecimal monthlyCap, boolean open) {}
