package com.spendmonitor.monitor.domain.cost;

import java.math.BigDecimal;

public record ServiceCost(String serviceName, BigDecimal cost, BigDecimal percentage) {}
