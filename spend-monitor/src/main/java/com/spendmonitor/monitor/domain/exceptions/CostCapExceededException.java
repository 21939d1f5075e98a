package com.spendmonitor.monitor.domain.exceptions;

import java.math.BigDecimal;

public class CostCapExceededException extends SpendMonitorException {

    private CostCapExceededException(String message) {
        super(message);
    }

    public static CostCapExceededException of(String periodKey, BigDecimal spent, BigDecimal cap) {
        return new CostCapExceededException("Enrichment spend for " + periodKey + " is $"
                + spent.toPlainString() + ", monthly cap is $" + cap.toPlainString());
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.COST_CAP;
    }
}
