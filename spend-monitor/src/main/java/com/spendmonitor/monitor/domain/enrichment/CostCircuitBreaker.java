package com.spendmonitor.monitor.domain.enrichment;

import com.spendmonitor.monitor.domain.exceptions.CostCapExceededException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import lombok.extern.slf4j.Slf4j;

/**
 * Disables enrichment once the estimated spend for the current billing period reaches
 * the monthly cap. The period key rolls over at the start of each UTC month, which
 * closes the breaker again.
 */
@Slf4j
public class CostCircuitBreaker {

    private static final BigDecimal MICROS_PER_DOLLAR = BigDecimal.valueOf(1_000_000);

    private final SpendLedger ledger;
    private final BigDecimal monthlyCap;
    private final BigDecimal warningRatio;
    private final Clock clock;

    public CostCircuitBreaker(SpendLedger ledger, BigDecimal monthlyCap, BigDecimal warningRatio, Clock clock) {
        if (monthlyCap.signum() < 0) {
            throw new IllegalArgumentException("monthlyCap must not be negative");
        }
        this.ledger = ledger;
        this.monthlyCap = monthlyCap;
        this.warningRatio = warningRatio;
        this.clock = clock;
    }

    public boolean isOpen() {
        return state().open();
    }

    public CircuitBreakerState state() {
        var periodKey = currentPeriodKey();
        var micros = ledger.total(periodKey);
        return stateOf(periodKey, micros);
    }

    public void checkClosed() {
        var state = state();
        if (state.open()) {
            throw CostCapExceededException.of(state.periodKey(), state.cumulativeCost(), monthlyCap);
        }
    }

    /**
     * Adds the cost of a completed call to the current period.
     */
    public CircuitBreakerState recordCost(BigDecimal cost) {
        if (cost == null || cost.signum() <= 0) {
            return state();
        }
        var periodKey = currentPeriodKey();
        var micros = cost.multiply(MICROS_PER_DOLLAR).setScale(0, RoundingMode.CEILING).longValueExact();
        var totalMicros = ledger.add(periodKey, micros);
        var before = stateOf(periodKey, totalMicros - micros);
        var after = stateOf(periodKey, totalMicros);

        if (after.open() && !before.open()) {
            log.warn("Enrichment cost cap reached: period={} spend={} cap={}",
                    periodKey, after.cumulativeCost(), monthlyCap);
        } else if (crossesWarning(before.cumulativeCost(), after.cumulativeCost())) {
            log.warn("Enrichment spend above {}% of cap: period={} spend={} cap={}",
                    warningRatio.multiply(BigDecimal.valueOf(100)).stripTrailingZeros().toPlainString(),
                    periodKey, after.cumulativeCost(), monthlyCap);
        }
        return after;
    }

    public void reset() {
        var periodKey = currentPeriodKey();
        ledger.reset(periodKey);
        log.info("Enrichment cost breaker reset for period {}", periodKey);
    }

    public String currentPeriodKey() {
        return YearMonth.from(clock.instant().atZone(ZoneOffset.UTC)).toString();
    }

    private CircuitBreakerState stateOf(String periodKey, long micros) {
        var spent = BigDecimal.valueOf(micros).divide(MICROS_PER_DOLLAR, 6, RoundingMode.UNNECESSARY);
        return new CircuitBreakerState(periodKey, spent, monthlyCap, spent.compareTo(monthlyCap) >= 0);
    }

    private boolean crossesWarning(BigDecimal before, BigDecimal after) {
        var warningLevel = monthlyCap.multiply(warningRatio);
        return before.compareTo(warningLevel) < 0 && after.compareTo(warningLevel) >= 0;
    }
}
