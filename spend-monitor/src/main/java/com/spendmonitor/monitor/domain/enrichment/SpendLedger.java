package com.spendmonitor.monitor.domain.enrichment;

/**
 * Cumulative enrichment spend per billing period, in micro-dollars. {@link #add} must be
 * atomic across processes.
 */
public interface SpendLedger {

    long add(String periodKey, long micros);

    long total(String periodKey);

    void reset(String periodKey);
}
