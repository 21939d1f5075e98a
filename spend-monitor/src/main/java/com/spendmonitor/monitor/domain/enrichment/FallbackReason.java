package com.spendmonitor.monitor.domain.enrichment;

public enum FallbackReason {
    DISABLED,
    COST_CAP_REACHED,
    COST_LEDGER_UNAVAILABLE,
    RATE_LIMITED,
    BACKEND_ERROR,
    UNPARSEABLE_RESPONSE
}
