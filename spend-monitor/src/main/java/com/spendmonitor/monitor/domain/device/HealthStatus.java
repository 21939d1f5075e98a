package com.spendmonitor.monitor.domain.device;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL;

    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
