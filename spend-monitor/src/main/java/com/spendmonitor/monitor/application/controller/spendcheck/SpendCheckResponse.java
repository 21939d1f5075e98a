package com.spendmonitor.monitor.application.controller.spendcheck;

import com.spendmonitor.common.event.AlertLevel;
import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import com.spendmonitor.monitor.domain.pipeline.RunStatus;
import java.math.BigDecimal;
import java.time.Instant;

public record SpendCheckResponse(
        String runId,
        RunStatus status,
        Instant startedAt,
        Instant finishedAt,
        BigDecimal totalCost,
        BigDecimal threshold,
        AlertLevel alertLevel,
        String enrichmentModel,
        String alertId,
        Boolean delivered,
        ErrorKind errorKind,
        String error) {}
