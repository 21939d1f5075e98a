package com.spendmonitor.monitor.domain.pipeline;

import com.spendmonitor.common.event.AlertLevel;
import com.spendmonitor.monitor.domain.dispatch.DispatchReport;
import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record PipelineRunResult(
        String runId,
        RunStatus status,
        Instant startedAt,
        Instant finishedAt,
        BigDecimal totalCost,
        BigDecimal threshold,
        AlertLevel alertLevel,
        String enrichmentModel,
        DispatchReport dispatchReport,
        ErrorKind errorKind,
        String error) {}
