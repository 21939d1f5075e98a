package com.spendmonitor.monitor.domain.pipeline;

import java.math.BigDecimal;
import lombok.Builder;

@Builder(toBuilder = true)
public record PipelineSettings(BigDecimal threshold, BigDecimal minServiceCost, int topServices) {}
