package com.spendmonitor.monitor.application.controller.spendcheck;

import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * All fields optional. Without a period the current month to date is checked.
 */
public record SpendCheckRequestBody(
        @DecimalMin(value = "0", inclusive = false) BigDecimal threshold,
        LocalDate periodStart,
        LocalDate periodEnd) {}
