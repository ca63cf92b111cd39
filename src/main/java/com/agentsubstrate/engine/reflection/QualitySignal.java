package com.agentsubstrate.engine.reflection;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * An aggregate quality measurement over the analysed decision events.
 *
 * @param signalId {@code qs-N}
 * @param severity set only when the value warrants attention
 */
public record QualitySignal(
        @NotBlank String signalId,
        @NotNull QualitySignalType type,
        @DecimalMin("0.0") @DecimalMax("1.0") double value,
        @NotBlank String description,
        @NotNull List<String> evidence,
        SignalSeverity severity
) {
}
