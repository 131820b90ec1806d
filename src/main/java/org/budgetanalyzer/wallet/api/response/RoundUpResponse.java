package org.budgetanalyzer.wallet.api.response;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;

/** Response DTO for a round-up savings projection. */
@Schema(description = "Round-up savings projection")
public record RoundUpResponse(
    @Schema(
            description = "Projected month",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-05")
        String month,
    @Schema(
            description = "Rounding step",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "10")
        int limit,
    @Schema(
            description = "Number of operations dated in the month",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2")
        int matchedTransactions,
    @Schema(
            description = "Total spare change",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "19.4")
        BigDecimal total) {}
