package org.budgetanalyzer.wallet.api.request;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.wallet.domain.Transaction;

/** Request DTO for a round-up savings projection. */
@Schema(description = "Round-up savings projection for one month")
public record RoundUpRequest(
    @Schema(
            description = "Month to project, YYYY-MM",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-05")
        @NotBlank(message = "Month is required")
        String month,
    @Schema(
            description = "Rounding step",
            requiredMode = Schema.RequiredMode.REQUIRED,
            allowableValues = {"10", "50", "100"},
            example = "10")
        @NotNull(message = "Limit is required")
        Integer limit,
    @Schema(description = "Operations to consider", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Transactions are required")
        List<Transaction> transactions) {}
