package org.budgetanalyzer.wallet.api.request;

import java.util.List;

import jakarta.validation.constraints.NotNull;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.wallet.domain.Transaction;

/** Request DTO for a free-text transaction search. */
@Schema(description = "Free-text search over description and category")
public record SimpleSearchRequest(
    @Schema(
            description = "Text to look for, case-insensitive",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "арбат")
        @NotNull(message = "Query is required")
        String query,
    @Schema(description = "Operations to search", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Transactions are required")
        List<Transaction> transactions) {}
