package org.budgetanalyzer.wallet.api.request;

import java.util.List;

import jakarta.validation.constraints.NotNull;

import io.swagger.v3.oas.annotations.media.Schema;

import org.budgetanalyzer.wallet.domain.Transaction;

/** Request DTO for pattern searches that take no parameters besides the operations. */
@Schema(description = "Operations to search")
public record TransactionListRequest(
    @Schema(description = "Operations to search", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Transactions are required")
        List<Transaction> transactions) {}
