package org.budgetanalyzer.wallet.api.response;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;

/** Response DTO for a currency conversion. */
@Schema(description = "Currency conversion result")
public record ConversionResponse(
    @Schema(
            description = "Amount in the source currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "9000")
        BigDecimal amount,
    @Schema(
            description = "Source currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "RUB")
        String from,
    @Schema(
            description = "Target currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "USD")
        String to,
    @Schema(
            description = "Amount in the target currency, not rounded",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "100")
        BigDecimal result) {}
