package org.budgetanalyzer.wallet.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

/** Error body returned by every endpoint. */
@Schema(description = "Error response")
public record ApiErrorResponse(
    @Schema(description = "Machine-readable error code", example = "EXCHANGE_RATE_NOT_FOUND")
        String code,
    @Schema(description = "Human-readable message", example = "No exchange rate for RUB")
        String message) {}
