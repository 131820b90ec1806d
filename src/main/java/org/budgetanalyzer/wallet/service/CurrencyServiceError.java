package org.budgetanalyzer.wallet.service;

/** Error codes for currency service business exceptions. */
public enum CurrencyServiceError {
  /** No API key is configured for the exchange rate service. */
  API_KEY_NOT_CONFIGURED,

  /** The exchange rate service answered, but the body lacks the expected structure. */
  MALFORMED_RATES_RESPONSE,

  /** The fetched rate table has no rate for the requested currency. */
  EXCHANGE_RATE_NOT_FOUND,
}
