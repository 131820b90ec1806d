package org.budgetanalyzer.wallet.service.provider;

import java.math.BigDecimal;
import java.util.Map;

/** Provider interface for fetching exchange rates from external data sources. */
public interface ExchangeRateProvider {

  /**
   * Retrieves the latest rate table for a base currency.
   *
   * <p>Each value is the number of units of the keyed currency per one unit of {@code
   * baseCurrency}. Implementations perform exactly one request per call and never return a
   * partially populated table.
   *
   * @param baseCurrency ISO 4217 code of the base currency, already normalized to upper case
   * @return Map of currency codes to rates
   * @throws org.budgetanalyzer.wallet.service.CurrencyServiceException if no API key is configured
   *     or the response body lacks the expected structure
   * @throws org.springframework.web.client.RestClientException on network or HTTP status errors,
   *     propagated as thrown by the HTTP client
   */
  Map<String, BigDecimal> getExchangeRates(String baseCurrency);
}
