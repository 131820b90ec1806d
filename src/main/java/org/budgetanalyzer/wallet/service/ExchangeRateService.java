package org.budgetanalyzer.wallet.service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.wallet.service.provider.ExchangeRateProvider;

/**
 * Serves exchange rate tables, fetching each base currency from the provider once.
 *
 * <p>Tables stay cached for the lifetime of the service or until {@link #clearCache()} / {@link
 * #evict(String)} is called. There is no time-based expiry and no retry: a failed fetch is
 * reported to the caller and nothing is cached.
 */
@Service
public class ExchangeRateService {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateService.class);

  private final ExchangeRateProvider exchangeRateProvider;
  private final ExchangeRateCache exchangeRateCache;

  /**
   * Constructs a new ExchangeRateService.
   *
   * @param exchangeRateProvider The provider to fetch exchange rates from
   * @param exchangeRateCache The cache owned by this service
   */
  public ExchangeRateService(
      ExchangeRateProvider exchangeRateProvider, ExchangeRateCache exchangeRateCache) {
    this.exchangeRateProvider = exchangeRateProvider;
    this.exchangeRateCache = exchangeRateCache;
  }

  /**
   * Returns the rate table for a base currency.
   *
   * @param baseCurrency currency code, case-insensitive
   * @return unmodifiable map of currency code to units per one unit of {@code baseCurrency}
   * @throws IllegalArgumentException if {@code baseCurrency} is blank
   * @throws CurrencyServiceException if the API key is missing or the response is malformed
   */
  public Map<String, BigDecimal> getRates(String baseCurrency) {
    var base = normalizeCurrencyCode(baseCurrency);

    if (log.isDebugEnabled() && exchangeRateCache.contains(base)) {
      log.debug("Exchange rate cache hit baseCurrency: {}", base);
    }

    return exchangeRateCache.get(base, exchangeRateProvider::getExchangeRates);
  }

  /** Drops every cached rate table. */
  public void clearCache() {
    log.info("Clearing exchange rate cache");
    exchangeRateCache.clear();
  }

  /**
   * Drops the cached table for one base currency.
   *
   * @param baseCurrency currency code, case-insensitive
   */
  public void evict(String baseCurrency) {
    var base = normalizeCurrencyCode(baseCurrency);
    log.info("Evicting cached exchange rates baseCurrency: {}", base);
    exchangeRateCache.evict(base);
  }

  static String normalizeCurrencyCode(String currencyCode) {
    if (currencyCode == null || currencyCode.isBlank()) {
      throw new IllegalArgumentException("currency code must not be blank");
    }
    return currencyCode.trim().toUpperCase(Locale.ROOT);
  }
}
