package org.budgetanalyzer.wallet.service;

import java.math.BigDecimal;
import java.math.MathContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Converts amounts between currencies using the latest exchange rates. */
@Service
public class CurrencyConversionService {

  private static final Logger log = LoggerFactory.getLogger(CurrencyConversionService.class);

  private final ExchangeRateService exchangeRateService;

  public CurrencyConversionService(ExchangeRateService exchangeRateService) {
    this.exchangeRateService = exchangeRateService;
  }

  /**
   * Converts {@code amount} from {@code fromCurrency} into {@code toCurrency}.
   *
   * <p>The rate table is fetched with {@code toCurrency} as base, so {@code rate[fromCurrency]} is
   * the number of source units per one target unit and the result is {@code amount / rate}. The
   * quotient is computed with {@link MathContext#DECIMAL128} and is not rounded for display.
   *
   * @param amount amount in {@code fromCurrency}
   * @param fromCurrency source currency code
   * @param toCurrency target currency code
   * @return the amount expressed in {@code toCurrency}
   * @throws CurrencyServiceException with {@link CurrencyServiceError#EXCHANGE_RATE_NOT_FOUND} if
   *     the table has no usable rate for {@code fromCurrency}
   */
  public BigDecimal convert(BigDecimal amount, String fromCurrency, String toCurrency) {
    if (amount == null) {
      throw new IllegalArgumentException("amount must not be null");
    }

    var from = ExchangeRateService.normalizeCurrencyCode(fromCurrency);
    var to = ExchangeRateService.normalizeCurrencyCode(toCurrency);

    var rates = exchangeRateService.getRates(to);
    var rate = rates.get(from);

    if (rate == null || rate.signum() == 0) {
      throw new CurrencyServiceException(
          "No exchange rate for " + from, CurrencyServiceError.EXCHANGE_RATE_NOT_FOUND);
    }

    var converted = amount.divide(rate, MathContext.DECIMAL128);
    log.debug("Converted {} {} -> {} {} rate: {}", amount, from, converted, to, rate);

    return converted;
  }
}
