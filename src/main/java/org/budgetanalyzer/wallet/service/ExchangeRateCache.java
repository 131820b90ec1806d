package org.budgetanalyzer.wallet.service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import org.springframework.cache.Cache;

/**
 * Rate tables keyed by base currency.
 *
 * <p>Loading goes through {@link Cache#get(Object, java.util.concurrent.Callable)}, which for the
 * in-process cache is an atomic compute-if-absent: concurrent callers for the same base currency
 * wait for a single load. A failed load stores nothing. Cached tables are unmodifiable.
 */
public class ExchangeRateCache {

  private final Cache cache;

  public ExchangeRateCache(Cache cache) {
    this.cache = cache;
  }

  /**
   * Returns the cached table for {@code baseCurrency}, loading it on a miss.
   *
   * @param baseCurrency normalized base currency code
   * @param loader fetches a fresh table; its runtime exceptions reach the caller unchanged
   * @return unmodifiable rate table
   */
  public Map<String, BigDecimal> get(
      String baseCurrency, Function<String, Map<String, BigDecimal>> loader) {
    try {
      return cache.get(baseCurrency, () -> freeze(loader.apply(baseCurrency)));
    } catch (Cache.ValueRetrievalException e) {
      throw unwrap(e);
    }
  }

  public boolean contains(String baseCurrency) {
    return cache.get(baseCurrency) != null;
  }

  public void evict(String baseCurrency) {
    cache.evict(baseCurrency);
  }

  public void clear() {
    cache.clear();
  }

  private static Map<String, BigDecimal> freeze(Map<String, BigDecimal> rates) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(rates));
  }

  private static RuntimeException unwrap(Cache.ValueRetrievalException e) {
    var cause = e.getCause();
    if (cause instanceof RuntimeException runtimeException) {
      return runtimeException;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return e;
  }
}
