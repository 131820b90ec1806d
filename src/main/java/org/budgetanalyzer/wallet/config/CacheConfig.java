package org.budgetanalyzer.wallet.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.budgetanalyzer.wallet.service.ExchangeRateCache;

/**
 * Cache configuration.
 *
 * <p>Exchange rate tables live in an in-process cache with no expiry. Entries are only removed
 * through {@code ExchangeRateService#clearCache()} or {@code ExchangeRateService#evict(String)}.
 */
@Configuration
public class CacheConfig {

  public static final String EXCHANGE_RATES_CACHE = "exchangeRates";

  @Bean
  public CacheManager cacheManager() {
    var cacheManager = new ConcurrentMapCacheManager(EXCHANGE_RATES_CACHE);
    // a failed fetch must never leave an entry behind
    cacheManager.setAllowNullValues(false);
    return cacheManager;
  }

  @Bean
  public ExchangeRateCache exchangeRateCache(CacheManager cacheManager) {
    return new ExchangeRateCache(cacheManager.getCache(EXCHANGE_RATES_CACHE));
  }
}
