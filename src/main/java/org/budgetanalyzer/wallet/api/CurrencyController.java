package org.budgetanalyzer.wallet.api;

import java.math.BigDecimal;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.wallet.api.response.ConversionResponse;
import org.budgetanalyzer.wallet.service.CurrencyConversionService;
import org.budgetanalyzer.wallet.service.ExchangeRateService;

@Tag(name = "Currency", description = "Exchange rates and currency conversion")
@RestController
@RequestMapping(path = "/v1", produces = MediaType.APPLICATION_JSON_VALUE)
public class CurrencyController {

  private final ExchangeRateService exchangeRateService;
  private final CurrencyConversionService currencyConversionService;

  public CurrencyController(
      ExchangeRateService exchangeRateService,
      CurrencyConversionService currencyConversionService) {
    this.exchangeRateService = exchangeRateService;
    this.currencyConversionService = currencyConversionService;
  }

  @Operation(summary = "Get the latest rate table for a base currency")
  @GetMapping("/exchange-rates/{baseCurrency}")
  public Map<String, BigDecimal> getExchangeRates(@PathVariable String baseCurrency) {
    return exchangeRateService.getRates(baseCurrency);
  }

  @Operation(summary = "Drop all cached rate tables so the next request fetches fresh rates")
  @DeleteMapping("/exchange-rates/cache")
  public ResponseEntity<Void> clearExchangeRateCache() {
    exchangeRateService.clearCache();
    return ResponseEntity.noContent().build();
  }

  @Operation(summary = "Convert an amount between two currencies")
  @GetMapping("/conversions")
  public ConversionResponse convert(
      @RequestParam BigDecimal amount, @RequestParam String from, @RequestParam String to) {
    var result = currencyConversionService.convert(amount, from, to);
    return new ConversionResponse(amount, from, to, result);
  }
}
