package org.budgetanalyzer.wallet.service.provider;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.wallet.config.WalletServiceProperties;
import org.budgetanalyzer.wallet.service.CurrencyServiceError;
import org.budgetanalyzer.wallet.service.CurrencyServiceException;

/**
 * {@link ExchangeRateProvider} backed by the currencyapi.com {@code /latest} endpoint.
 *
 * <p>Expected body:
 *
 * <pre>{@code
 * {"data": {"EUR": {"code": "EUR", "value": "0.9"}, "RUB": {"code": "RUB", "value": "94.5"}}}
 * }</pre>
 *
 * <p>Errors raised by {@link RestClient} (connection failures, timeouts, 4xx/5xx statuses) are not
 * caught here, so callers can tell an unavailable service apart from a garbage response.
 */
@Component
public class CurrencyApiExchangeRateProvider implements ExchangeRateProvider {

  private static final Logger log = LoggerFactory.getLogger(CurrencyApiExchangeRateProvider.class);

  static final String LATEST_PATH = "/latest";
  static final String BASE_CURRENCY_PARAM = "base_currency";
  static final String API_KEY_HEADER = "apikey";

  private static final String DATA_FIELD = "data";
  private static final String VALUE_FIELD = "value";

  private final RestClient ratesRestClient;
  private final ObjectMapper objectMapper;
  private final WalletServiceProperties properties;

  public CurrencyApiExchangeRateProvider(
      RestClient ratesRestClient, ObjectMapper objectMapper, WalletServiceProperties properties) {
    this.ratesRestClient = ratesRestClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public Map<String, BigDecimal> getExchangeRates(String baseCurrency) {
    var ratesApi = properties.ratesApi();
    if (!ratesApi.hasApiKey()) {
      throw new CurrencyServiceException(
          "API key for the exchange rate service is not configured",
          CurrencyServiceError.API_KEY_NOT_CONFIGURED);
    }

    log.info("Fetching exchange rates baseCurrency: {}", baseCurrency);

    var body =
        ratesRestClient
            .get()
            .uri(
                uriBuilder ->
                    uriBuilder
                        .path(LATEST_PATH)
                        .queryParam(BASE_CURRENCY_PARAM, baseCurrency)
                        .build())
            .header(API_KEY_HEADER, ratesApi.apiKey())
            .retrieve()
            .body(String.class);

    var rates = parseRates(body, baseCurrency);
    log.info("Fetched {} exchange rates baseCurrency: {}", rates.size(), baseCurrency);

    return rates;
  }

  private Map<String, BigDecimal> parseRates(String body, String baseCurrency) {
    JsonNode root;
    try {
      root = body == null ? null : objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw malformed(baseCurrency, "body is not valid JSON", e);
    }

    var data = root == null ? null : root.get(DATA_FIELD);
    if (data == null || !data.isObject()) {
      throw malformed(baseCurrency, "missing '" + DATA_FIELD + "' object", null);
    }

    var rates = new LinkedHashMap<String, BigDecimal>();
    var fields = data.fields();
    while (fields.hasNext()) {
      var entry = fields.next();
      rates.put(entry.getKey(), parseValue(entry.getKey(), entry.getValue(), baseCurrency));
    }

    return rates;
  }

  private BigDecimal parseValue(String currencyCode, JsonNode rateNode, String baseCurrency) {
    var valueNode = rateNode.get(VALUE_FIELD);
    if (valueNode == null || !(valueNode.isNumber() || valueNode.isTextual())) {
      throw malformed(baseCurrency, "no value for " + currencyCode, null);
    }

    BigDecimal rate;
    try {
      rate =
          valueNode.isNumber()
              ? valueNode.decimalValue()
              : new BigDecimal(valueNode.textValue().trim());
    } catch (NumberFormatException e) {
      throw malformed(baseCurrency, "value for " + currencyCode + " is not a number", e);
    }

    if (rate.signum() < 0) {
      throw malformed(baseCurrency, "negative value for " + currencyCode, null);
    }

    return rate;
  }

  private CurrencyServiceException malformed(String baseCurrency, String reason, Throwable cause) {
    log.warn("Malformed exchange rate response baseCurrency: {} reason: {}", baseCurrency, reason);
    return new CurrencyServiceException(
        "Malformed exchange rate service response: " + reason,
        CurrencyServiceError.MALFORMED_RATES_RESPONSE,
        cause);
  }
}
