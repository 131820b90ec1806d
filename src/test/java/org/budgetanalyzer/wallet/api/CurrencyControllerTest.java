package org.budgetanalyzer.wallet.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

import org.budgetanalyzer.wallet.base.AbstractControllerTest;
import org.budgetanalyzer.wallet.service.CurrencyConversionService;
import org.budgetanalyzer.wallet.service.CurrencyServiceError;
import org.budgetanalyzer.wallet.service.CurrencyServiceException;
import org.budgetanalyzer.wallet.service.ExchangeRateService;

@WebMvcTest(CurrencyController.class)
class CurrencyControllerTest extends AbstractControllerTest {

  @MockBean private ExchangeRateService exchangeRateService;

  @MockBean private CurrencyConversionService currencyConversionService;

  @Test
  void returnsRateTable() throws Exception {
    when(exchangeRateService.getRates("USD"))
        .thenReturn(Map.of("EUR", new BigDecimal("0.9"), "RUB", new BigDecimal("94.5")));

    performGet("/v1/exchange-rates/{baseCurrency}", "USD")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.EUR").value(0.9))
        .andExpect(jsonPath("$.RUB").value(94.5));
  }

  @Test
  void clearsCache() throws Exception {
    performDelete("/v1/exchange-rates/cache").andExpect(status().isNoContent());

    verify(exchangeRateService).clearCache();
  }

  @Test
  void convertsAmount() throws Exception {
    when(currencyConversionService.convert(any(BigDecimal.class), eq("RUB"), eq("USD")))
        .thenReturn(new BigDecimal("100"));

    performGet("/v1/conversions?amount=9000&from=RUB&to=USD")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.amount").value(9000))
        .andExpect(jsonPath("$.from").value("RUB"))
        .andExpect(jsonPath("$.to").value("USD"))
        .andExpect(jsonPath("$.result").value(100));
  }

  @Test
  void missingRateIsUnprocessable() throws Exception {
    when(currencyConversionService.convert(any(BigDecimal.class), eq("RUB"), eq("USD")))
        .thenThrow(
            new CurrencyServiceException(
                "No exchange rate for RUB", CurrencyServiceError.EXCHANGE_RATE_NOT_FOUND));

    performGet("/v1/conversions?amount=100&from=RUB&to=USD")
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("EXCHANGE_RATE_NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("No exchange rate for RUB"));
  }

  @Test
  void missingApiKeyIsServiceUnavailable() throws Exception {
    when(exchangeRateService.getRates("USD"))
        .thenThrow(
            new CurrencyServiceException(
                "API key for the exchange rate service is not configured",
                CurrencyServiceError.API_KEY_NOT_CONFIGURED));

    performGet("/v1/exchange-rates/{baseCurrency}", "USD")
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("API_KEY_NOT_CONFIGURED"));
  }

  @Test
  void malformedUpstreamResponseIsBadGateway() throws Exception {
    when(exchangeRateService.getRates("USD"))
        .thenThrow(
            new CurrencyServiceException(
                "Malformed exchange rate service response: missing 'data' object",
                CurrencyServiceError.MALFORMED_RATES_RESPONSE));

    performGet("/v1/exchange-rates/{baseCurrency}", "USD")
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("MALFORMED_RATES_RESPONSE"));
  }

  @Test
  void upstreamStatusErrorIsBadGateway() throws Exception {
    when(exchangeRateService.getRates("USD"))
        .thenThrow(new HttpClientErrorException(HttpStatus.UNAUTHORIZED));

    performGet("/v1/exchange-rates/{baseCurrency}", "USD")
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("RATES_SERVICE_ERROR"))
        .andExpect(jsonPath("$.message").value("Exchange rate service returned 401"));
  }

  @Test
  void unreachableUpstreamIsBadGateway() throws Exception {
    when(exchangeRateService.getRates("USD")).thenThrow(new ResourceAccessException("down"));

    performGet("/v1/exchange-rates/{baseCurrency}", "USD")
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("RATES_SERVICE_UNAVAILABLE"));
  }

  @Test
  void missingParameterIsBadRequest() throws Exception {
    performGet("/v1/conversions?amount=100&from=RUB")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
  }

  @Test
  void nonNumericAmountIsBadRequest() throws Exception {
    performGet("/v1/conversions?amount=abc&from=RUB&to=USD")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
  }
}
