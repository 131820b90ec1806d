package org.budgetanalyzer.wallet.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the wallet service, bound from the {@code budget-analyzer} prefix.
 *
 * @param ratesApi connection settings for the external exchange rate service
 * @param transactions settings for transaction search
 */
@ConfigurationProperties(prefix = "budget-analyzer")
@Validated
public record WalletServiceProperties(
    @Valid @NotNull RatesApi ratesApi, @Valid @NotNull Transactions transactions) {

  /**
   * Exchange rate service settings.
   *
   * <p>The API key may be empty at startup; it is checked on every rate request so a missing key
   * surfaces as a domain error instead of a failed application start.
   *
   * @param baseUrl base URL of the rate service, e.g. {@code https://api.currencyapi.com/v3}
   * @param apiKey credential sent with every request
   * @param connectTimeout connection timeout for the HTTP client
   * @param readTimeout read timeout for the HTTP client
   */
  public record RatesApi(
      @NotBlank String baseUrl,
      String apiKey,
      @NotNull Duration connectTimeout,
      @NotNull Duration readTimeout) {

    public boolean hasApiKey() {
      return apiKey != null && !apiKey.isBlank();
    }
  }

  /** @param transfersCategory category reserved for person-to-person transfers */
  public record Transactions(@NotBlank String transfersCategory) {}
}
