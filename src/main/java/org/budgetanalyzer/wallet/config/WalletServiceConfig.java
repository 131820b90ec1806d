package org.budgetanalyzer.wallet.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Main configuration class for the Wallet Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties(WalletServiceProperties.class)
public class WalletServiceConfig {

  /**
   * RestClient bound to the exchange rate service.
   *
   * @param builder Boot-configured builder (message converters, observation)
   * @param properties service configuration
   * @return RestClient for the rate service
   */
  @Bean
  public RestClient ratesRestClient(
      RestClient.Builder builder, WalletServiceProperties properties) {
    var ratesApi = properties.ratesApi();
    var settings =
        ClientHttpRequestFactorySettings.DEFAULTS
            .withConnectTimeout(ratesApi.connectTimeout())
            .withReadTimeout(ratesApi.readTimeout());

    return builder
        .baseUrl(ratesApi.baseUrl())
        .requestFactory(ClientHttpRequestFactories.get(settings))
        .build();
  }
}
