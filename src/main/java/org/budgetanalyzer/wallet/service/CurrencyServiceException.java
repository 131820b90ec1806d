package org.budgetanalyzer.wallet.service;

import org.budgetanalyzer.wallet.exception.BusinessException;

/** Raised by the rate pipeline for configuration, response-format and lookup errors. */
public class CurrencyServiceException extends BusinessException {

  private final CurrencyServiceError error;

  public CurrencyServiceException(String message, CurrencyServiceError error) {
    super(message, error.name());
    this.error = error;
  }

  public CurrencyServiceException(String message, CurrencyServiceError error, Throwable cause) {
    super(message, error.name(), cause);
    this.error = error;
  }

  public CurrencyServiceError getError() {
    return error;
  }
}
