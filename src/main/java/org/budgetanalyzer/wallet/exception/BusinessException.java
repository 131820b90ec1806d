package org.budgetanalyzer.wallet.exception;

/**
 * Base class for domain errors that carry a machine-readable error code.
 *
 * <p>Business exceptions describe conditions the caller can act on (missing configuration,
 * unsupported currency, unusable upstream data). Transport failures are never converted into a
 * business exception.
 */
public class BusinessException extends RuntimeException {

  private final String code;

  public BusinessException(String message, String code) {
    super(message);
    this.code = code;
  }

  public BusinessException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
