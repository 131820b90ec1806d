package org.budgetanalyzer.wallet.api;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.budgetanalyzer.wallet.api.response.ApiErrorResponse;
import org.budgetanalyzer.wallet.service.CurrencyServiceException;

/**
 * Maps service exceptions to HTTP responses.
 *
 * <p>Upstream transport and status errors from the rate service reach this handler unchanged and
 * are reported as 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String INVALID_REQUEST_MESSAGE =
      "Request body or parameters are missing or cannot be read";

  @ExceptionHandler(CurrencyServiceException.class)
  public ResponseEntity<ApiErrorResponse> handleCurrencyService(CurrencyServiceException ex) {
    var status =
        switch (ex.getError()) {
          case API_KEY_NOT_CONFIGURED -> HttpStatus.SERVICE_UNAVAILABLE;
          case MALFORMED_RATES_RESPONSE -> HttpStatus.BAD_GATEWAY;
          case EXCHANGE_RATE_NOT_FOUND -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    log.warn("Currency service error code: {} message: {}", ex.getCode(), ex.getMessage());
    return build(status, ex.getCode(), ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    var message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    log.debug("Unreadable request: {}", ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", INVALID_REQUEST_MESSAGE);
  }

  @ExceptionHandler(RestClientResponseException.class)
  public ResponseEntity<ApiErrorResponse> handleUpstreamStatus(RestClientResponseException ex) {
    log.warn("Exchange rate service returned status: {}", ex.getStatusCode().value());
    return build(
        HttpStatus.BAD_GATEWAY,
        "RATES_SERVICE_ERROR",
        "Exchange rate service returned " + ex.getStatusCode().value());
  }

  @ExceptionHandler(ResourceAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleUpstreamUnavailable(ResourceAccessException ex) {
    log.warn("Exchange rate service unreachable: {}", ex.getMessage());
    return build(
        HttpStatus.BAD_GATEWAY, "RATES_SERVICE_UNAVAILABLE", "Exchange rate service unreachable");
  }

  private ResponseEntity<ApiErrorResponse> build(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
