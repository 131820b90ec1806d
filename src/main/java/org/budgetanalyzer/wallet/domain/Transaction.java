package org.budgetanalyzer.wallet.domain;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * A single operation from a bank statement export.
 *
 * <p>JSON property names are the statement column names, so records read from an export and
 * records written back by the search operations look the same. Columns other than the known ones
 * are kept in {@link #otherColumns()} and written back after them.
 */
@Schema(description = "Bank statement operation")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  Transaction.OPERATION_DATE,
  Transaction.AMOUNT,
  Transaction.CURRENCY,
  Transaction.CATEGORY,
  Transaction.DESCRIPTION
})
@JsonDeserialize(builder = Transaction.Builder.class)
public record Transaction(
    @Schema(description = "Operation date (YYYY-MM-DD)", example = "2024-05-15")
        @JsonProperty(Transaction.OPERATION_DATE)
        String operationDate,
    @Schema(description = "Signed operation amount", example = "-160.89")
        @JsonProperty(Transaction.AMOUNT)
        BigDecimal amount,
    @Schema(description = "Operation currency", example = "RUB")
        @JsonProperty(Transaction.CURRENCY)
        String currency,
    @Schema(description = "Statement category", example = "Переводы")
        @JsonProperty(Transaction.CATEGORY)
        String category,
    @Schema(description = "Free-form description", example = "Иванов И.")
        @JsonProperty(Transaction.DESCRIPTION)
        String description,
    @Schema(description = "Any other statement columns, by column name")
        @JsonAnyGetter
        Map<String, Object> otherColumns) {

  public static final String OPERATION_DATE = "Дата операции";
  public static final String AMOUNT = "Сумма операции";
  public static final String CURRENCY = "Валюта операции";
  public static final String CATEGORY = "Категория";
  public static final String DESCRIPTION = "Описание";

  public Transaction {
    // column values may be null, so Map.copyOf does not fit
    otherColumns =
        otherColumns == null || otherColumns.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(otherColumns));
  }

  /** Record with the known columns only. */
  public Transaction(
      String operationDate,
      BigDecimal amount,
      String currency,
      String category,
      String description) {
    this(operationDate, amount, currency, category, description, Map.of());
  }

  /** Record without an operation currency. */
  public Transaction(
      String operationDate, BigDecimal amount, String category, String description) {
    this(operationDate, amount, null, category, description);
  }

  /** Reads a statement row, collecting unknown columns in column order. */
  @JsonPOJOBuilder(withPrefix = "")
  public static final class Builder {

    private String operationDate;
    private BigDecimal amount;
    private String currency;
    private String category;
    private String description;
    private final Map<String, Object> otherColumns = new LinkedHashMap<>();

    @JsonProperty(OPERATION_DATE)
    public Builder operationDate(String operationDate) {
      this.operationDate = operationDate;
      return this;
    }

    @JsonProperty(AMOUNT)
    public Builder amount(BigDecimal amount) {
      this.amount = amount;
      return this;
    }

    @JsonProperty(CURRENCY)
    public Builder currency(String currency) {
      this.currency = currency;
      return this;
    }

    @JsonProperty(CATEGORY)
    public Builder category(String category) {
      this.category = category;
      return this;
    }

    @JsonProperty(DESCRIPTION)
    public Builder description(String description) {
      this.description = description;
      return this;
    }

    @JsonAnySetter
    public Builder otherColumn(String name, Object value) {
      otherColumns.put(name, value);
      return this;
    }

    public Transaction build() {
      return new Transaction(
          operationDate, amount, currency, category, description, otherColumns);
    }
  }
}
