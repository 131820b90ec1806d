package org.budgetanalyzer.wallet.fixture;

import java.math.BigDecimal;

import org.budgetanalyzer.wallet.domain.Transaction;

/** Builder for {@link Transaction} test data with sensible defaults. */
public class TransactionTestBuilder {

  private String operationDate = "2024-05-15";
  private BigDecimal amount = new BigDecimal("100.00");
  private String currency;
  private String category = TestConstants.CATEGORY_FOOD;
  private String description = "Покупка";

  public static TransactionTestBuilder aTransaction() {
    return new TransactionTestBuilder();
  }

  /** Operation with only a description and category, as produced by a text search source. */
  public static Transaction described(String description, String category) {
    return new Transaction(null, null, category, description);
  }

  /** Operation with only a date and amount. */
  public static Transaction dated(String operationDate, String amount) {
    return new Transaction(operationDate, new BigDecimal(amount), null, null);
  }

  public TransactionTestBuilder withOperationDate(String operationDate) {
    this.operationDate = operationDate;
    return this;
  }

  public TransactionTestBuilder withAmount(String amount) {
    this.amount = new BigDecimal(amount);
    return this;
  }

  public TransactionTestBuilder withCurrency(String currency) {
    this.currency = currency;
    return this;
  }

  public TransactionTestBuilder withCategory(String category) {
    this.category = category;
    return this;
  }

  public TransactionTestBuilder withDescription(String description) {
    this.description = description;
    return this;
  }

  public Transaction build() {
    return new Transaction(operationDate, amount, currency, category, description);
  }
}
