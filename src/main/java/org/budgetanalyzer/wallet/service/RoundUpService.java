package org.budgetanalyzer.wallet.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.budgetanalyzer.wallet.domain.Transaction;

/**
 * Calculates the "investment piggy bank": the spare change saved if every operation of a month
 * were rounded up to the next multiple of a fixed limit.
 */
@Service
public class RoundUpService {

  private static final Logger log = LoggerFactory.getLogger(RoundUpService.class);

  public static final Set<Integer> ALLOWED_LIMITS = Set.of(10, 50, 100);

  private static final Pattern MONTH_PATTERN = Pattern.compile("^\\d{4}-\\d{2}$");

  /** Round-up total for one month together with the number of operations it covers. */
  public record Summary(int matchedTransactions, BigDecimal total) {}

  /**
   * Sums {@code ceil(amount / limit) * limit - amount} over the operations dated in {@code
   * month}.
   *
   * @param month month in {@code YYYY-MM} form
   * @param transactions operations to consider
   * @param limit rounding step, one of {@link #ALLOWED_LIMITS}
   * @return total spare change, never negative
   * @throws IllegalArgumentException if {@code month} or {@code limit} is invalid
   * @see #summarize(String, List, int)
   */
  public BigDecimal investmentBank(String month, List<Transaction> transactions, int limit) {
    return summarize(month, transactions, limit).total();
  }

  /**
   * Computes the round-up total and counts the operations it was computed from, in one pass.
   *
   * <p>Operations are selected by a prefix match of {@code month} on the operation date text. The
   * formula is applied to every selected amount as is, so negative amounts are rounded toward
   * zero and exact multiples contribute nothing. Operations without a date or amount are skipped.
   *
   * @param month month in {@code YYYY-MM} form
   * @param transactions operations to consider
   * @param limit rounding step, one of {@link #ALLOWED_LIMITS}
   * @return matched operation count and total spare change
   * @throws IllegalArgumentException if {@code month} or {@code limit} is invalid
   */
  public Summary summarize(String month, List<Transaction> transactions, int limit) {
    if (month == null || !MONTH_PATTERN.matcher(month).matches()) {
      throw new IllegalArgumentException("month must be in 'YYYY-MM' format");
    }
    if (!ALLOWED_LIMITS.contains(limit)) {
      throw new IllegalArgumentException("limit must be 10, 50 or 100");
    }

    var step = BigDecimal.valueOf(limit);
    var matched = 0;
    var total = BigDecimal.ZERO;
    for (var transaction : transactions) {
      if (isInMonth(transaction, month)) {
        var amount = transaction.amount();
        total = total.add(roundUp(amount, step).subtract(amount));
        matched++;
      }
    }

    log.info(
        "Round-up month: {} limit: {} matched {} operations, total: {}",
        month,
        limit,
        matched,
        total);

    return new Summary(matched, total);
  }

  private static boolean isInMonth(Transaction transaction, String month) {
    return transaction.operationDate() != null
        && transaction.operationDate().startsWith(month)
        && transaction.amount() != null;
  }

  static BigDecimal roundUp(BigDecimal amount, BigDecimal step) {
    return amount.divide(step, 0, RoundingMode.CEILING).multiply(step);
  }
}
