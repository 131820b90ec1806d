package org.budgetanalyzer.wallet.service;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import org.budgetanalyzer.wallet.config.WalletServiceProperties;
import org.budgetanalyzer.wallet.domain.Transaction;

/**
 * Searches a list of statement operations.
 *
 * <p>Every search returns the matching records, in input order, as a pretty-printed JSON array.
 * When nothing matches the result is exactly {@code []}.
 */
@Service
public class TransactionSearchService {

  private static final Logger log = LoggerFactory.getLogger(TransactionSearchService.class);

  static final String EMPTY_RESULT = "[]";

  /** {@code +7} or {@code 8}, then a 10-digit subscriber number split 3-3-2-2. */
  static final Pattern PHONE_PATTERN =
      Pattern.compile(
          "(?<![\\d+])(?:\\+7|8)[\\s-]?\\(?\\d{3}\\)?"
              + "[\\s-]?\\d{3}[\\s-]?\\d{2}[\\s-]?\\d{2}(?!\\d)");

  /** Surname followed by one or more initials, e.g. {@code Иванов И.} or {@code Петрова А.Б.} */
  static final Pattern PERSON_NAME_PATTERN =
      Pattern.compile("^\\p{Lu}\\p{Ll}+(?:-\\p{Lu}\\p{Ll}+)?\\s+\\p{Lu}\\.(?:\\s?\\p{Lu}\\.)*$");

  private final ObjectWriter writer;
  private final String transfersCategory;

  public TransactionSearchService(ObjectMapper objectMapper, WalletServiceProperties properties) {
    this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    this.transfersCategory = properties.transactions().transfersCategory();
  }

  /**
   * Finds operations whose description or category contains {@code query}, ignoring case.
   *
   * <p>The query is matched as is: whitespace is not trimmed, and an empty query matches every
   * operation that has a description or category.
   *
   * @param query text to look for
   * @param transactions operations to search
   * @return JSON array of matches
   * @throws IllegalArgumentException if {@code query} is null
   */
  public String simpleSearch(String query, List<Transaction> transactions) {
    if (query == null) {
      throw new IllegalArgumentException("query must not be null");
    }

    var needle = query.toLowerCase(Locale.ROOT);
    return search(
        "simple",
        transactions,
        transaction ->
            containsIgnoreCase(transaction.description(), needle)
                || containsIgnoreCase(transaction.category(), needle));
  }

  /**
   * Finds operations whose description contains a phone number such as {@code +7 999 123-45-67}.
   *
   * @param transactions operations to search
   * @return JSON array of matches
   */
  public String phoneSearch(List<Transaction> transactions) {
    return search(
        "phone",
        transactions,
        transaction ->
            transaction.description() != null
                && PHONE_PATTERN.matcher(transaction.description()).find());
  }

  /**
   * Finds transfers to private persons: the category is the transfers category and the
   * description is a surname with initials. Organizations in the same category are skipped.
   *
   * @param transactions operations to search
   * @return JSON array of matches
   */
  public String peopleTransferSearch(List<Transaction> transactions) {
    return search(
        "people-transfer",
        transactions,
        transaction ->
            transfersCategory.equalsIgnoreCase(trim(transaction.category()))
                && transaction.description() != null
                && PERSON_NAME_PATTERN.matcher(transaction.description().trim()).matches());
  }

  private String search(
      String searchType, List<Transaction> transactions, Predicate<Transaction> predicate) {
    var matches = transactions.stream().filter(predicate).toList();

    log.debug(
        "Transaction search type: {} matched {} of {}",
        searchType,
        matches.size(),
        transactions.size());

    return toJson(matches);
  }

  private String toJson(List<Transaction> matches) {
    if (matches.isEmpty()) {
      return EMPTY_RESULT;
    }

    try {
      return writer.writeValueAsString(matches);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize search result", e);
    }
  }

  private static boolean containsIgnoreCase(String value, String lowerCaseNeedle) {
    return value != null && value.toLowerCase(Locale.ROOT).contains(lowerCaseNeedle);
  }

  private static String trim(String value) {
    return value == null ? null : value.trim();
  }
}
