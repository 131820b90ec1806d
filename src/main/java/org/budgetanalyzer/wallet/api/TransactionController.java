package org.budgetanalyzer.wallet.api;

import jakarta.validation.Valid;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.budgetanalyzer.wallet.api.request.RoundUpRequest;
import org.budgetanalyzer.wallet.api.request.SimpleSearchRequest;
import org.budgetanalyzer.wallet.api.request.TransactionListRequest;
import org.budgetanalyzer.wallet.api.response.RoundUpResponse;
import org.budgetanalyzer.wallet.service.RoundUpService;
import org.budgetanalyzer.wallet.service.TransactionSearchService;

@Tag(name = "Transactions", description = "Transaction search and round-up savings")
@RestController
@RequestMapping(path = "/v1", produces = MediaType.APPLICATION_JSON_VALUE)
public class TransactionController {

  private final TransactionSearchService transactionSearchService;
  private final RoundUpService roundUpService;

  public TransactionController(
      TransactionSearchService transactionSearchService, RoundUpService roundUpService) {
    this.transactionSearchService = transactionSearchService;
    this.roundUpService = roundUpService;
  }

  @Operation(summary = "Find operations whose description or category contains the query")
  @PostMapping("/transactions/search/simple")
  public String simpleSearch(@Valid @RequestBody SimpleSearchRequest request) {
    return transactionSearchService.simpleSearch(request.query(), request.transactions());
  }

  @Operation(summary = "Find operations mentioning a phone number")
  @PostMapping("/transactions/search/phone")
  public String phoneSearch(@Valid @RequestBody TransactionListRequest request) {
    return transactionSearchService.phoneSearch(request.transactions());
  }

  @Operation(summary = "Find transfers to private persons")
  @PostMapping("/transactions/search/people-transfers")
  public String peopleTransferSearch(@Valid @RequestBody TransactionListRequest request) {
    return transactionSearchService.peopleTransferSearch(request.transactions());
  }

  @Operation(summary = "Project round-up savings for a month")
  @PostMapping("/round-ups")
  public RoundUpResponse roundUp(@Valid @RequestBody RoundUpRequest request) {
    var summary =
        roundUpService.summarize(request.month(), request.transactions(), request.limit());

    return new RoundUpResponse(
        request.month(), request.limit(), summary.matchedTransactions(), summary.total());
  }
}
