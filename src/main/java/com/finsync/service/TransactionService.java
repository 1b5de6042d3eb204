package com.finsync.service;

import com.finsync.dto.TransactionListResponse;
import com.finsync.dto.TransactionResponse;
import com.finsync.dto.UpdateTransactionRequest;
import com.finsync.model.AccountTransaction;
import com.finsync.repository.AccountTransactionRepository;
import com.finsync.repository.ConnectedAccountRepository;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/** Read access to synced transactions and the user-owned override fields on them. */
@Service
public class TransactionService {
  static final int MAX_PAGE_SIZE = 500;
  private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
  private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

  private final AccountTransactionRepository transactionRepository;
  private final ConnectedAccountRepository accountRepository;

  public TransactionService(AccountTransactionRepository transactionRepository,
                            ConnectedAccountRepository accountRepository) {
    this.transactionRepository = transactionRepository;
    this.accountRepository = accountRepository;
  }

  /** Newest first. {@code accountId}, {@code from} and {@code to} are optional filters. */
  public TransactionListResponse listTransactions(UUID userId, UUID accountId, LocalDate from, LocalDate to,
                                                  int page, int size) {
    if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
          "page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
    }
    LocalDate start = from == null ? EARLIEST : from;
    LocalDate end = to == null ? LATEST : to;
    if (start.isAfter(end)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "from must not be after to");
    }

    PageRequest pageRequest = PageRequest.of(page, size);
    Page<AccountTransaction> result;
    if (accountId == null) {
      result = transactionRepository.findUserTransactionsInRange(userId, start, end, pageRequest);
    } else {
      accountRepository.findByIdAndUserId(accountId, userId)
          .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connected account not found"));
      result = transactionRepository.findAccountTransactionsInRange(userId, accountId, start, end, pageRequest);
    }
    return new TransactionListResponse(result.getContent().stream().map(this::toResponse).toList(),
        result.getTotalElements(), page, size);
  }

  public TransactionResponse getTransaction(UUID userId, UUID transactionId) {
    return toResponse(requireTransaction(userId, transactionId));
  }

  public TransactionResponse updateTransaction(UUID userId, UUID transactionId, UpdateTransactionRequest request) {
    if (request.getUserCategory() == null && request.getUserNotes() == null && request.getHidden() == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No valid update data provided");
    }
    AccountTransaction transaction = requireTransaction(userId, transactionId);
    if (request.getUserCategory() != null) {
      transaction.setUserCategory(blankToNull(request.getUserCategory()));
    }
    if (request.getUserNotes() != null) {
      transaction.setUserNotes(blankToNull(request.getUserNotes()));
    }
    if (request.getHidden() != null) {
      transaction.setHidden(request.getHidden());
    }
    return toResponse(transactionRepository.save(transaction));
  }

  private AccountTransaction requireTransaction(UUID userId, UUID transactionId) {
    return transactionRepository.findByIdAndUserId(transactionId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Transaction not found"));
  }

  private TransactionResponse toResponse(AccountTransaction transaction) {
    return new TransactionResponse(transaction.getId(), transaction.getAccount().getId(),
        transaction.getProviderTransactionId(), transaction.getAmount(), transaction.getCurrency(),
        transaction.getDate(), transaction.getAuthorizedDate(), transaction.getName(),
        transaction.getMerchantName(), transaction.getCategoryPrimary(), transaction.getCategoryDetailed(),
        transaction.getPaymentChannel(), transaction.isPending(), transaction.getUserCategory(),
        transaction.getUserNotes(), transaction.isHidden());
  }

  private static String blankToNull(String value) {
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
