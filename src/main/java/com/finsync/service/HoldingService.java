package com.finsync.service;

import com.finsync.dto.HoldingListResponse;
import com.finsync.dto.HoldingResponse;
import com.finsync.dto.SecurityResponse;
import com.finsync.model.Holding;
import com.finsync.model.Security;
import com.finsync.repository.ConnectedAccountRepository;
import com.finsync.repository.HoldingRepository;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class HoldingService {
  private final HoldingRepository holdingRepository;
  private final ConnectedAccountRepository accountRepository;

  public HoldingService(HoldingRepository holdingRepository, ConnectedAccountRepository accountRepository) {
    this.holdingRepository = holdingRepository;
    this.accountRepository = accountRepository;
  }

  /** Holdings of one connected account with their securities, largest position first. */
  public HoldingListResponse listHoldings(UUID userId, UUID accountId) {
    accountRepository.findByIdAndUserId(accountId, userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Connected account not found"));
    List<HoldingResponse> holdings = holdingRepository.findByAccountId(accountId).stream()
        .sorted(Comparator.comparing(Holding::getInstitutionValue).reversed())
        .map(this::toResponse)
        .toList();
    return new HoldingListResponse(holdings, holdings.size());
  }

  private HoldingResponse toResponse(Holding holding) {
    Security security = holding.getSecurity();
    SecurityResponse securityResponse = new SecurityResponse(security.getId(), security.getProviderSecurityId(),
        security.getName(), security.getTickerSymbol(), security.getSecurityType(), security.isCashEquivalent(),
        security.getClosePrice(), security.getClosePriceAsOf(), security.getCurrency());
    return new HoldingResponse(holding.getId(), holding.getAccount().getId(), securityResponse,
        holding.getQuantity(), holding.getInstitutionPrice(), holding.getInstitutionPriceAsOf(),
        holding.getInstitutionValue(), holding.getCostBasis(), holding.getCurrency(), holding.getCreatedAt());
  }
}
