package com.loandesk.api;

import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.WalletTransactionDTO;
import com.loandesk.api.response.BalanceResponse;
import com.loandesk.api.response.IntegrityResponse;
import com.loandesk.api.response.WalletResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Wallet API: read access to user wallets and their append-only ledger.
 *
 * <p>Wallets are never credited or debited through this API directly; money moves only as a
 * consequence of commissions, KPI bonuses and withdrawals.
 */
@RequestMapping("/api/v1/wallets")
public interface WalletApi {

    /**
     * Returns the acting user's wallet, creating an empty one on first access.
     */
    @GetMapping("/me")
    ResponseEntity<WalletResponse> getMyWallet(@RequestHeader(ApiHeaders.USER_ID) UUID actorId);

    @GetMapping("/users/{userId}/balance")
    ResponseEntity<BalanceResponse> getBalance(@PathVariable("userId") UUID userId);

    @GetMapping("/users/{userId}/transactions")
    ResponseEntity<PagedResponse<WalletTransactionDTO>> getTransactions(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Re-sums the wallet's ledger and compares it with the cached balance.
     */
    @GetMapping("/{walletId}/integrity")
    ResponseEntity<IntegrityResponse> verifyIntegrity(@PathVariable("walletId") UUID walletId);
}
