package com.loandesk.controller;

import com.loandesk.api.WalletApi;
import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.WalletTransactionDTO;
import com.loandesk.api.response.BalanceResponse;
import com.loandesk.api.response.IntegrityResponse;
import com.loandesk.api.response.WalletResponse;
import com.loandesk.mapper.WalletMapper;
import com.loandesk.model.Wallet;
import com.loandesk.model.WalletTransaction;
import com.loandesk.service.WalletService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
public class WalletController implements WalletApi {

    private final WalletService walletService;
    private final Paging paging;

    @Override
    public ResponseEntity<WalletResponse> getMyWallet(UUID actorId) {
        return ResponseEntity.ok(WalletMapper.INSTANCE.toResponse(walletService.getOrCreateWallet(actorId)));
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(UUID userId) {
        Wallet wallet = walletService.getWalletByUserId(userId);
        return ResponseEntity.ok(new BalanceResponse(userId, wallet.getId(), wallet.getBalance()));
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getTransactions(UUID userId, int page, int size) {
        Page<WalletTransaction> transactions = walletService.getTransactionsByUser(userId, paging.of(page, size));
        PagedResponse<WalletTransactionDTO> response = Paging.toResponse(transactions, WalletMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<IntegrityResponse> verifyIntegrity(UUID walletId) {
        return ResponseEntity.ok(walletService.verifyWalletIntegrity(walletId));
    }
}
