package com.loandesk.controller;

import com.loandesk.api.WithdrawalApi;
import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.WithdrawalDTO;
import com.loandesk.api.model.WithdrawalStatus;
import com.loandesk.api.request.CreateWithdrawalRequest;
import com.loandesk.api.request.ProcessWithdrawalRequest;
import com.loandesk.mapper.WalletMapper;
import com.loandesk.model.WithdrawalRequest;
import com.loandesk.service.WithdrawalService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
public class WithdrawalController implements WithdrawalApi {

    private final WithdrawalService withdrawalService;
    private final Paging paging;

    @Override
    public ResponseEntity<WithdrawalDTO> createWithdrawal(UUID actorId, CreateWithdrawalRequest request) {
        WithdrawalRequest withdrawal = withdrawalService.createRequest(actorId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(WalletMapper.INSTANCE.toDTO(withdrawal));
    }

    @Override
    public ResponseEntity<PagedResponse<WithdrawalDTO>> getMyWithdrawals(UUID actorId, int page, int size) {
        Page<WithdrawalRequest> requests = withdrawalService.getUserRequests(actorId, paging.of(page, size));
        PagedResponse<WithdrawalDTO> response = Paging.toResponse(requests, WalletMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PagedResponse<WithdrawalDTO>> searchWithdrawals(WithdrawalStatus status, int page, int size) {
        Page<WithdrawalRequest> requests = withdrawalService.searchRequests(status, paging.of(page, size));
        PagedResponse<WithdrawalDTO> response = Paging.toResponse(requests, WalletMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<WithdrawalDTO> processWithdrawal(UUID actorId, UUID withdrawalId,
                                                           ProcessWithdrawalRequest request) {
        return ResponseEntity.ok(WalletMapper.INSTANCE.toDTO(withdrawalService.processRequest(withdrawalId, actorId,
                request)));
    }
}
