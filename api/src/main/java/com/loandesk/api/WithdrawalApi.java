package com.loandesk.api;

import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.WithdrawalDTO;
import com.loandesk.api.model.WithdrawalStatus;
import com.loandesk.api.request.CreateWithdrawalRequest;
import com.loandesk.api.request.ProcessWithdrawalRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Withdrawal API: users cash out their wallet balance, admins approve, pay or reject requests.
 *
 * <p>The requested amount is debited from the wallet when the request is created and credited
 * back if the request is rejected.
 */
@RequestMapping("/api/v1/withdrawals")
public interface WithdrawalApi {

    @PostMapping
    ResponseEntity<WithdrawalDTO> createWithdrawal(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                   @RequestBody @Valid CreateWithdrawalRequest request);

    @GetMapping("/mine")
    ResponseEntity<PagedResponse<WithdrawalDTO>> getMyWithdrawals(
            @RequestHeader(ApiHeaders.USER_ID) UUID actorId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    @GetMapping
    ResponseEntity<PagedResponse<WithdrawalDTO>> searchWithdrawals(
            @RequestParam(value = "status", required = false) WithdrawalStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Moves a request to APPROVED, PAID or REJECTED. PAID requires a proof of transfer.
     */
    @PutMapping("/{withdrawalId}/process")
    ResponseEntity<WithdrawalDTO> processWithdrawal(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                    @PathVariable("withdrawalId") UUID withdrawalId,
                                                    @RequestBody @Valid ProcessWithdrawalRequest request);
}
