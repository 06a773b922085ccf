package com.loandesk.api;

import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.WithdrawalDTO;
import com.loandesk.api.model.WithdrawalStatus;
import com.loandesk.api.request.CreateWithdrawalRequest;
import com.loandesk.api.request.ProcessWithdrawalRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;
import java.util.UUID;

@RequiredArgsConstructor
@Slf4j
public class WithdrawalClient implements WithdrawalApi {

    private static final ParameterizedTypeReference<PagedResponse<WithdrawalDTO>> WITHDRAWAL_PAGE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    @Override
    public ResponseEntity<WithdrawalDTO> createWithdrawal(UUID actorId, CreateWithdrawalRequest request) {
        log.debug("Calling createWithdrawal: actorId={}, amount={}, method={}",
                actorId, request.amount(), request.method());

        return webClient.post()
                .uri("/api/v1/withdrawals")
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(WithdrawalDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WithdrawalDTO>> getMyWithdrawals(UUID actorId, int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/withdrawals/mine")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(WITHDRAWAL_PAGE)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WithdrawalDTO>> searchWithdrawals(WithdrawalStatus status, int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/withdrawals")
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .retrieve()
                .toEntity(WITHDRAWAL_PAGE)
                .block();
    }

    @Override
    public ResponseEntity<WithdrawalDTO> processWithdrawal(UUID actorId, UUID withdrawalId,
                                                           ProcessWithdrawalRequest request) {
        log.debug("Calling processWithdrawal: withdrawalId={}, status={}", withdrawalId, request.status());

        return webClient.put()
                .uri("/api/v1/withdrawals/{withdrawalId}/process", withdrawalId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(WithdrawalDTO.class)
                .block();
    }
}
