package com.loandesk.api;

import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.WalletTransactionDTO;
import com.loandesk.api.response.BalanceResponse;
import com.loandesk.api.response.IntegrityResponse;
import com.loandesk.api.response.WalletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

@RequiredArgsConstructor
@Slf4j
public class WalletClient implements WalletApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<WalletResponse> getMyWallet(UUID actorId) {
        log.debug("Calling getMyWallet: actorId={}", actorId);

        return webClient.get()
                .uri("/api/v1/wallets/me")
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(UUID userId) {
        log.debug("Calling getBalance: userId={}", userId);

        return webClient.get()
                .uri("/api/v1/wallets/users/{userId}/balance", userId)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getTransactions(UUID userId, int page, int size) {
        log.debug("Calling getTransactions: userId={}, page={}, size={}", userId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/wallets/users/{userId}/transactions")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(userId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<WalletTransactionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<IntegrityResponse> verifyIntegrity(UUID walletId) {
        log.debug("Calling verifyIntegrity: walletId={}", walletId);

        return webClient.get()
                .uri("/api/v1/wallets/{walletId}/integrity", walletId)
                .retrieve()
                .toEntity(IntegrityResponse.class)
                .block();
    }
}
