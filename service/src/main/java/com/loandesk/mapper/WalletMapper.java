package com.loandesk.mapper;

import com.loandesk.api.dto.WalletTransactionDTO;
import com.loandesk.api.dto.WithdrawalDTO;
import com.loandesk.api.response.WalletResponse;
import com.loandesk.model.Wallet;
import com.loandesk.model.WalletTransaction;
import com.loandesk.model.WithdrawalRequest;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for wallets, ledger entries and withdrawal requests.
 */
@Mapper
public interface WalletMapper {

    WalletMapper INSTANCE = Mappers.getMapper(WalletMapper.class);

    WalletResponse toResponse(Wallet wallet);

    WalletTransactionDTO toDTO(WalletTransaction transaction);

    WithdrawalDTO toDTO(WithdrawalRequest withdrawal);
}
