package com.loandesk.mapper;

import com.loandesk.api.dto.CommissionConfigDTO;
import com.loandesk.api.dto.CommissionRecordDTO;
import com.loandesk.api.dto.CommissionSnapshotDTO;
import com.loandesk.api.dto.KpiTierDTO;
import com.loandesk.model.CommissionConfig;
import com.loandesk.model.CommissionRecord;
import com.loandesk.model.CommissionSnapshot;
import com.loandesk.model.KpiCommissionTier;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface CommissionMapper {

    CommissionMapper INSTANCE = Mappers.getMapper(CommissionMapper.class);

    CommissionConfigDTO toDTO(CommissionConfig config);

    CommissionRecordDTO toDTO(CommissionRecord record);

    CommissionSnapshotDTO toDTO(CommissionSnapshot snapshot);

    KpiTierDTO toDTO(KpiCommissionTier tier);

    List<CommissionConfigDTO> toConfigDTOList(List<CommissionConfig> configs);

    List<KpiTierDTO> toTierDTOList(List<KpiCommissionTier> tiers);
}
