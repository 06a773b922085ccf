package com.loandesk.mapper;

import com.loandesk.api.dto.DocumentRequirementDTO;
import com.loandesk.api.dto.LoanProductDTO;
import com.loandesk.api.dto.QuestionDTO;
import com.loandesk.model.DocumentRequirement;
import com.loandesk.model.LoanProduct;
import com.loandesk.model.Question;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

/**
 * Flattens the JSON configs of requirements and questions into their DTOs.
 */
@Mapper
public interface CatalogMapper {

    CatalogMapper INSTANCE = Mappers.getMapper(CatalogMapper.class);

    LoanProductDTO toDTO(LoanProduct product);

    @Mapping(target = "minFiles", source = "config.minFiles")
    @Mapping(target = "maxFiles", source = "config.maxFiles")
    @Mapping(target = "allowedTypes", source = "config.allowedTypes")
    @Mapping(target = "maxSizeBytes", source = "config.maxSizeBytes")
    @Mapping(target = "expirationDays", source = "config.expirationDays")
    DocumentRequirementDTO toDTO(DocumentRequirement requirement);

    @Mapping(target = "options", source = "config.options")
    @Mapping(target = "placeholder", source = "config.placeholder")
    @Mapping(target = "maxLength", source = "config.maxLength")
    QuestionDTO toDTO(Question question);
}
