package com.loandesk.api.dto;

import com.loandesk.api.model.QuestionType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class QuestionDTO {
    private UUID id;
    private String content;
    private QuestionType type;
    private List<String> options;
    private String placeholder;
    private Integer maxLength;
    private boolean active;
}
