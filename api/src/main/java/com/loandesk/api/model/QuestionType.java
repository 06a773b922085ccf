package com.loandesk.api.model;

public enum QuestionType {
    TEXT,
    TEXTAREA,
    NUMBER,
    DATE,
    SELECT,
    MULTI_SELECT
}
