package com.loandesk.controller;

import com.loandesk.api.dto.PagedResponse;
import com.loandesk.config.LoanDeskProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Page requests bounded by {@code loandesk.pagination.max-page-size}, and their conversion to
 * {@link PagedResponse}.
 */
@Component
@RequiredArgsConstructor
public class Paging {

    private final LoanDeskProperties properties;

    public PageRequest of(int page, int size) {
        int pageSize = size < 1
                ? properties.getPagination().getDefaultPageSize()
                : Math.min(size, properties.getPagination().getMaxPageSize());
        return PageRequest.of(Math.max(page, 0), pageSize);
    }

    public static <E, D> PagedResponse<D> toResponse(Page<E> page, Function<E, D> mapper) {
        return new PagedResponse<>(
                page.getContent().stream().map(mapper).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }
}
