package com.loandesk.api.dto;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param data         records of the current page, at most {@code pageSize} of them
 * @param pageNumber   zero-based
 * @param totalRecords across all pages
 */
public record PagedResponse<T>(List<T> data, int pageNumber, int pageSize, long totalRecords, int totalPages) {

    public PagedResponse(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        this(data, pageNumber, pageSize, totalRecords,
                pageSize == 0 ? 0 : (int) ((totalRecords + pageSize - 1) / pageSize));
    }
}
