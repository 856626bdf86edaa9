package com.esports.dashboard.infrastructure.persistence.repository;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One page of rows plus the total row count across all pages.
 * {@code total} is 0 when the page came back empty, since the window count rides on the rows.
 */
@Data
@AllArgsConstructor
public class RowSlice<T> {
    private List<T> rows;
    private long total;
}
