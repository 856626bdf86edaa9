package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageMeta {

    private long total;
    private int perPage;
    private int currentPage;
    private int lastPage;

    public static PageMeta of(long total, int perPage, int currentPage) {
        return PageMeta.builder()
                .total(total)
                .perPage(perPage)
                .currentPage(currentPage)
                .lastPage((int) Math.ceil((double) total / perPage))
                .build();
    }
}
