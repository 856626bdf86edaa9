package com.esports.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LpChangeEntry {

    private int rank;
    private EntityRef entity;
    private EntityType entityType;
    private TeamRef team;
    private int lpChange;
    private int games;
}
