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
public class GrinderEntry {

    private int rank;
    private EntityRef entity;
    private EntityType entityType;
    private TeamRef team;
    private String role;
    private int games;
}
