package com.esports.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamInfo {

    private int teamId;
    private String slug;
    private String currentName;
    private String shortName;
    private String logoUrl;
    private String region;
    private String league;
}
