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
public class TeamRef {

    private Integer teamId;
    private String slug;
    private String shortName;
    private String logoUrl;
    private String region;
    private String league;
}
