package com.esports.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Team or player identity in top lists.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityRef {

    private int id;
    private String slug;
    private String name;
    private String shortName;
    private String logoUrl;
}
