package com.esports.dashboard.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of a team.
 *
 * The table is owned by the ingestion side; this service never writes to it,
 * so the mapping only covers columns the dashboard reads.
 */
@Entity
@Immutable
@Table(name = "teams")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamEntity {

    @Id
    @Column(name = "team_id")
    private Integer teamId;

    @Column(nullable = false)
    private String slug;

    @Column(name = "current_name", nullable = false)
    private String currentName;

    @Column(name = "short_name")
    private String shortName;

    private String region;

    private String league;

    @Column(name = "is_active")
    private Boolean active;
}
