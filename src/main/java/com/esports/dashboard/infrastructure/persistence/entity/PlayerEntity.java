package com.esports.dashboard.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of a player.
 */
@Entity
@Immutable
@Table(name = "players")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerEntity {

    @Id
    @Column(name = "player_id")
    private Integer playerId;

    @Column(nullable = false)
    private String slug;

    @Column(name = "current_pseudo", nullable = false)
    private String currentPseudo;
}
