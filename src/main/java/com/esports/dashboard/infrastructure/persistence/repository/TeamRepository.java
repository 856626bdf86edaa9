package com.esports.dashboard.infrastructure.persistence.repository;

import com.esports.dashboard.infrastructure.persistence.entity.TeamEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Team lookups by id. Aggregations go through the JDBC repositories.
 */
@Repository
public interface TeamRepository extends JpaRepository<TeamEntity, Integer> {
}
