package com.esports.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Esports Dashboard Backend
 *
 * Read-only query engine behind the LoL esports dashboard.
 *
 * Architecture:
 * - REST APIs for leaderboards, top lists, history and summary
 * - Hand-written PostgreSQL CTE queries over daily rank snapshots
 * - Whitelisted dynamic filters, parameter-bound values only
 * - Redis caching with a circuit breaker
 * - Every query bounded by a timeout on a dedicated pool
 */
@SpringBootApplication
public class DashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashboardApplication.class, args);
    }
}
