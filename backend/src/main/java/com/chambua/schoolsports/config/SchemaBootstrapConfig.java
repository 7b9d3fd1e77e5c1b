package com.chambua.schoolsports.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runs the table migrations once at startup. A failed migration is logged and the process keeps
 * running; a missing table then shows up as a query error on first use.
 */
@Configuration
public class SchemaBootstrapConfig {
    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrapConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return SchemaBootstrapConfig::migrateQuietly;
    }

    static void migrateQuietly(Flyway flyway) {
        try {
            log.info("[Schema] Running Flyway repair before migrate");
            flyway.repair();
        } catch (Exception ex) {
            log.warn("[Schema] Flyway repair failed or not needed: {}", ex.getMessage());
        }
        try {
            var result = flyway.migrate();
            log.info("[Schema] Database tables initialized ({} migrations applied)", result.migrationsExecuted);
        } catch (Exception ex) {
            log.error("[Schema] Error initializing database tables", ex);
        }
    }
}
