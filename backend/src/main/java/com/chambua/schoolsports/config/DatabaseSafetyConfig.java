package com.chambua.schoolsports.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;
import java.util.Locale;

/**
 * Refuses to start when Hibernate would drop the Flyway-managed tables, unless the "test" profile is active.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    private final Environment environment;

    @Value("${spring.jpa.hibernate.ddl-auto:none}")
    private String ddlAuto;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    public DatabaseSafetyConfig(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void verifyDatasourceSettings() {
        boolean testProfile = Arrays.asList(environment.getActiveProfiles()).contains("test");
        log.info("[DB_SAFETY] datasource='{}' ddl-auto='{}' test-profile={}", datasourceUrl, ddlAuto, testProfile);

        String mode = ddlAuto == null ? "" : ddlAuto.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (isDestructive(mode) && !testProfile) {
            throw new IllegalStateException("ddl-auto '" + ddlAuto + "' would drop the Flyway-managed schema");
        }
    }

    static boolean isDestructive(String ddl) {
        return "create".equals(ddl) || "create-drop".equals(ddl);
    }
}
