package com.celflicks.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests. The schema is migrated once per JVM
 * and every table is truncated after each test.
 */
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("celflicks_test")
            .withUsername("celflicks")
            .withPassword("celflicks");

    private static final Object MIGRATION_LOCK = new Object();
    private static boolean initialized = false;

    static {
        String dockerHost = System.getProperty("docker.host");
        if (dockerHost == null || dockerHost.isBlank()) {
            dockerHost = System.getenv("DOCKER_HOST");
        }
        if (dockerHost != null && !dockerHost.isBlank()) {
            System.setProperty("docker.host", dockerHost);
        }

        String apiVersion = System.getenv("DOCKER_API_VERSION");
        if (apiVersion != null && !apiVersion.isBlank()) {
            System.setProperty("api.version", apiVersion);
        }
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("spring.flyway.url", POSTGRES::getJdbcUrl);
        registry.add("spring.flyway.user", POSTGRES::getUsername);
        registry.add("spring.flyway.password", POSTGRES::getPassword);

        // 재시도 대기를 짧게
        registry.add("celflicks.onboarding.backoff-base", () -> "10ms");

        synchronized (MIGRATION_LOCK) {
            if (!initialized) {
                cleanAndMigrate();
                initialized = true;
            }
        }
    }

    private static void cleanAndMigrate() {
        Flyway flyway = Flyway.configure()
                .dataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword())
                .locations("classpath:db/migration")
                .cleanDisabled(false)
                .load();
        flyway.clean();
        flyway.migrate();
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    TRUNCATE TABLE audio_room_participant, audio_room, notification, wallet_transaction,
                                   user_balance, profile, audit_log, app_user
                    """);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to truncate tables after test", ex);
        }
    }
}
