package com.shelfkeep.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationInitializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the lending registry database.
 *
 * <p>Services import this configuration and switch off Spring Boot's own Flyway
 * auto-configuration:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * shelfkeep:
 *   flyway:
 *     enabled: true
 * }</pre>
 *
 * <p>The Flyway instance runs against the service's primary {@link DataSource}; migrations are
 * applied by {@link FlywayMigrationInitializer} while the context starts, before any request can
 * reach the store.
 *
 * @see RegistryFlywayProperties
 */
@Configuration
@EnableConfigurationProperties(RegistryFlywayProperties.class)
@ConditionalOnProperty(prefix = "shelfkeep.flyway", name = "enabled", havingValue = "true")
public class RegistryFlywayConfig {

    /** Bean name for the registry Flyway instance. */
    public static final String REGISTRY_FLYWAY_BEAN = "registryFlyway";

    /** Logical database name reported by {@link MigrationService}. */
    public static final String REGISTRY_DATABASE = "registry";

    @Bean(name = REGISTRY_FLYWAY_BEAN)
    public Flyway registryFlyway(DataSource dataSource, RegistryFlywayProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().toArray(String[]::new))
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }

    @Bean
    public FlywayMigrationInitializer registryFlywayInitializer(Flyway registryFlyway) {
        return new FlywayMigrationInitializer(registryFlyway);
    }

    @Bean
    public MigrationService migrationService(Flyway registryFlyway) {
        return new MigrationService(REGISTRY_DATABASE, registryFlyway);
    }
}
