package com.shelfkeep.database.migration;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the registry database.
 *
 * <p>Bound from {@code application.yml} and validated at startup, so a missing migration location
 * fails the boot rather than the first query.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * shelfkeep:
 *   flyway:
 *     enabled: true
 *     locations:
 *       - classpath:db/migration/registry
 *       - classpath:db/seed/development   # dev profile only
 * }</pre>
 *
 * @param enabled whether to migrate the service DataSource on startup
 * @param locations Flyway script locations, schema first
 * @param baselineOnMigrate whether to baseline a non-empty schema that has no history table
 */
@Validated
@ConfigurationProperties(prefix = "shelfkeep.flyway")
public record RegistryFlywayProperties(
        boolean enabled, @NotEmpty List<String> locations, boolean baselineOnMigrate) {

    /** Default location of the registry schema scripts. */
    public static final String SCHEMA_LOCATION = "classpath:db/migration/registry";

    /** Defaults the locations to the schema scripts only. */
    public RegistryFlywayProperties {
        if (locations == null || locations.isEmpty()) {
            locations = List.of(SCHEMA_LOCATION);
        } else {
            locations = List.copyOf(locations);
        }
    }
}
