package com.shelfkeep.database.migration;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Reports the migration state of the registry database.
 *
 * <p>Plain class; the Spring wiring lives in {@link RegistryFlywayConfig}.
 */
public class MigrationService {

    /**
     * Overall status of a database's migrations.
     *
     * @param database logical database name (e.g., "registry")
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no migrations applied)
     */
    public record DatabaseStatus(
            String database, int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final String database;
    private final Flyway flyway;

    public MigrationService(String database, Flyway flyway) {
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database must not be null or blank");
        }
        if (flyway == null) {
            throw new IllegalArgumentException("flyway must not be null");
        }
        this.database = database;
        this.flyway = flyway;
    }

    /**
     * Queries Flyway's schema history for the current status. Each call reads the database.
     */
    public DatabaseStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return new DatabaseStatus(
                database,
                info.applied().length,
                info.pending().length,
                current != null && current.getVersion() != null
                        ? current.getVersion().getVersion()
                        : null);
    }
}
