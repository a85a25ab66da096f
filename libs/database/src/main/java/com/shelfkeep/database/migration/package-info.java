/**
 * Flyway migration configuration and status reporting.
 *
 * <ul>
 *   <li>{@link com.shelfkeep.database.migration.RegistryFlywayProperties}: externalized
 *       configuration ({@code shelfkeep.flyway.*})
 *   <li>{@link com.shelfkeep.database.migration.RegistryFlywayConfig}: Spring
 *       {@code @Configuration} that migrates the service's DataSource on startup
 *   <li>{@link com.shelfkeep.database.migration.MigrationService}: schema version and
 *       applied/pending counts
 * </ul>
 */
package com.shelfkeep.database.migration;
