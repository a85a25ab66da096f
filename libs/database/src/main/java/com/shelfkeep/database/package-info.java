/**
 * Database schema management for the Shelfkeep lending registry.
 *
 * <p>Flyway owns the schema: versioned scripts under {@code db/migration/registry} create the
 * tenant, member, item and loan tables together with the constraints that back the inventory
 * and loan-state invariants. Development seed data lives under {@code db/seed/development} and is
 * only added to the Flyway locations by the {@code dev} profile.
 *
 * <ul>
 *   <li>{@code V{n}__{desc}.sql}: schema migrations
 *   <li>{@code V1000+} in the seed location: sample tenants, members and catalog
 * </ul>
 *
 * @see com.shelfkeep.database.migration.RegistryFlywayConfig
 * @see com.shelfkeep.database.migration.RegistryFlywayProperties
 */
package com.shelfkeep.database;
