package com.subtrack.subbackend.database;

import com.subtrack.subbackend.error.MigrationException;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;

/**
 * Brings the schema up to the newest versioned script before the store serves traffic.
 * Runs on its own short-lived connection, not on the request pool.
 */
@Slf4j
public class MigrationRunner {

    public MigrationOutcome applyMigrations(String descriptor, String scriptsLocation) {
        ConnectionDescriptor parsed = ConnectionDescriptor.parse(descriptor);

        Flyway flyway = Flyway.configure()
                .dataSource(parsed.jdbcUrl(), parsed.username(), parsed.password())
                .locations(scriptsLocation)
                .failOnMissingLocations(true)
                .load();

        MigrateResult result;
        try {
            result = flyway.migrate();
        } catch (FlywayException e) {
            log.error("❌ Schema migration failed ({}): {}", scriptsLocation, e.getMessage());
            throw new MigrationException("Schema migration failed: " + e.getMessage(), e);
        }

        if (result.migrationsExecuted == 0) {
            log.info("Schema up to date at version {}", result.targetSchemaVersion);
            return MigrationOutcome.noChangeNeeded(result.targetSchemaVersion);
        }
        log.info("📦 Applied {} migration(s), schema now at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return MigrationOutcome.applied(result.migrationsExecuted, result.targetSchemaVersion);
    }
}
