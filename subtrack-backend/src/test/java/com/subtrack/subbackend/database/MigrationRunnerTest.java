package com.subtrack.subbackend.database;

import com.subtrack.subbackend.error.ConfigurationException;
import com.subtrack.subbackend.error.MigrationException;
import com.subtrack.subbackend.util.TestDatabase;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationRunnerTest {

    private final MigrationRunner runner = new MigrationRunner();

    @Test
    void appliesAllScriptsOnEmptyDatabase() throws Exception {
        String descriptor = TestDatabase.newDescriptor();

        MigrationOutcome outcome = runner.applyMigrations(descriptor, "classpath:db/migration");

        assertThat(outcome.result()).isEqualTo(MigrationOutcome.Result.APPLIED);
        assertThat(outcome.scriptsApplied()).isEqualTo(2);

        try (Connection conn = DriverManager.getConnection(descriptor);
             ResultSet rs = conn.getMetaData().getTables(null, null, "SUBSCRIPTIONS", null)) {
            assertThat(rs.next()).isTrue();
        }
    }

    @Test
    void secondRunIsNoChangeNeeded() {
        String descriptor = TestDatabase.newDescriptor();
        runner.applyMigrations(descriptor, "classpath:db/migration");

        MigrationOutcome again = runner.applyMigrations(descriptor, "classpath:db/migration");

        assertThat(again.result()).isEqualTo(MigrationOutcome.Result.NO_CHANGE_NEEDED);
        assertThat(again.scriptsApplied()).isZero();
    }

    @Test
    void failingScriptAbortsTheRun() {
        String descriptor = TestDatabase.newDescriptor();

        assertThatThrownBy(() -> runner.applyMigrations(descriptor, "classpath:db/broken"))
                .isInstanceOf(MigrationException.class);
    }

    @Test
    void missingLocationIsAnError() {
        assertThatThrownBy(() -> runner.applyMigrations(TestDatabase.newDescriptor(), "classpath:db/nowhere"))
                .isInstanceOf(MigrationException.class);
    }

    @Test
    void malformedDescriptorIsAConfigurationError() {
        assertThatThrownBy(() -> runner.applyMigrations("nonsense", "classpath:db/migration"))
                .isInstanceOf(ConfigurationException.class);
    }
}
