package com.subtrack.subbackend.config;

import com.subtrack.subbackend.database.BackoffPolicy;
import com.subtrack.subbackend.database.ConnectionManager;
import com.subtrack.subbackend.database.ConnectionPool;
import com.subtrack.subbackend.database.HikariPoolFactory;
import com.subtrack.subbackend.database.MigrationOutcome;
import com.subtrack.subbackend.database.MigrationRunner;
import com.subtrack.subbackend.database.PoolFactory;
import com.subtrack.subbackend.database.Sleeper;
import com.subtrack.subbackend.error.MigrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

// Bootstrap order: acquire pool -> apply migrations -> repository goes into service.
@Slf4j
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StoreConfig {

    @Bean
    public PoolFactory poolFactory(StorageProperties props) {
        // a borrow counts against both the liveness check and the request budget
        Duration borrowTimeout = props.getAttemptTimeout().compareTo(props.getQueryTimeout()) <= 0
                ? props.getAttemptTimeout()
                : props.getQueryTimeout();
        return new HikariPoolFactory(borrowTimeout);
    }

    @Bean
    public ConnectionManager connectionManager(PoolFactory poolFactory, StorageProperties props) {
        return new ConnectionManager(poolFactory, BackoffPolicy.linear(), Sleeper.THREAD,
                props.getConnectAttempts(), props.getAttemptTimeout());
    }

    @Bean
    public MigrationRunner migrationRunner() {
        return new MigrationRunner();
    }

    // Released through connectionPoolRelease, not by Spring's inferred close().
    @Bean(destroyMethod = "")
    public ConnectionPool connectionPool(ConnectionManager connectionManager,
                                         MigrationRunner migrationRunner,
                                         StorageProperties props) {
        // the descriptor may carry a password, so it is not logged here
        log.info("Storage config loaded: max {} connections, {} attempts, migrations from {}",
                props.getMaxConnections(), props.getConnectAttempts(), props.getMigrationsLocation());
        ConnectionPool pool = connectionManager.acquire(props.getPath(), props.getMaxConnections());
        try {
            MigrationOutcome outcome = migrationRunner.applyMigrations(props.getPath(), props.getMigrationsLocation());
            log.info("Migrations finished: {}", outcome.result());
        } catch (MigrationException e) {
            connectionManager.release(pool);
            throw e;
        }
        return pool;
    }

    @Bean
    public DisposableBean connectionPoolRelease(ConnectionManager connectionManager, ConnectionPool connectionPool) {
        return () -> {
            log.info("Shutting down storage...");
            connectionManager.release(connectionPool);
        };
    }
}
