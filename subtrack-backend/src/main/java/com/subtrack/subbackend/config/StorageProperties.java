package com.subtrack.subbackend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    /** Storage descriptor: postgres URL, keyword/value DSN or raw JDBC URL. */
    @NotBlank
    private String path;

    @Min(1)
    private int maxConnections = 10;

    @Min(1)
    private int connectAttempts = 10;

    /** Bound on each pool construction and each liveness check. */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration attemptTimeout = Duration.ofSeconds(5);

    /** Budget for one storage operation, from entry through borrowing a connection to the statement's end. */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration queryTimeout = Duration.ofSeconds(5);

    @NotBlank
    private String migrationsLocation = "classpath:db/migration";
}
