package com.subtrack.subbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// The store bootstraps its own pool and migrations (see StoreConfig).
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
public class SubtrackBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubtrackBackendApplication.class, args);
    }
}
