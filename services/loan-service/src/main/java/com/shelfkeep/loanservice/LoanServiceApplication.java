package com.shelfkeep.loanservice;

import com.shelfkeep.database.migration.RegistryFlywayConfig;
import com.shelfkeep.loanservice.config.LoanPolicyProperties;
import com.shelfkeep.loanservice.config.LoanServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Shelfkeep loan service: the borrowing transaction engine behind the lending registry.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Registry schema migrated by Flyway on startup ({@link RegistryFlywayConfig})
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation and actor-aware MDC
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@Import(RegistryFlywayConfig.class)
@EnableConfigurationProperties({LoanServiceProperties.class, LoanPolicyProperties.class})
public class LoanServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(LoanServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LoanServiceApplication.class, args);
        log.info("Shelfkeep loan service started");
    }
}
