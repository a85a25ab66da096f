package com.shelfkeep.loanservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code shelfkeep.service.*} and validated at startup.
 *
 * <pre>
 * shelfkeep:
 *   service:
 *     name: loan-service
 *     environment: production
 *     description: Borrowing transaction engine
 * </pre>
 *
 * @param name service name used for logging, metrics and tracing. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description for {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "shelfkeep.service")
@Validated
public record LoanServiceProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public LoanServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
