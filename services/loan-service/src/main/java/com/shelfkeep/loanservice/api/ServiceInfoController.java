package com.shelfkeep.loanservice.api;

import com.shelfkeep.database.migration.MigrationService;
import com.shelfkeep.loanservice.config.LoanPolicyProperties;
import com.shelfkeep.loanservice.config.LoanServiceProperties;
import java.time.Clock;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service info endpoint: identity, lending rules and the applied schema version.
 *
 * <p>Actuator provides {@code /actuator/info} for build metadata; this endpoint adds runtime
 * information.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final LoanServiceProperties properties;
    private final LoanPolicyProperties policy;
    private final ObjectProvider<MigrationService> migrations;
    private final Clock clock;

    public ServiceInfoController(
            LoanServiceProperties properties,
            LoanPolicyProperties policy,
            ObjectProvider<MigrationService> migrations,
            Clock clock) {
        this.properties = properties;
        this.policy = policy;
        this.migrations = migrations;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        MigrationService migrationService = migrations.getIfAvailable();
        String schemaVersion = null;
        if (migrationService != null) {
            schemaVersion = migrationService.status().currentVersion();
        }
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description(),
                "status", "running",
                "schemaVersion", schemaVersion != null ? schemaVersion : "none",
                "loanPolicy",
                        Map.of(
                                "maxActiveLoans", policy.maxActiveLoans(),
                                "defaultLoanPeriodDays", policy.defaultLoanPeriod().toDays()),
                "timestamp", clock.instant().toString());
    }
}
