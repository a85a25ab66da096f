package com.shelfkeep.loanservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Lending rules, bound from {@code shelfkeep.loans.*}.
 *
 * <pre>
 * shelfkeep:
 *   loans:
 *     max-active-loans: 5
 *     default-loan-period: 14d
 *     write-retry-attempts: 3
 * </pre>
 *
 * @param maxActiveLoans simultaneous active loans allowed per member (default 5)
 * @param defaultLoanPeriod due date offset applied when a borrow request names none (default 14
 *     days)
 * @param writeRetryAttempts attempts per unit of work on transient write conflicts (default 3)
 */
@ConfigurationProperties(prefix = "shelfkeep.loans")
@Validated
public record LoanPolicyProperties(
        int maxActiveLoans, Duration defaultLoanPeriod, int writeRetryAttempts) {

    public static final int DEFAULT_MAX_ACTIVE_LOANS = 5;
    public static final Duration DEFAULT_LOAN_PERIOD = Duration.ofDays(14);
    public static final int DEFAULT_WRITE_RETRY_ATTEMPTS = 3;

    /** Applies defaults for unset values. Runs before Bean Validation. */
    public LoanPolicyProperties {
        if (maxActiveLoans <= 0) {
            maxActiveLoans = DEFAULT_MAX_ACTIVE_LOANS;
        }
        if (defaultLoanPeriod == null) {
            defaultLoanPeriod = DEFAULT_LOAN_PERIOD;
        }
        if (defaultLoanPeriod.isNegative() || defaultLoanPeriod.isZero()) {
            throw new IllegalArgumentException(
                    "shelfkeep.loans.default-loan-period must be positive: " + defaultLoanPeriod);
        }
        if (writeRetryAttempts <= 0) {
            writeRetryAttempts = DEFAULT_WRITE_RETRY_ATTEMPTS;
        }
    }
}
