package com.shelfkeep.loanservice.config;

import com.shelfkeep.loanservice.domain.port.InventoryLedger;
import com.shelfkeep.loanservice.domain.port.LoanStore;
import com.shelfkeep.loanservice.domain.port.MemberDirectory;
import com.shelfkeep.loanservice.domain.port.UnitOfWork;
import com.shelfkeep.loanservice.domain.service.LoanLimitPolicy;
import com.shelfkeep.loanservice.domain.service.LoanOperations;
import com.shelfkeep.loanservice.domain.service.LoanTransactionService;
import com.shelfkeep.loanservice.domain.service.OverdueScanner;
import com.shelfkeep.loanservice.infrastructure.observability.ObservedLoanOperations;
import com.shelfkeep.observability.MetricFactory;
import com.shelfkeep.observability.SpanHelper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free borrowing engine. The store ports are the JDBC adapters found by
 * component scanning.
 */
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LoanLimitPolicy loanLimitPolicy(LoanPolicyProperties policy) {
        return new LoanLimitPolicy(policy.maxActiveLoans());
    }

    @Bean
    public OverdueScanner overdueScanner(LoanStore loanStore, Clock clock) {
        return new OverdueScanner(loanStore, clock);
    }

    @Bean
    public LoanOperations loanOperations(
            InventoryLedger inventoryLedger,
            LoanStore loanStore,
            MemberDirectory memberDirectory,
            UnitOfWork unitOfWork,
            LoanLimitPolicy loanLimitPolicy,
            OverdueScanner overdueScanner,
            Clock clock,
            MetricFactory metricFactory,
            SpanHelper spanHelper) {
        var engine =
                new LoanTransactionService(
                        inventoryLedger,
                        loanStore,
                        memberDirectory,
                        unitOfWork,
                        loanLimitPolicy,
                        overdueScanner,
                        clock);
        return new ObservedLoanOperations(engine, metricFactory, spanHelper);
    }
}
