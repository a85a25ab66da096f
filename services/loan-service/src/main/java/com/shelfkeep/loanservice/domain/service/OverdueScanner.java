package com.shelfkeep.loanservice.domain.service;

import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.loanservice.domain.port.LoanStore;
import com.shelfkeep.security.TenantScope;
import java.time.Clock;
import java.util.List;

/** Computes overdue loans at query time. Reads only. */
public final class OverdueScanner {

    private final LoanStore loans;
    private final Clock clock;

    public OverdueScanner(LoanStore loans, Clock clock) {
        this.loans = loans;
        this.clock = clock;
    }

    /** Active loans of the scope whose due date is before now, earliest due first. */
    public List<Loan> scan(TenantScope scope) {
        return loans.findOverdue(scope, clock.instant());
    }
}
