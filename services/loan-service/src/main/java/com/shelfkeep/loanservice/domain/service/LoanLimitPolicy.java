package com.shelfkeep.loanservice.domain.service;

/** Maximum number of simultaneously active loans per member. */
public final class LoanLimitPolicy {

    public static final int DEFAULT_MAX_ACTIVE_LOANS = 5;

    private final int maxActiveLoans;

    public LoanLimitPolicy(int maxActiveLoans) {
        if (maxActiveLoans < 1) {
            throw new IllegalArgumentException("maxActiveLoans must be positive: " + maxActiveLoans);
        }
        this.maxActiveLoans = maxActiveLoans;
    }

    /** Whether a member currently holding {@code activeLoans} loans may take one more. */
    public boolean permitsAnother(int activeLoans) {
        return activeLoans < maxActiveLoans;
    }

    public int maxActiveLoans() {
        return maxActiveLoans;
    }
}
