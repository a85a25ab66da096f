package com.shelfkeep.loanservice.domain.port;

import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.security.TenantScope;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Persistent loans. Loans are inserted once, returned once and never deleted. */
public interface LoanStore {

    Optional<Loan> findById(String loanId);

    /** Stores a newly opened loan; only active loans are inserted. */
    void insert(Loan loan);

    /**
     * Marks an active loan returned.
     *
     * @return {@code false} when the loan was no longer active
     */
    boolean markReturned(String loanId, Instant returnedAt);

    int countActive(String memberId);

    /** Active loans due before {@code now}, ordered by due date then id. */
    List<Loan> findOverdue(TenantScope scope, Instant now);

    /** Every loan of the member, newest first. */
    List<Loan> findByMember(String memberId);

    /** Every loan within the scope, newest first. */
    List<Loan> findByScope(TenantScope scope);
}
