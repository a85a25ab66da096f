package com.shelfkeep.loanservice.domain.service;

import com.shelfkeep.loanservice.domain.error.LoanResult;
import com.shelfkeep.loanservice.domain.model.InventoryItem;
import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.security.ActorContext;
import com.shelfkeep.security.TenantScope;
import java.time.Instant;
import java.util.List;

/**
 * Entry point of the borrowing engine for every surrounding layer.
 *
 * <p>The actor is the verified identity supplied by the authorization layer. Business outcomes
 * are reported through {@link LoanResult}; records of other tenants are reported as not found.
 */
public interface LoanOperations {

    /** Lends one copy of the item to the acting member until {@code dueDate}. */
    LoanResult<Loan> borrow(ActorContext actor, String itemId, Instant dueDate);

    /** Closes an active loan and puts its copy back on the shelf. */
    LoanResult<Loan> returnLoan(ActorContext actor, String loanId);

    /** Active loans past their due date within the scope, earliest due first. */
    List<Loan> listOverdue(TenantScope scope);

    /**
     * Loans visible to the actor, newest first: every loan of the actor's tenant for an
     * administrator, every tenant for a global super-administrator, and the actor's own loans
     * for anyone else.
     */
    List<Loan> listLoans(ActorContext actor);

    LoanResult<Integer> activeLoanCount(ActorContext actor, String memberId);

    /** Every loan of one member, newest first. */
    LoanResult<List<Loan>> loansForMember(ActorContext actor, String memberId);

    LoanResult<InventoryItem> itemAvailability(ActorContext actor, String itemId);

    /** Changes an item's total copies; the number of copies on loan is preserved. */
    LoanResult<InventoryItem> resizeInventory(ActorContext actor, String itemId, int newTotalCopies);
}
