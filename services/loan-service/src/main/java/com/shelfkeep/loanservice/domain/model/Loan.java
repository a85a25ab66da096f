package com.shelfkeep.loanservice.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One borrowing transaction: a single copy of one item held by one member.
 *
 * <p>Created active by a successful borrow and mutated exactly once, by a successful return. The
 * record never goes back to active and is never deleted.
 *
 * @param id loan identifier
 * @param itemId borrowed item
 * @param memberId borrowing member
 * @param tenantId tenant shared by the item and the member at creation time
 * @param borrowedAt when the copy left the shelf
 * @param dueDate when the copy is due back
 * @param returnedAt when the copy came back; set if and only if the loan is returned
 * @param status lifecycle state
 */
public record Loan(
        String id,
        String itemId,
        String memberId,
        String tenantId,
        Instant borrowedAt,
        Instant dueDate,
        Instant returnedAt,
        LoanStatus status) {

    public Loan {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(memberId, "memberId");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(borrowedAt, "borrowedAt");
        Objects.requireNonNull(dueDate, "dueDate");
        Objects.requireNonNull(status, "status");
        if ((status == LoanStatus.RETURNED) != (returnedAt != null)) {
            throw new IllegalArgumentException(
                    "returnedAt must be set exactly when the loan is returned (status=" + status + ")");
        }
    }

    /** A new active loan. */
    public static Loan open(
            String id,
            String itemId,
            String memberId,
            String tenantId,
            Instant borrowedAt,
            Instant dueDate) {
        return new Loan(id, itemId, memberId, tenantId, borrowedAt, dueDate, null, LoanStatus.ACTIVE);
    }

    /**
     * Returns the returned form of this loan.
     *
     * @throws IllegalStateException if the loan is already returned
     */
    public Loan markReturned(Instant at) {
        if (!isActive()) {
            throw new IllegalStateException("Loan " + id + " is already returned");
        }
        return new Loan(id, itemId, memberId, tenantId, borrowedAt, dueDate, at, LoanStatus.RETURNED);
    }

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    /** Active and due strictly before {@code now}. Never stored. */
    public boolean isOverdue(Instant now) {
        return isActive() && dueDate.isBefore(now);
    }
}
