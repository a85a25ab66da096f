package com.shelfkeep.loanservice.api.dto;

import com.shelfkeep.loanservice.domain.model.Loan;
import java.time.Instant;

/** A loan as returned by the API; {@code overdue} is computed at response time. */
public record LoanResponse(
        String id,
        String itemId,
        String memberId,
        String tenantId,
        Instant borrowedAt,
        Instant dueDate,
        Instant returnedAt,
        String status,
        boolean overdue) {

    public static LoanResponse from(Loan loan, Instant now) {
        return new LoanResponse(
                loan.id(),
                loan.itemId(),
                loan.memberId(),
                loan.tenantId(),
                loan.borrowedAt(),
                loan.dueDate(),
                loan.returnedAt(),
                loan.status().value(),
                loan.isOverdue(now));
    }
}
