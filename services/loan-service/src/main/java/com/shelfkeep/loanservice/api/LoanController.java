package com.shelfkeep.loanservice.api;

import com.shelfkeep.loanservice.api.dto.BorrowRequest;
import com.shelfkeep.loanservice.api.dto.LoanResponse;
import com.shelfkeep.loanservice.config.LoanPolicyProperties;
import com.shelfkeep.loanservice.domain.error.LoanError;
import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.loanservice.domain.service.LoanOperations;
import com.shelfkeep.loanservice.infrastructure.web.LoanProblemException;
import com.shelfkeep.security.ActorContext;
import com.shelfkeep.security.Role;
import com.shelfkeep.security.RoleChecker;
import com.shelfkeep.security.TenantScope;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Borrow, return and overdue endpoints.
 *
 * <p>The due date defaults to now plus {@code shelfkeep.loans.default-loan-period} when the
 * request names none.
 */
@RestController
@RequestMapping("/api/v1/loans")
public class LoanController {

    private final LoanOperations loans;
    private final LoanPolicyProperties policy;
    private final Clock clock;

    public LoanController(LoanOperations loans, LoanPolicyProperties policy, Clock clock) {
        this.loans = loans;
        this.policy = policy;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<LoanResponse> borrow(
            ActorContext actor, @Valid @RequestBody BorrowRequest request) {
        Instant dueDate =
                request.dueDate() != null
                        ? request.dueDate()
                        : clock.instant().plus(policy.defaultLoanPeriod());
        Loan loan =
                loans.borrow(actor, request.itemId(), dueDate)
                        .orElseThrow(LoanProblemException::new);
        return ResponseEntity.created(URI.create("/api/v1/loans/" + loan.id()))
                .body(LoanResponse.from(loan, clock.instant()));
    }

    @PostMapping("/{loanId}/return")
    public LoanResponse returnLoan(ActorContext actor, @PathVariable String loanId) {
        return loans.returnLoan(actor, loanId)
                .map(loan -> LoanResponse.from(loan, clock.instant()))
                .orElseThrow(LoanProblemException::new);
    }

    /** Loans visible to the actor, newest first. */
    @GetMapping
    public List<LoanResponse> list(ActorContext actor) {
        Instant now = clock.instant();
        return loans.listLoans(actor).stream().map(l -> LoanResponse.from(l, now)).toList();
    }

    /**
     * Overdue loans of the actor's tenant. A global super-administrator sees every tenant, or
     * one tenant when {@code tenantId} is given.
     */
    @GetMapping("/overdue")
    public List<LoanResponse> overdue(
            ActorContext actor, @RequestParam(required = false) String tenantId) {
        TenantScope scope;
        if (actor.isGlobal()) {
            if (actor.role() != Role.SUPER_ADMIN) {
                throw overdueForbidden();
            }
            scope = tenantId != null ? TenantScope.of(tenantId) : TenantScope.global();
        } else {
            if (!RoleChecker.hasRole(actor, Role.TENANT_ADMIN)) {
                throw overdueForbidden();
            }
            scope = actor.scope();
        }
        Instant now = clock.instant();
        return loans.listOverdue(scope).stream().map(l -> LoanResponse.from(l, now)).toList();
    }

    @GetMapping("/mine")
    public List<LoanResponse> mine(ActorContext actor) {
        Instant now = clock.instant();
        return loans.loansForMember(actor, actor.memberId())
                .orElseThrow(LoanProblemException::new)
                .stream()
                .map(l -> LoanResponse.from(l, now))
                .toList();
    }

    private static LoanProblemException overdueForbidden() {
        return new LoanProblemException(
                LoanError.forbidden("loan", "Only administrators may list overdue loans"));
    }
}
