package com.shelfkeep.loanservice.api;

import com.shelfkeep.loanservice.api.dto.ActiveLoanCountResponse;
import com.shelfkeep.loanservice.api.dto.LoanResponse;
import com.shelfkeep.loanservice.domain.service.LoanLimitPolicy;
import com.shelfkeep.loanservice.domain.service.LoanOperations;
import com.shelfkeep.loanservice.infrastructure.web.LoanProblemException;
import com.shelfkeep.security.ActorContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Loan views of one roster member. */
@RestController
@RequestMapping("/api/v1/members/{memberId}")
public class MemberLoanController {

    private final LoanOperations loans;
    private final LoanLimitPolicy limitPolicy;
    private final Clock clock;

    public MemberLoanController(LoanOperations loans, LoanLimitPolicy limitPolicy, Clock clock) {
        this.loans = loans;
        this.limitPolicy = limitPolicy;
        this.clock = clock;
    }

    @GetMapping("/loans")
    public List<LoanResponse> loans(ActorContext actor, @PathVariable String memberId) {
        Instant now = clock.instant();
        return loans.loansForMember(actor, memberId)
                .orElseThrow(LoanProblemException::new)
                .stream()
                .map(l -> LoanResponse.from(l, now))
                .toList();
    }

    @GetMapping("/active-loans")
    public ActiveLoanCountResponse activeLoans(ActorContext actor, @PathVariable String memberId) {
        return loans.activeLoanCount(actor, memberId)
                .map(active -> new ActiveLoanCountResponse(
                        memberId, active, limitPolicy.maxActiveLoans()))
                .orElseThrow(LoanProblemException::new);
    }
}
