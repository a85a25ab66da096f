package com.shelfkeep.loanservice.domain.service;

import com.shelfkeep.loanservice.domain.error.ErrorCode;
import com.shelfkeep.loanservice.domain.error.LoanError;
import com.shelfkeep.loanservice.domain.error.LoanResult;
import com.shelfkeep.loanservice.domain.model.InventoryItem;
import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.loanservice.domain.model.Member;
import com.shelfkeep.loanservice.domain.port.InventoryLedger;
import com.shelfkeep.loanservice.domain.port.LoanStore;
import com.shelfkeep.loanservice.domain.port.MemberDirectory;
import com.shelfkeep.loanservice.domain.port.UnitOfWork;
import com.shelfkeep.security.ActorContext;
import com.shelfkeep.security.Role;
import com.shelfkeep.security.RoleChecker;
import com.shelfkeep.security.TenantAccess;
import com.shelfkeep.security.TenantIsolationGuard;
import com.shelfkeep.security.TenantScope;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Borrowing transaction engine.
 *
 * <p>Borrow and return each run as one {@link UnitOfWork}. Availability is decided by the
 * ledger's conditional decrement, never by a prior read, and the loan limit is counted after the
 * member's roster row is locked, so neither check can be raced by a concurrent request. Any
 * failure after the decrement rolls the whole unit back.
 *
 * <p>Framework-free; wired by {@code CoreConfig}.
 */
public class LoanTransactionService implements LoanOperations {

    private static final Logger log = LoggerFactory.getLogger(LoanTransactionService.class);

    static final String ITEM = "item";
    static final String LOAN = "loan";
    static final String MEMBER = "member";

    private final InventoryLedger ledger;
    private final LoanStore loans;
    private final MemberDirectory members;
    private final UnitOfWork unitOfWork;
    private final LoanLimitPolicy limitPolicy;
    private final OverdueScanner overdueScanner;
    private final Clock clock;

    public LoanTransactionService(
            InventoryLedger ledger,
            LoanStore loans,
            MemberDirectory members,
            UnitOfWork unitOfWork,
            LoanLimitPolicy limitPolicy,
            OverdueScanner overdueScanner,
            Clock clock) {
        this.ledger = ledger;
        this.loans = loans;
        this.members = members;
        this.unitOfWork = unitOfWork;
        this.limitPolicy = limitPolicy;
        this.overdueScanner = overdueScanner;
        this.clock = clock;
    }

    @Override
    public LoanResult<Loan> borrow(ActorContext actor, String itemId, Instant dueDate) {
        if (TenantIsolationGuard.creationTenant(actor).isEmpty()) {
            if (actor.role() == Role.SUPER_ADMIN) {
                return LoanResult.fail(
                        LoanError.of(
                                ErrorCode.TENANT_ASSOCIATION_REQUIRED,
                                "tenant",
                                "Borrowing requires an actor associated with exactly one tenant"));
            }
            return LoanResult.fail(LoanError.notFound(ITEM, itemId));
        }
        if (dueDate == null || !dueDate.isAfter(now())) {
            return LoanResult.fail(
                    LoanError.of(
                            ErrorCode.INVALID_DUE_DATE, "dueDate", "dueDate must be in the future"));
        }
        Instant due = dueDate.truncatedTo(ChronoUnit.MICROS);

        return unitOfWork.execute("borrow", () -> borrowInUnit(actor, itemId, due));
    }

    private LoanResult<Loan> borrowInUnit(ActorContext actor, String itemId, Instant dueDate) {
        Optional<Member> member =
                members.lockForBorrowing(actor.memberId())
                        .filter(m -> actor.tenantId().equals(m.tenantId()));
        if (member.isEmpty()) {
            return LoanResult.fail(LoanError.notFound(MEMBER, actor.memberId()));
        }

        Optional<InventoryItem> item = visibleItem(actor, itemId);
        if (item.isEmpty()) {
            return LoanResult.fail(LoanError.notFound(ITEM, itemId));
        }

        if (!ledger.takeCopy(itemId)) {
            return LoanResult.fail(
                    LoanError.of(
                            ErrorCode.NO_COPIES_AVAILABLE,
                            ITEM,
                            "No copies of item " + itemId + " are available"));
        }

        int active = loans.countActive(actor.memberId());
        if (!limitPolicy.permitsAnother(active)) {
            return LoanResult.fail(
                    LoanError.of(
                            ErrorCode.LOAN_LIMIT_REACHED,
                            MEMBER,
                            "Member already holds "
                                    + active
                                    + " active loans (limit "
                                    + limitPolicy.maxActiveLoans()
                                    + ")"));
        }

        Loan loan =
                Loan.open(
                        UUID.randomUUID().toString(),
                        itemId,
                        actor.memberId(),
                        item.get().tenantId(),
                        now(),
                        dueDate);
        loans.insert(loan);
        log.info(
                "Loan {} opened: item={} member={} due={}",
                loan.id(),
                itemId,
                loan.memberId(),
                dueDate);
        return LoanResult.ok(loan);
    }

    @Override
    public LoanResult<Loan> returnLoan(ActorContext actor, String loanId) {
        return unitOfWork.execute("return", () -> returnInUnit(actor, loanId));
    }

    private LoanResult<Loan> returnInUnit(ActorContext actor, String loanId) {
        Optional<Loan> found =
                loans.findById(loanId).filter(l -> isAllowed(actor, l.tenantId()));
        if (found.isEmpty()) {
            return LoanResult.fail(LoanError.notFound(LOAN, loanId));
        }
        Loan loan = found.get();

        boolean owner = loan.memberId().equals(actor.memberId());
        if (!owner && !RoleChecker.hasRole(actor, Role.TENANT_ADMIN)) {
            return LoanResult.fail(
                    LoanError.forbidden(
                            LOAN, "Only the borrower or an administrator may return loan " + loanId));
        }
        if (!loan.isActive()) {
            return alreadyReturned(loanId);
        }

        Instant returnedAt = now();
        if (!loans.markReturned(loanId, returnedAt)) {
            // a concurrent return won
            return alreadyReturned(loanId);
        }
        if (!ledger.releaseCopy(loan.itemId())) {
            log.error(
                    "Inventory overflow returning loan {}: item {} already has all copies on the shelf",
                    loanId,
                    loan.itemId());
            return LoanResult.fail(
                    LoanError.of(
                            ErrorCode.INVENTORY_OVERFLOW,
                            ITEM,
                            "availableCopies of item " + loan.itemId() + " would exceed totalCopies"));
        }
        log.info("Loan {} returned: item={} by={}", loanId, loan.itemId(), actor.memberId());
        return LoanResult.ok(loan.markReturned(returnedAt));
    }

    @Override
    public List<Loan> listOverdue(TenantScope scope) {
        return overdueScanner.scan(scope);
    }

    @Override
    public List<Loan> listLoans(ActorContext actor) {
        if (seesWholeScope(actor)) {
            return loans.findByScope(actor.scope());
        }
        return loans.findByMember(actor.memberId());
    }

    /** Tenant administrators see their tenant; only a super-administrator may be global. */
    private static boolean seesWholeScope(ActorContext actor) {
        if (actor.isGlobal()) {
            return actor.role() == Role.SUPER_ADMIN;
        }
        return RoleChecker.hasRole(actor, Role.TENANT_ADMIN);
    }

    @Override
    public LoanResult<Integer> activeLoanCount(ActorContext actor, String memberId) {
        if (visibleMember(actor, memberId).isEmpty()) {
            return LoanResult.fail(LoanError.notFound(MEMBER, memberId));
        }
        return LoanResult.ok(loans.countActive(memberId));
    }

    @Override
    public LoanResult<List<Loan>> loansForMember(ActorContext actor, String memberId) {
        if (visibleMember(actor, memberId).isEmpty()) {
            return LoanResult.fail(LoanError.notFound(MEMBER, memberId));
        }
        if (!memberId.equals(actor.memberId()) && !RoleChecker.hasRole(actor, Role.TENANT_ADMIN)) {
            return LoanResult.fail(
                    LoanError.forbidden(MEMBER, "Only administrators may list another member's loans"));
        }
        return LoanResult.ok(loans.findByMember(memberId));
    }

    @Override
    public LoanResult<InventoryItem> itemAvailability(ActorContext actor, String itemId) {
        return visibleItem(actor, itemId)
                .map(LoanResult::ok)
                .orElseGet(() -> LoanResult.fail(LoanError.notFound(ITEM, itemId)));
    }

    @Override
    public LoanResult<InventoryItem> resizeInventory(
            ActorContext actor, String itemId, int newTotalCopies) {
        if (newTotalCopies < 1) {
            return LoanResult.fail(
                    LoanError.of(
                            ErrorCode.INVALID_TOTAL_COPIES,
                            "totalCopies",
                            "totalCopies must be at least 1"));
        }
        return unitOfWork.execute("resize", () -> resizeInUnit(actor, itemId, newTotalCopies));
    }

    private LoanResult<InventoryItem> resizeInUnit(
            ActorContext actor, String itemId, int newTotalCopies) {
        if (visibleItem(actor, itemId).isEmpty()) {
            return LoanResult.fail(LoanError.notFound(ITEM, itemId));
        }
        if (!RoleChecker.hasRole(actor, Role.TENANT_ADMIN)) {
            return LoanResult.fail(
                    LoanError.forbidden(ITEM, "Only administrators may change the copy count"));
        }
        if (!ledger.resize(itemId, newTotalCopies)) {
            return LoanResult.fail(
                    LoanError.of(
                            ErrorCode.COPIES_ON_LOAN_EXCEED_TOTAL,
                            "totalCopies",
                            "More copies of item " + itemId + " are on loan than " + newTotalCopies));
        }
        InventoryItem resized =
                ledger.find(itemId)
                        .orElseThrow(() -> new IllegalStateException("Item " + itemId + " vanished"));
        log.info(
                "Item {} resized to {} copies ({} available)",
                itemId,
                resized.totalCopies(),
                resized.availableCopies());
        return LoanResult.ok(resized);
    }

    private Optional<InventoryItem> visibleItem(ActorContext actor, String itemId) {
        return ledger.find(itemId).filter(i -> isAllowed(actor, i.tenantId()));
    }

    private Optional<Member> visibleMember(ActorContext actor, String memberId) {
        return members.find(memberId).filter(m -> isAllowed(actor, m.tenantId()));
    }

    private static boolean isAllowed(ActorContext actor, String recordTenantId) {
        return TenantIsolationGuard.check(actor, recordTenantId) == TenantAccess.ALLOW;
    }

    private static LoanResult<Loan> alreadyReturned(String loanId) {
        return LoanResult.fail(
                LoanError.of(
                        ErrorCode.ALREADY_RETURNED, LOAN, "Loan " + loanId + " is already returned"));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
