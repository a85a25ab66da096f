package com.shelfkeep.loanservice.infrastructure.observability;

import com.shelfkeep.loanservice.domain.error.LoanResult;
import com.shelfkeep.loanservice.domain.model.InventoryItem;
import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.loanservice.domain.service.LoanOperations;
import com.shelfkeep.observability.MetricFactory;
import com.shelfkeep.observability.SpanHelper;
import com.shelfkeep.security.ActorContext;
import com.shelfkeep.security.TenantScope;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates {@link LoanOperations} with spans, timers and outcome counters.
 *
 * <p>Meters:
 *
 * <ul>
 *   <li>{@code shelfkeep.loans.borrowed} / {@code shelfkeep.loans.returned}: successful writes
 *   <li>{@code shelfkeep.loans.rejected}: failed operations, tagged with {@code operation} and
 *       {@code code}
 *   <li>{@code shelfkeep.loans.operation}: latency per {@code operation}
 * </ul>
 */
public class ObservedLoanOperations implements LoanOperations {

    private static final Logger log = LoggerFactory.getLogger(ObservedLoanOperations.class);

    public static final String BORROWED = "shelfkeep.loans.borrowed";
    public static final String RETURNED = "shelfkeep.loans.returned";
    public static final String REJECTED = "shelfkeep.loans.rejected";
    public static final String OPERATION_TIMER = "shelfkeep.loans.operation";

    private final LoanOperations delegate;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public ObservedLoanOperations(LoanOperations delegate, MetricFactory metrics, SpanHelper spans) {
        this.delegate = delegate;
        this.metrics = metrics;
        this.spans = spans;
    }

    @Override
    public LoanResult<Loan> borrow(ActorContext actor, String itemId, Instant dueDate) {
        LoanResult<Loan> result =
                spans.inSpan(
                        "loan.borrow",
                        Map.of("item.id", itemId),
                        () -> timed("borrow", () -> delegate.borrow(actor, itemId, dueDate)));
        if (result.isOk()) {
            metrics.counter(BORROWED, "Loans opened").increment();
        }
        return countRejection("borrow", result);
    }

    @Override
    public LoanResult<Loan> returnLoan(ActorContext actor, String loanId) {
        LoanResult<Loan> result =
                spans.inSpan(
                        "loan.return",
                        Map.of("loan.id", loanId),
                        () -> timed("return", () -> delegate.returnLoan(actor, loanId)));
        if (result.isOk()) {
            metrics.counter(RETURNED, "Loans returned").increment();
        }
        return countRejection("return", result);
    }

    @Override
    public List<Loan> listOverdue(TenantScope scope) {
        return timed("list_overdue", () -> delegate.listOverdue(scope));
    }

    @Override
    public List<Loan> listLoans(ActorContext actor) {
        return timed("list_loans", () -> delegate.listLoans(actor));
    }

    @Override
    public LoanResult<Integer> activeLoanCount(ActorContext actor, String memberId) {
        return countRejection(
                "active_loan_count",
                timed("active_loan_count", () -> delegate.activeLoanCount(actor, memberId)));
    }

    @Override
    public LoanResult<List<Loan>> loansForMember(ActorContext actor, String memberId) {
        return countRejection(
                "loans_for_member",
                timed("loans_for_member", () -> delegate.loansForMember(actor, memberId)));
    }

    @Override
    public LoanResult<InventoryItem> itemAvailability(ActorContext actor, String itemId) {
        return countRejection(
                "item_availability",
                timed("item_availability", () -> delegate.itemAvailability(actor, itemId)));
    }

    @Override
    public LoanResult<InventoryItem> resizeInventory(
            ActorContext actor, String itemId, int newTotalCopies) {
        LoanResult<InventoryItem> result =
                spans.inSpan(
                        "inventory.resize",
                        Map.of("item.id", itemId),
                        () ->
                                timed(
                                        "resize_inventory",
                                        () -> delegate.resizeInventory(actor, itemId, newTotalCopies)));
        return countRejection("resize_inventory", result);
    }

    private <T> T timed(String operation, Supplier<T> work) {
        return metrics.timer(OPERATION_TIMER, "Loan operation latency", "operation", operation)
                .record(work);
    }

    private <T> LoanResult<T> countRejection(String operation, LoanResult<T> result) {
        if (!result.isOk()) {
            var error = result.error();
            log.debug("{} rejected: {} {}", operation, error.code(), error.message());
            metrics.counter(
                            REJECTED,
                            "Loan operations rejected",
                            "operation",
                            operation,
                            "code",
                            error.code().name())
                    .increment();
        }
        return result;
    }
}
