package com.shelfkeep.loanservice.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.shelfkeep.loanservice.domain.error.ErrorCode;
import com.shelfkeep.loanservice.domain.error.ErrorKind;
import com.shelfkeep.loanservice.domain.error.LoanResult;
import com.shelfkeep.loanservice.domain.model.Availability;
import com.shelfkeep.loanservice.domain.model.Loan;
import com.shelfkeep.loanservice.domain.model.LoanStatus;
import com.shelfkeep.loanservice.domain.service.LoanOperations;
import com.shelfkeep.loanservice.support.MutableClock;
import com.shelfkeep.loanservice.support.RegistryFixtures;
import com.shelfkeep.loanservice.support.RegistryIntegrationTest;
import com.shelfkeep.loanservice.support.TestClockConfig;
import com.shelfkeep.security.ActorContext;
import com.shelfkeep.security.TenantScope;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

/** Borrowing engine against the migrated H2 registry through the JDBC adapters. */
@RegistryIntegrationTest
@DisplayName("Borrowing engine on the registry store")
class BorrowingEngineIntegrationTest {

    @Autowired private LoanOperations loans;
    @Autowired private JdbcTemplate jdbcTemplate;
    @Autowired private MutableClock clock;

    private RegistryFixtures fixtures;
    private String tenant;
    private ActorContext member;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.START);
        fixtures = new RegistryFixtures(jdbcTemplate);
        tenant = fixtures.tenant();
        member = fixtures.member(tenant);
    }

    private Instant inTwoWeeks() {
        return clock.instant().plus(Duration.ofDays(14));
    }

    private Loan borrow(ActorContext actor, String itemId) {
        LoanResult<Loan> result = loans.borrow(actor, itemId, inTwoWeeks());
        assertThat(result.isOk()).as("borrow of %s: %s", itemId, result.error()).isTrue();
        return result.value();
    }

    @Nested
    @DisplayName("Inventory")
    class Inventory {

        @Test
        @DisplayName("last copies run out, a third borrower is refused, a return frees one copy")
        void twoCopyScenario() {
            String item = fixtures.item(tenant, 2);

            Loan first = borrow(member, item);
            borrow(member, item);
            assertThat(fixtures.availableCopies(item)).isZero();
            assertThat(loans.itemAvailability(member, item).value().availability())
                    .isEqualTo(Availability.UNAVAILABLE);

            ActorContext other = fixtures.member(tenant);
            var third = loans.borrow(other, item, inTwoWeeks());
            assertThat(third.error().code()).isEqualTo(ErrorCode.NO_COPIES_AVAILABLE);
            assertThat(third.error().kind()).isEqualTo(ErrorKind.CONFLICT);

            assertThat(loans.returnLoan(member, first.id()).isOk()).isTrue();
            assertThat(fixtures.availableCopies(item)).isEqualTo(1);
            assertThat(loans.itemAvailability(member, item).value().availability())
                    .isEqualTo(Availability.AVAILABLE);
        }

        @Test
        @DisplayName("borrow then return leaves the counter unchanged")
        void borrowReturnIsCounterNeutral() {
            String item = fixtures.item(tenant, 3);

            Loan loan = borrow(member, item);
            loans.returnLoan(member, loan.id());

            assertThat(fixtures.availableCopies(item)).isEqualTo(3);
        }

        @Test
        @DisplayName("a refused borrow leaves no trace")
        void refusedBorrowHasNoEffect() {
            String item = fixtures.item(tenant, 1);
            for (int i = 0; i < 5; i++) {
                borrow(member, fixtures.item(tenant, 1));
            }

            var refused = loans.borrow(member, item, inTwoWeeks());

            assertThat(refused.error().code()).isEqualTo(ErrorCode.LOAN_LIMIT_REACHED);
            assertThat(fixtures.availableCopies(item)).isEqualTo(1);
            assertThat(fixtures.activeLoans(member.memberId())).isEqualTo(5);
        }

        @Test
        @DisplayName("a return that would overflow the counter fails and rolls back")
        void overflowIsReportedAndRolledBack() {
            String item = fixtures.item(tenant, 1);
            Loan loan = borrow(member, item);
            fixtures.restock(item);

            var result = loans.returnLoan(member, loan.id());

            assertThat(result.error().code()).isEqualTo(ErrorCode.INVENTORY_OVERFLOW);
            assertThat(result.error().kind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(fixtures.activeLoans(member.memberId())).isEqualTo(1);
            assertThat(fixtures.availableCopies(item)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Loan limit")
    class LoanLimit {

        @Test
        @DisplayName("a sixth borrow is refused until one loan comes back")
        void sixthBorrowScenario() {
            List<Loan> held = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                held.add(borrow(member, fixtures.item(tenant, 1)));
            }
            String sixth = fixtures.item(tenant, 1);

            var refused = loans.borrow(member, sixth, inTwoWeeks());
            assertThat(refused.error().code()).isEqualTo(ErrorCode.LOAN_LIMIT_REACHED);
            assertThat(loans.activeLoanCount(member, member.memberId()).value()).isEqualTo(5);

            loans.returnLoan(member, held.get(0).id());

            assertThat(loans.borrow(member, sixth, inTwoWeeks()).isOk()).isTrue();
            var again = loans.borrow(member, fixtures.item(tenant, 1), inTwoWeeks());
            assertThat(again.error().code()).isEqualTo(ErrorCode.LOAN_LIMIT_REACHED);
        }
    }

    @Nested
    @DisplayName("Loan lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("a returned loan stays returned and a second return is refused")
        void secondReturnIsRefused() {
            Loan loan = borrow(member, fixtures.item(tenant, 1));
            clock.advance(Duration.ofHours(2));

            var returned = loans.returnLoan(member, loan.id());
            var again = loans.returnLoan(member, loan.id());

            assertThat(returned.value().status()).isEqualTo(LoanStatus.RETURNED);
            assertThat(returned.value().returnedAt()).isEqualTo(clock.instant());
            assertThat(again.error().code()).isEqualTo(ErrorCode.ALREADY_RETURNED);
            assertThat(loans.loansForMember(member, member.memberId()).value())
                    .singleElement()
                    .satisfies(l -> assertThat(l.status()).isEqualTo(LoanStatus.RETURNED));
        }

        @Test
        @DisplayName("an administrator may return a member's loan, another member may not")
        void returnPermissions() {
            Loan loan = borrow(member, fixtures.item(tenant, 1));

            var byPeer = loans.returnLoan(fixtures.member(tenant), loan.id());
            var byAdmin = loans.returnLoan(fixtures.admin(tenant), loan.id());

            assertThat(byPeer.error().kind()).isEqualTo(ErrorKind.FORBIDDEN);
            assertThat(byAdmin.isOk()).isTrue();
        }

        @Test
        @DisplayName("the stored loan carries the tenant and timestamps of the borrow")
        void storedLoanMatchesBorrow() {
            String item = fixtures.item(tenant, 1);
            Instant due = inTwoWeeks();

            Loan loan = loans.borrow(member, item, due).value();

            assertThat(loans.loansForMember(member, member.memberId()).value())
                    .containsExactly(loan);
            assertThat(loan.tenantId()).isEqualTo(tenant);
            assertThat(loan.borrowedAt()).isEqualTo(TestClockConfig.START);
            assertThat(loan.dueDate()).isEqualTo(due);
        }
    }

    @Nested
    @DisplayName("Overdue scan")
    class Overdue {

        @Test
        @DisplayName("an active loan past its due date is overdue until it is returned")
        void overdueUntilReturned() {
            Loan loan =
                    loans.borrow(member, fixtures.item(tenant, 1), clock.instant().plus(Duration.ofDays(1)))
                            .value();
            assertThat(loans.listOverdue(TenantScope.of(tenant))).isEmpty();

            clock.advance(Duration.ofDays(2));
            assertThat(loans.listOverdue(TenantScope.of(tenant)))
                    .extracting(Loan::id)
                    .containsExactly(loan.id());

            loans.returnLoan(member, loan.id());
            assertThat(loans.listOverdue(TenantScope.of(tenant))).isEmpty();
        }

        @Test
        @DisplayName("orders by due date and keeps other tenants out")
        void ordersAndScopes() {
            Loan later =
                    loans.borrow(member, fixtures.item(tenant, 1), clock.instant().plus(Duration.ofDays(3)))
                            .value();
            Loan sooner =
                    loans.borrow(member, fixtures.item(tenant, 1), clock.instant().plus(Duration.ofDays(1)))
                            .value();
            String otherTenant = fixtures.tenant();
            ActorContext outsider = fixtures.member(otherTenant);
            Loan foreign =
                    loans.borrow(
                                    outsider,
                                    fixtures.item(otherTenant, 1),
                                    clock.instant().plus(Duration.ofDays(1)))
                            .value();

            clock.advance(Duration.ofDays(5));

            assertThat(loans.listOverdue(TenantScope.of(tenant)))
                    .extracting(Loan::id)
                    .containsExactly(sooner.id(), later.id());
            assertThat(loans.listOverdue(TenantScope.global()))
                    .extracting(Loan::id)
                    .contains(sooner.id(), later.id(), foreign.id());
        }
    }

    @Nested
    @DisplayName("Tenant isolation")
    class TenantIsolation {

        @Test
        @DisplayName("another tenant's item reads as not found, even to its administrator")
        void crossTenantBorrowIsNotFound() {
            String otherTenant = fixtures.tenant();
            String foreignItem = fixtures.item(otherTenant, 1);

            var asMember = loans.borrow(member, foreignItem, inTwoWeeks());
            var asAdmin = loans.borrow(fixtures.admin(tenant), foreignItem, inTwoWeeks());

            assertThat(asMember.error().kind()).isEqualTo(ErrorKind.NOT_FOUND);
            assertThat(asAdmin.error().kind()).isEqualTo(ErrorKind.NOT_FOUND);
            assertThat(fixtures.availableCopies(foreignItem)).isEqualTo(1);
        }

        @Test
        @DisplayName("a global super-administrator cannot borrow without a tenant")
        void globalActorCannotBorrow() {
            var result =
                    loans.borrow(fixtures.globalSuperAdmin(), fixtures.item(tenant, 1), inTwoWeeks());

            assertThat(result.error().code()).isEqualTo(ErrorCode.TENANT_ASSOCIATION_REQUIRED);
        }

        @Test
        @DisplayName("another tenant's loan cannot be returned")
        void crossTenantReturnIsNotFound() {
            Loan loan = borrow(member, fixtures.item(tenant, 1));
            String otherTenant = fixtures.tenant();

            var result = loans.returnLoan(fixtures.admin(otherTenant), loan.id());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.NOT_FOUND);
            assertThat(fixtures.activeLoans(member.memberId())).isEqualTo(1);
        }

        @Test
        @DisplayName("a tenant administrator's loan listing stops at the tenant boundary")
        void loanListingIsTenantScoped() {
            Loan own = borrow(member, fixtures.item(tenant, 1));
            String otherTenant = fixtures.tenant();
            Loan foreign = borrow(fixtures.member(otherTenant), fixtures.item(otherTenant, 1));

            assertThat(loans.listLoans(fixtures.admin(tenant)))
                    .extracting(Loan::id)
                    .containsExactly(own.id());
            assertThat(loans.listLoans(fixtures.admin(otherTenant)))
                    .extracting(Loan::id)
                    .containsExactly(foreign.id());
        }
    }

    @Nested
    @DisplayName("Copy count edits")
    class Resize {

        @Test
        @DisplayName("growing the total adds shelf copies and keeps copies on loan")
        void growKeepsLoans() {
            String item = fixtures.item(tenant, 2);
            borrow(member, item);

            var resized = loans.resizeInventory(fixtures.admin(tenant), item, 4);

            assertThat(resized.value().totalCopies()).isEqualTo(4);
            assertThat(resized.value().availableCopies()).isEqualTo(3);
            assertThat(resized.value().copiesOnLoan()).isEqualTo(1);
        }

        @Test
        @DisplayName("shrinking below the copies on loan is refused")
        void shrinkBelowLoansIsRefused() {
            String item = fixtures.item(tenant, 3);
            borrow(member, item);
            borrow(fixtures.member(tenant), item);

            var refused = loans.resizeInventory(fixtures.admin(tenant), item, 1);
            var allowed = loans.resizeInventory(fixtures.admin(tenant), item, 2);

            assertThat(refused.error().code()).isEqualTo(ErrorCode.COPIES_ON_LOAN_EXCEED_TOTAL);
            assertThat(allowed.value().availableCopies()).isZero();
            assertThat(fixtures.totalCopies(item)).isEqualTo(2);
        }

        @Test
        @DisplayName("members may not edit the copy count")
        void memberCannotResize() {
            String item = fixtures.item(tenant, 1);

            var result = loans.resizeInventory(member, item, 5);

            assertThat(result.error().kind()).isEqualTo(ErrorKind.FORBIDDEN);
            assertThat(fixtures.totalCopies(item)).isEqualTo(1);
        }
    }
}
