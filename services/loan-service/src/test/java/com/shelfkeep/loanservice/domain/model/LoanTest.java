package com.shelfkeep.loanservice.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Loan")
class LoanTest {

    private static final Instant BORROWED = Instant.parse("2026-03-01T09:00:00Z");
    private static final Instant DUE = BORROWED.plus(Duration.ofDays(14));

    private static Loan activeLoan() {
        return Loan.open("loan-1", "item-1", "member-1", "tenant-a", BORROWED, DUE);
    }

    @Nested
    @DisplayName("open()")
    class Open {

        @Test
        @DisplayName("starts active without a return time")
        void startsActive() {
            Loan loan = activeLoan();

            assertThat(loan.status()).isEqualTo(LoanStatus.ACTIVE);
            assertThat(loan.returnedAt()).isNull();
            assertThat(loan.isActive()).isTrue();
        }

        @Test
        @DisplayName("requires a tenant")
        void requiresTenant() {
            assertThatThrownBy(() -> Loan.open("loan-1", "item-1", "member-1", null, BORROWED, DUE))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("tenantId");
        }
    }

    @Nested
    @DisplayName("markReturned()")
    class MarkReturned {

        @Test
        @DisplayName("sets status and return time together")
        void setsStatusAndReturnTime() {
            Instant at = BORROWED.plus(Duration.ofDays(3));

            Loan returned = activeLoan().markReturned(at);

            assertThat(returned.status()).isEqualTo(LoanStatus.RETURNED);
            assertThat(returned.returnedAt()).isEqualTo(at);
            assertThat(returned.id()).isEqualTo("loan-1");
            assertThat(returned.dueDate()).isEqualTo(DUE);
        }

        @Test
        @DisplayName("cannot return a loan twice")
        void cannotReturnTwice() {
            Loan returned = activeLoan().markReturned(BORROWED.plusSeconds(60));

            assertThatThrownBy(() -> returned.markReturned(BORROWED.plusSeconds(120)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already returned");
        }
    }

    @Nested
    @DisplayName("status and return time coupling")
    class Coupling {

        @Test
        @DisplayName("rejects an active loan with a return time")
        void rejectsActiveWithReturnTime() {
            assertThatThrownBy(
                            () ->
                                    new Loan(
                                            "loan-1",
                                            "item-1",
                                            "member-1",
                                            "tenant-a",
                                            BORROWED,
                                            DUE,
                                            BORROWED,
                                            LoanStatus.ACTIVE))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects a returned loan without a return time")
        void rejectsReturnedWithoutReturnTime() {
            assertThatThrownBy(
                            () ->
                                    new Loan(
                                            "loan-1",
                                            "item-1",
                                            "member-1",
                                            "tenant-a",
                                            BORROWED,
                                            DUE,
                                            null,
                                            LoanStatus.RETURNED))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("isOverdue()")
    class IsOverdue {

        @Test
        @DisplayName("is false up to and including the due instant")
        void notOverdueAtDueDate() {
            assertThat(activeLoan().isOverdue(DUE.minusSeconds(1))).isFalse();
            assertThat(activeLoan().isOverdue(DUE)).isFalse();
        }

        @Test
        @DisplayName("is true after the due date while active")
        void overdueAfterDueDate() {
            assertThat(activeLoan().isOverdue(DUE.plusSeconds(1))).isTrue();
        }

        @Test
        @DisplayName("is never true once returned")
        void returnedIsNeverOverdue() {
            Loan returned = activeLoan().markReturned(DUE.plus(Duration.ofDays(2)));

            assertThat(returned.isOverdue(DUE.plus(Duration.ofDays(10)))).isFalse();
        }
    }

    @Test
    @DisplayName("status values round-trip through their stored form")
    void statusValues() {
        assertThat(LoanStatus.fromValue("active")).isEqualTo(LoanStatus.ACTIVE);
        assertThat(LoanStatus.fromValue("returned")).isEqualTo(LoanStatus.RETURNED);
        assertThatThrownBy(() -> LoanStatus.fromValue("lost"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
