package com.shelfkeep.loanservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.shelfkeep.loanservice.domain.error.ErrorCode;
import com.shelfkeep.loanservice.domain.error.ErrorKind;
import com.shelfkeep.loanservice.domain.error.LoanError;
import java.net.URI;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

@DisplayName("LoanProblems")
class LoanProblemsTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "NOT_FOUND, 404",
        "FORBIDDEN, 403",
        "CONFLICT, 409",
        "VALIDATION, 400",
        "INTERNAL, 500"
    })
    @DisplayName("maps each error kind to an HTTP status")
    void mapsKindToStatus(ErrorKind kind, int status) {
        assertThat(LoanProblems.statusOf(kind).value()).isEqualTo(status);
    }

    @Test
    @DisplayName("builds a problem with code, resource and a kebab-case type")
    void buildsProblemDetail() {
        var error =
                LoanError.of(ErrorCode.LOAN_LIMIT_REACHED, "member", "Member already holds 5 active loans");

        ProblemDetail problem = LoanProblems.toProblemDetail(error);

        assertThat(problem.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
        assertThat(problem.getTitle()).isEqualTo("Conflict");
        assertThat(problem.getDetail()).isEqualTo("Member already holds 5 active loans");
        assertThat(problem.getType())
                .isEqualTo(URI.create("https://shelfkeep.io/errors/loan-limit-reached"));
        assertThat(problem.getProperties())
                .containsEntry("code", "LOAN_LIMIT_REACHED")
                .containsEntry("resource", "member");
    }

    @Test
    @DisplayName("hides the message of internal errors")
    void hidesInternalDetail() {
        var error =
                LoanError.of(ErrorCode.INVENTORY_OVERFLOW, "item", "availableCopies of item 7 overflow");

        ProblemDetail problem = LoanProblems.toProblemDetail(error);

        assertThat(problem.getStatus()).isEqualTo(500);
        assertThat(problem.getDetail()).isEqualTo("An unexpected error occurred");
        assertThat(problem.getProperties()).containsEntry("code", "INVENTORY_OVERFLOW");
    }
}
