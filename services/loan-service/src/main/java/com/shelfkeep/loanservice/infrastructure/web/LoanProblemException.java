package com.shelfkeep.loanservice.infrastructure.web;

import com.shelfkeep.loanservice.domain.error.LoanError;

/**
 * Carries a failed {@code LoanResult} out of a controller to {@link GlobalExceptionHandler}.
 * Thrown only at the web edge; the engine itself never throws for business outcomes.
 */
public class LoanProblemException extends RuntimeException {

    private final transient LoanError error;

    public LoanProblemException(LoanError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public LoanError error() {
        return error;
    }
}
