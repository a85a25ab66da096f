package com.shelfkeep.loanservice.infrastructure.web;

import com.shelfkeep.loanservice.domain.error.ErrorKind;
import com.shelfkeep.loanservice.domain.error.LoanError;
import java.net.URI;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Maps {@link LoanError} to RFC 7807 responses.
 *
 * <pre>
 * {
 *   "type": "https://shelfkeep.io/errors/no-copies-available",
 *   "title": "Conflict",
 *   "status": 409,
 *   "detail": "No copies of item 42 are available",
 *   "code": "NO_COPIES_AVAILABLE",
 *   "resource": "item"
 * }
 * </pre>
 *
 * <p>Internal errors keep their code but never their detail.
 */
public final class LoanProblems {

    static final String ERROR_TYPE_BASE = "https://shelfkeep.io/errors/";

    private LoanProblems() {}

    public static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static ProblemDetail toProblemDetail(LoanError error) {
        HttpStatus status = statusOf(error.kind());
        String detail =
                error.kind() == ErrorKind.INTERNAL ? "An unexpected error occurred" : error.message();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(
                URI.create(
                        ERROR_TYPE_BASE + error.code().name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("code", error.code().name());
        problem.setProperty("resource", error.resource());
        return problem;
    }
}
