package com.shelfkeep.loanservice.domain.error;

import java.util.Objects;

/**
 * A failed loan operation.
 *
 * @param code what went wrong
 * @param resource the offending resource or input field (e.g. "item", "loan", "dueDate")
 * @param message human-readable detail; for {@link ErrorKind#INTERNAL} errors it is meant for
 *     operators and must not be shown to callers
 */
public record LoanError(ErrorCode code, String resource, String message) {

    public LoanError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(resource, "resource");
    }

    public ErrorKind kind() {
        return code.kind();
    }

    public static LoanError notFound(String resource, String id) {
        return new LoanError(ErrorCode.NOT_FOUND, resource, resource + " " + id + " not found");
    }

    public static LoanError forbidden(String resource, String message) {
        return new LoanError(ErrorCode.FORBIDDEN, resource, message);
    }

    public static LoanError of(ErrorCode code, String resource, String message) {
        return new LoanError(code, resource, message);
    }
}
