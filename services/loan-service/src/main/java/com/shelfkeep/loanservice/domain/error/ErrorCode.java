package com.shelfkeep.loanservice.domain.error;

/** Specific error outcomes, each belonging to one {@link ErrorKind}. */
public enum ErrorCode {
    NOT_FOUND(ErrorKind.NOT_FOUND),
    FORBIDDEN(ErrorKind.FORBIDDEN),
    NO_COPIES_AVAILABLE(ErrorKind.CONFLICT),
    LOAN_LIMIT_REACHED(ErrorKind.CONFLICT),
    ALREADY_RETURNED(ErrorKind.CONFLICT),
    COPIES_ON_LOAN_EXCEED_TOTAL(ErrorKind.CONFLICT),
    INVALID_DUE_DATE(ErrorKind.VALIDATION),
    INVALID_TOTAL_COPIES(ErrorKind.VALIDATION),
    TENANT_ASSOCIATION_REQUIRED(ErrorKind.VALIDATION),
    INVENTORY_OVERFLOW(ErrorKind.INTERNAL),
    STORE_CONTENTION(ErrorKind.INTERNAL);

    private final ErrorKind kind;

    ErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
