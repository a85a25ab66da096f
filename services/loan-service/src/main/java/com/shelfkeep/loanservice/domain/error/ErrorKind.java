package com.shelfkeep.loanservice.domain.error;

/** Error taxonomy of the borrowing engine. */
public enum ErrorKind {
    /** Record absent, or hidden because it belongs to another tenant. */
    NOT_FOUND,
    /** Actor is known and in-tenant but not permitted. */
    FORBIDDEN,
    /** Business rule violated. */
    CONFLICT,
    /** Malformed input. */
    VALIDATION,
    /** Invariant violation in the store; never a user error. */
    INTERNAL
}
