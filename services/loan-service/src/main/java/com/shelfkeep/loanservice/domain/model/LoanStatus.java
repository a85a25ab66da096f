package com.shelfkeep.loanservice.domain.model;

/** Lifecycle state of a {@link Loan}. The only transition is {@code ACTIVE -> RETURNED}. */
public enum LoanStatus {
    ACTIVE("active"),
    RETURNED("returned");

    private final String value;

    LoanStatus(String value) {
        this.value = value;
    }

    /** The value stored in the {@code loans.status} column. */
    public String value() {
        return value;
    }

    /**
     * Looks up a status by its stored value.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    public static LoanStatus fromValue(String value) {
        for (LoanStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown loan status: " + value);
    }
}
