package com.shelfkeep.loanservice.domain.model;

/** Display status of an item, derived from its available-copy counter on every read. */
public enum Availability {
    AVAILABLE("available"),
    UNAVAILABLE("unavailable");

    private final String value;

    Availability(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Availability of(int availableCopies) {
        return availableCopies > 0 ? AVAILABLE : UNAVAILABLE;
    }
}
