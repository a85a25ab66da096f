package com.shelfkeep.loanservice.domain.model;

import java.util.Objects;

/**
 * Copy counters of one catalog item. {@code availableCopies} is the single availability fact.
 *
 * @param id item identifier
 * @param tenantId owning tenant, or {@code null} for an item outside every tenant
 * @param totalCopies physical copies owned, always positive
 * @param availableCopies copies on the shelf, between zero and {@code totalCopies}
 */
public record InventoryItem(String id, String tenantId, int totalCopies, int availableCopies) {

    public InventoryItem {
        Objects.requireNonNull(id, "id");
        if (totalCopies < 1) {
            throw new IllegalArgumentException("totalCopies must be positive: " + totalCopies);
        }
        if (availableCopies < 0 || availableCopies > totalCopies) {
            throw new IllegalArgumentException(
                    "availableCopies must be within [0, "
                            + totalCopies
                            + "]: "
                            + availableCopies);
        }
    }

    public int copiesOnLoan() {
        return totalCopies - availableCopies;
    }

    public Availability availability() {
        return Availability.of(availableCopies);
    }
}
