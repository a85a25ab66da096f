package com.shelfkeep.loanservice.api.dto;

import com.shelfkeep.loanservice.domain.model.InventoryItem;

/** Copy counters of one item with the derived display status. */
public record AvailabilityResponse(
        String itemId, int totalCopies, int availableCopies, int copiesOnLoan, String status) {

    public static AvailabilityResponse from(InventoryItem item) {
        return new AvailabilityResponse(
                item.id(),
                item.totalCopies(),
                item.availableCopies(),
                item.copiesOnLoan(),
                item.availability().value());
    }
}
