package com.shelfkeep.loanservice.api.dto;

import jakarta.validation.constraints.NotNull;

/** Body of {@code PUT /api/v1/items/{itemId}/copies}. */
public record ResizeCopiesRequest(@NotNull Integer totalCopies) {}
