package com.shelfkeep.loanservice.api.dto;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;

/**
 * Body of {@code POST /api/v1/loans}.
 *
 * @param itemId item to borrow
 * @param dueDate requested due date; the configured default loan period applies when absent
 */
public record BorrowRequest(@NotBlank String itemId, Instant dueDate) {}
