package com.shelfkeep.loanservice.api.dto;

/** Active loans of a member against the configured limit. */
public record ActiveLoanCountResponse(String memberId, int activeLoans, int maxActiveLoans) {}
