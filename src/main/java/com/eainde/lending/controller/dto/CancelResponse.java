package com.eainde.lending.controller.dto;

public record CancelResponse(String loanId, boolean cancelled) {
}
