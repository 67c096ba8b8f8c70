package com.eainde.lending.controller.dto;

public record ConfidenceResponse(double variance, double confidence) {
}
