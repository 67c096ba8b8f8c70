package com.eainde.lending.model;

import java.util.List;

/**
 * One risk-matrix category: an integer score in [0, 10] and the evidence lines that produced it.
 */
public record CategoryScore(int score, List<String> evidence) {

    public static final int MIN = 0;
    public static final int MAX = 10;

    public CategoryScore {
        if (score < MIN || score > MAX) {
            throw new IllegalArgumentException("Category score out of range [0,10]: " + score);
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
