package com.eainde.lending.scoring;

import com.eainde.lending.model.CategoryScore;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.RiskMatrix;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic categorical risk scoring over extracted financials.
 * <p>
 * Pure and total: unknown fields degrade to neutral scores, malformed fields (negative,
 * non-numeric or wrongly shaped) are rejected individually with an evidence note, and a missing extraction
 * yields the neutral matrix. Scoring the same input twice returns equal matrices.
 *
 * <ul>
 *   <li>financial_risk: DSCR band, leverage add-on, collateral relief. Higher is worse.</li>
 *   <li>growth_strength: revenue tier, DSCR capacity, collateral as a secondary signal. Higher is better.</li>
 *   <li>regulatory_risk / reputation_risk: baseline 1 plus keyword weights. Higher is worse.</li>
 * </ul>
 */
@Log4j2
@Component
public class RiskMatrixScorer {

    static final int FLOOR = 1;
    static final int CEILING = 10;

    static final int NEUTRAL_FINANCIAL = 5;
    static final int NEUTRAL_GROWTH = 5;
    static final int KEYWORD_BASELINE = 1;

    static final double DSCR_COVENANT = 1.25;

    public RiskMatrix score(ExtractionResult extracted) {
        if (extracted == null) {
            log.debug("No extraction result, returning neutral risk matrix");
            return neutral();
        }

        List<String> anomalies = new ArrayList<>();
        Double revenue = accept("Revenue", extracted.revenue(), anomalies);
        Double debt = accept("Debt", extracted.debt(), anomalies);
        Double dscr = acceptDscr(extracted.dscr(), anomalies);
        if (extracted.isMalformed(ExtractionResult.COLLATERAL_PRESENT)) {
            anomalies.add("Collateral value is not a boolean and was ignored");
        }

        List<String> keywordNotes = new ArrayList<>();
        if (extracted.isMalformed(ExtractionResult.COMPLIANCE_KEYWORDS)) {
            keywordNotes.add(extracted.hasComplianceKeywords()
                    ? "Compliance keywords value is not a list and was read as text"
                    : "Compliance keywords value is not a list and was ignored");
        }

        return new RiskMatrix(
                financialRisk(revenue, debt, dscr, extracted.collateralPresent(), anomalies),
                growthStrength(revenue, dscr, extracted.collateralPresent()),
                keywordRisk(extracted.complianceKeywords(), KeywordWeights.REGULATORY, keywordNotes,
                        "No compliance keywords detected"),
                keywordRisk(extracted.complianceKeywords(), KeywordWeights.REPUTATION, List.of(),
                        "No reputation risk keywords detected"));
    }

    public RiskMatrix neutral() {
        return new RiskMatrix(
                new CategoryScore(NEUTRAL_FINANCIAL, List.of("Financial data not available")),
                new CategoryScore(NEUTRAL_GROWTH, List.of("Growth data not available")),
                new CategoryScore(KEYWORD_BASELINE, List.of("Compliance data not available")),
                new CategoryScore(KEYWORD_BASELINE, List.of("Reputation data not available")));
    }

    // =========================================================================
    //  financial_risk
    // =========================================================================

    private CategoryScore financialRisk(Double revenue, Double debt, Double dscr,
                                        boolean collateral, List<String> anomalies) {
        List<String> evidence = new ArrayList<>(anomalies);
        int score;

        if (dscr == null) {
            score = NEUTRAL_FINANCIAL;
            evidence.add("DSCR not available");
        } else if (dscr <= 0) {
            score = 10;
            evidence.add(format("DSCR %.2f indicates inability to service debt", dscr));
        } else if (dscr < 0.5) {
            score = 9;
            evidence.add(format("DSCR %.2f severely below 1.0 threshold", dscr));
        } else if (dscr < 1.0) {
            score = 8;
            evidence.add(format("DSCR %.2f below 1.0 (cannot cover debt service)", dscr));
        } else if (dscr < DSCR_COVENANT) {
            score = 6;
            evidence.add(format("DSCR %.2f below 1.25 typical covenant", dscr));
        } else if (dscr < 1.5) {
            score = 5;
            evidence.add(format("DSCR %.2f adequate buffer", dscr));
        } else {
            score = 2;
            evidence.add(format("DSCR %.2f strong debt service coverage", dscr));
        }

        if (revenue != null && debt != null && revenue > 0) {
            double ratio = debt / revenue;
            if (ratio > 3) {
                score += 2;
                evidence.add(format("Debt/Revenue %.1fx indicates high leverage", ratio));
            } else if (ratio > 2) {
                score += 1;
                evidence.add(format("Debt/Revenue %.1fx moderate leverage", ratio));
            } else {
                evidence.add(format("Debt/Revenue %.1fx", ratio));
            }
        }

        if (collateral) {
            score -= 1;
            evidence.add("Collateral present reduces financial risk");
        }

        return new CategoryScore(clamp(score), evidence);
    }

    // =========================================================================
    //  growth_strength
    // =========================================================================

    private CategoryScore growthStrength(Double revenue, Double dscr, boolean collateral) {
        List<String> evidence = new ArrayList<>();
        int score = NEUTRAL_GROWTH;

        if (revenue != null && revenue > 0) {
            if (revenue >= 100_000_000) {
                score = 9;
                evidence.add(format("Revenue $%.0fM indicates scale", revenue / 1e6));
            } else if (revenue >= 10_000_000) {
                score = 7;
                evidence.add(format("Revenue $%.1fM solid base", revenue / 1e6));
            } else if (revenue >= 1_000_000) {
                score = 6;
                evidence.add(format("Revenue $%.2fM", revenue / 1e6));
            } else {
                score = 4;
                evidence.add(format("Revenue $%,.0f", revenue));
            }
        }

        if (dscr != null) {
            if (dscr >= 1.5) {
                score += 2;
                evidence.add(format("DSCR %.2f suggests strong cash flow", dscr));
            } else if (dscr >= DSCR_COVENANT) {
                score += 1;
                evidence.add(format("DSCR %.2f supports growth capacity", dscr));
            } else if (dscr < 1.0) {
                score -= 2;
                evidence.add(format("DSCR %.2f constrains growth capacity", dscr));
            }
        }

        // secondary signal, never lifts an already strong profile
        if (collateral && score < 8) {
            score += 1;
            evidence.add("Collateral supports financing capacity");
        }

        if (evidence.isEmpty()) {
            evidence.add("Limited data for growth assessment");
        }
        return new CategoryScore(clamp(score), evidence);
    }

    // =========================================================================
    //  regulatory_risk / reputation_risk
    // =========================================================================

    private CategoryScore keywordRisk(List<String> keywords, KeywordWeights weights, List<String> notes,
                                      String emptyEvidence) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String keyword : keywords) {
            String normalized = KeywordWeights.normalize(keyword);
            if (!normalized.isEmpty()) {
                distinct.add(normalized);
            }
        }
        List<String> evidence = new ArrayList<>(notes);
        if (distinct.isEmpty()) {
            evidence.add(emptyEvidence);
            return new CategoryScore(KEYWORD_BASELINE, evidence);
        }

        int score = KEYWORD_BASELINE;
        for (String keyword : distinct) {
            score += weights.weightOf(keyword);
            evidence.add("Keyword detected: " + keyword);
        }
        return new CategoryScore(clamp(score), evidence);
    }

    // =========================================================================
    //  Field validation
    // =========================================================================

    private static Double accept(String field, Double value, List<String> anomalies) {
        if (value == null) {
            return null;
        }
        if (value.isNaN() || value.isInfinite()) {
            anomalies.add(field + " value is not numeric and was ignored");
            return null;
        }
        if (value < 0) {
            anomalies.add(format("%s value %.2f is negative and was ignored", field, value));
            return null;
        }
        return value;
    }

    // DSCR may legitimately be zero or negative, only non-numeric values are rejected
    private static Double acceptDscr(Double value, List<String> anomalies) {
        if (value != null && (value.isNaN() || value.isInfinite())) {
            anomalies.add("DSCR value is not numeric and was ignored");
            return null;
        }
        return value;
    }

    private static int clamp(int score) {
        return Math.max(FLOOR, Math.min(CEILING, score));
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
