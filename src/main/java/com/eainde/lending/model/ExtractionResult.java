package com.eainde.lending.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Financial fields extracted from the applicant's documents by the ingestion stage.
 * <p>
 * Numeric fields are nullable (unknown). Values that arrived non-numeric are carried
 * as {@link Double#NaN} so the scorer can flag the anomaly instead of failing the pass.
 * Non-numeric fields that arrived in the wrong shape are named in {@code malformedFields}.
 * A compliance keyword value given as plain text is still read, split on commas, and marked.
 */
public record ExtractionResult(
        Double revenue,
        Double debt,
        Double dscr,
        boolean collateralPresent,
        List<String> complianceKeywords,
        Set<String> malformedFields
) {

    public static final String REVENUE = "revenue";
    public static final String DEBT = "debt";
    public static final String DSCR = "dscr";
    public static final String COLLATERAL_PRESENT = "collateral_present";
    public static final String COMPLIANCE_KEYWORDS = "compliance_keywords";

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "y", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "n", "0");

    public ExtractionResult {
        complianceKeywords = complianceKeywords == null ? List.of() : List.copyOf(complianceKeywords);
        malformedFields = malformedFields == null ? Set.of() : Set.copyOf(malformedFields);
    }

    public ExtractionResult(Double revenue, Double debt, Double dscr, boolean collateralPresent,
                            List<String> complianceKeywords) {
        this(revenue, debt, dscr, collateralPresent, complianceKeywords, Set.of());
    }

    /**
     * Builds an extraction result from a loosely typed payload (JSON body, extractor output).
     * Numeric strings are parsed; anything else non-numeric becomes NaN.
     */
    public static ExtractionResult fromMap(Map<String, Object> raw) {
        if (raw == null) {
            return null;
        }
        Set<String> malformed = new LinkedHashSet<>();
        return new ExtractionResult(
                toDouble(raw.get(REVENUE)),
                toDouble(raw.get(DEBT)),
                toDouble(raw.get(DSCR)),
                toBoolean(raw.get(COLLATERAL_PRESENT), malformed),
                toKeywords(raw.get(COMPLIANCE_KEYWORDS), malformed),
                malformed);
    }

    public boolean hasComplianceKeywords() {
        return !complianceKeywords.isEmpty();
    }

    public boolean isMalformed(String field) {
        return malformedFields.contains(field);
    }

    /** Keyword value was unreadable and nothing could be recovered from it. */
    public boolean complianceKeywordsUnreadable() {
        return isMalformed(COMPLIANCE_KEYWORDS) && complianceKeywords.isEmpty();
    }

    private static Double toDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) return n.doubleValue();
        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        try {
            return Double.parseDouble(text.replace(",", "").replace("$", ""));
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static boolean toBoolean(Object value, Set<String> malformed) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty() || FALSE_VALUES.contains(text)) return false;
        if (TRUE_VALUES.contains(text)) return true;
        malformed.add(COLLATERAL_PRESENT);
        return false;
    }

    private static List<String> toKeywords(Object value, Set<String> malformed) {
        if (value == null) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !item.toString().isBlank()) {
                    keywords.add(item.toString().trim());
                }
            }
            return keywords;
        }
        if (value instanceof CharSequence text) {
            if (text.toString().isBlank()) {
                return List.of();
            }
            for (String part : text.toString().split("[,;]")) {
                if (!part.isBlank()) {
                    keywords.add(part.trim());
                }
            }
        }
        malformed.add(COMPLIANCE_KEYWORDS);
        return keywords;
    }
}
