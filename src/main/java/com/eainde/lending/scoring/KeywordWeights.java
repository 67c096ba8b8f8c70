package com.eainde.lending.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-category weights for compliance keywords. A flagged term that matches no known
 * keyword still counts with {@link #UNKNOWN_TERM_WEIGHT}.
 */
final class KeywordWeights {

    static final int UNKNOWN_TERM_WEIGHT = 1;

    static final KeywordWeights REGULATORY = new KeywordWeights(ordered(
            "offshore", 3,
            "grey list", 2,
            "gray list", 2,
            "aml", 2,
            "anti-money laundering", 2,
            "sanctions", 2,
            "pep", 2,
            "politically exposed", 2));

    static final KeywordWeights REPUTATION = new KeywordWeights(ordered(
            "grey list", 3,
            "gray list", 3,
            "pep", 3,
            "politically exposed", 3,
            "offshore", 2,
            "aml", 1,
            "anti-money laundering", 1,
            "sanctions", 2));

    private final Map<String, Integer> weights;

    private KeywordWeights(Map<String, Integer> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    /**
     * Weight of a normalized keyword. Matching is containment in either direction,
     * so "sanction" and "ofac sanctions hit" both resolve to "sanctions".
     */
    int weightOf(String keyword) {
        for (Map.Entry<String, Integer> entry : weights.entrySet()) {
            String known = entry.getKey();
            if (known.contains(keyword) || keyword.contains(known)) {
                return entry.getValue();
            }
        }
        return UNKNOWN_TERM_WEIGHT;
    }

    static String normalize(String keyword) {
        return keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Integer> ordered(Object... pairs) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Integer) pairs[i + 1]);
        }
        return map;
    }
}
