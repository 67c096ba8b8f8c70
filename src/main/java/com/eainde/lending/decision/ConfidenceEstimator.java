package com.eainde.lending.decision;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Confidence in a decision derived from how far the Sales and Risk agents disagree.
 * <p>
 * With {@code v = |sales - risk|}:
 * <pre>
 *   0  &lt;= v &lt;= 10   1.00 - 0.01 * v
 *   10 &lt;  v &lt;= 20   0.90 - 0.02 * (v - 10)
 *   20 &lt;  v &lt;= 40   0.70 - 0.01 * (v - 20)
 *        v &gt;  40   max(0.10, 0.50 - 0.005 * (v - 40))
 * </pre>
 * Continuous at every breakpoint and non-increasing in {@code v}. Results are rounded
 * half-up to two decimals. This is the only place the law is implemented.
 */
public final class ConfidenceEstimator {

    public static final BigDecimal VETO_CONFIDENCE = new BigDecimal("1.00");

    private static final BigDecimal FLOOR = new BigDecimal("0.10");

    private ConfidenceEstimator() {
    }

    /**
     * @return confidence in [0.10, 1.00], or null when either score is unavailable
     */
    public static Double confidence(Double salesScore, Double riskScore) {
        if (salesScore == null || riskScore == null) {
            return null;
        }
        return fromVariance(Math.abs(salesScore - riskScore));
    }

    public static double fromVariance(double variance) {
        if (Double.isNaN(variance) || variance < 0) {
            throw new IllegalArgumentException("Variance must be a non-negative number: " + variance);
        }
        BigDecimal v = BigDecimal.valueOf(variance);
        BigDecimal raw;
        if (variance <= 10) {
            raw = new BigDecimal("1.00").subtract(new BigDecimal("0.01").multiply(v));
        } else if (variance <= 20) {
            raw = new BigDecimal("0.90").subtract(new BigDecimal("0.02").multiply(v.subtract(BigDecimal.TEN)));
        } else if (variance <= 40) {
            raw = new BigDecimal("0.70").subtract(new BigDecimal("0.01").multiply(v.subtract(BigDecimal.valueOf(20))));
        } else {
            raw = new BigDecimal("0.50").subtract(new BigDecimal("0.005").multiply(v.subtract(BigDecimal.valueOf(40))))
                    .max(FLOOR);
        }
        return raw.setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
