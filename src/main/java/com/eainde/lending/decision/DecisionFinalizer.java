package com.eainde.lending.decision;

import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.model.LoanStatus;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Writes the final decision onto a loan sitting at COMPLIANCE_CHECK and freezes it.
 * <p>
 * {@code final_score = round2(0.4 * sales - 0.4 * risk)}; Approved iff the score reaches
 * {@link #APPROVAL_THRESHOLD}. Both inputs are the round-0 Sales and Risk scores, the
 * Moderator round never feeds the formula.
 */
@Log4j2
@Component
public class DecisionFinalizer {

    public static final double APPROVAL_THRESHOLD = 20.0;

    static final BigDecimal SALES_WEIGHT = new BigDecimal("0.4");
    static final BigDecimal RISK_WEIGHT = new BigDecimal("0.4");

    public static double computeFinalScore(double salesScore, double riskScore) {
        return SALES_WEIGHT.multiply(BigDecimal.valueOf(salesScore))
                .subtract(RISK_WEIGHT.multiply(BigDecimal.valueOf(riskScore)))
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static LoanStatus statusFor(double finalScore) {
        return finalScore >= APPROVAL_THRESHOLD ? LoanStatus.APPROVED : LoanStatus.REJECTED;
    }

    public Decision finalizeDecision(LoanApplication loan, double salesScore, double riskScore) {
        double finalScore = computeFinalScore(salesScore, riskScore);
        LoanStatus status = statusFor(finalScore);
        Double confidence = ConfidenceEstimator.confidence(salesScore, riskScore);

        loan.finalizeDecision(status, finalScore, confidence, false);
        log.info("Loan {} finalized: status={}, finalScore={}, confidence={}",
                loan.getId(), status.displayName(), finalScore, confidence);
        return new Decision(status, finalScore, confidence, false);
    }

    /**
     * Veto path: Rejected, 0.0 and full confidence, whatever the agents said.
     */
    public Decision finalizeVetoed(LoanApplication loan) {
        double confidence = ConfidenceEstimator.VETO_CONFIDENCE.doubleValue();
        loan.finalizeDecision(LoanStatus.REJECTED, 0.0, confidence, true);
        log.info("Loan {} finalized by compliance veto", loan.getId());
        return new Decision(LoanStatus.REJECTED, 0.0, confidence, true);
    }
}
