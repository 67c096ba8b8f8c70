package com.eainde.lending.decision;

import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.LoanApplication;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fail-closed compliance override, evaluated once the debate is over.
 * <p>
 * A veto is raised when any extracted compliance keyword or any flag on the Compliance memo
 * names a blocking term, when the extracted keywords could not be read at all, or when the
 * Compliance agent scored the applicant below {@link #BLOCKING_COMPLIANCE_SCORE}. A veto is a
 * short-circuit: the finalizer never weighs it.
 * <p>
 * Terms match on word boundaries. A memo flag that opens with a negation ("No AML concerns")
 * or closes with a clearance ("sanctions screening clear") is not blocking.
 */
@Log4j2
@Component
public class ComplianceVetoGate {

    static final List<String> BLOCKING_TERMS = List.of(
            "aml", "anti-money laundering", "grey list", "gray list", "offshore",
            "sanction", "sanctions", "sanctioned", "blocked");

    static final double BLOCKING_COMPLIANCE_SCORE = 30.0;

    private static final Pattern BLOCKING_PATTERN = Pattern.compile("\\b(" + BLOCKING_TERMS.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|")) + ")\\b");

    private static final Pattern NEGATED_FLAG = Pattern.compile(
            "^(no|none|not flagged|without)\\b.*|.*\\b(clear|cleared|passed|not found)\\.?$");

    /**
     * @param complianceMemo round-0 Compliance memo, may be null when the agent failed
     */
    public VetoResult apply(LoanApplication loan, AgentMemo complianceMemo) {
        List<String> reasons = new ArrayList<>();

        ExtractionResult financials = loan.getExtractedFinancials();
        if (financials != null) {
            if (financials.complianceKeywordsUnreadable()) {
                reasons.add("Compliance keywords could not be read");
            }
            for (String keyword : financials.complianceKeywords()) {
                if (isBlocking(keyword)) {
                    reasons.add("Compliance keyword '" + keyword + "' is blocking");
                }
            }
        }

        if (complianceMemo != null) {
            for (String flag : complianceMemo.flags()) {
                if (isBlocking(flag) && !isNegated(flag)) {
                    reasons.add("Compliance agent flagged '" + flag + "'");
                }
            }
            if (complianceMemo.hasScore() && complianceMemo.riskScore() < BLOCKING_COMPLIANCE_SCORE) {
                reasons.add(String.format(Locale.ROOT, "Compliance score %.0f below %.0f",
                        complianceMemo.riskScore(), BLOCKING_COMPLIANCE_SCORE));
            }
        }

        if (reasons.isEmpty()) {
            return VetoResult.clear();
        }
        log.warn("Compliance veto for loan {}: {}", loan.getId(), reasons);
        return new VetoResult(true, reasons);
    }

    static boolean isBlocking(String text) {
        if (text == null) {
            return false;
        }
        return BLOCKING_PATTERN.matcher(normalize(text)).find();
    }

    static boolean isNegated(String flag) {
        return NEGATED_FLAG.matcher(normalize(flag)).matches();
    }

    private static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
