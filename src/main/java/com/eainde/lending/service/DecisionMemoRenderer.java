package com.eainde.lending.service;

import com.eainde.lending.debate.RoundGrouping;
import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentStepError;
import com.eainde.lending.model.CategoryScore;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.LoanSnapshot;
import com.eainde.lending.model.RiskMatrix;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a finalized loan as a Markdown decision memo: executive summary, key metrics,
 * risk matrix, memos grouped by debate round, compliance notes and any step errors.
 */
@Component
public class DecisionMemoRenderer {

    private static final String NONE = "n/a";

    public String render(LoanSnapshot loan) {
        if (!loan.isFinalized()) {
            throw new LoanStateConflictException("Loan " + loan.id() + " has no final decision yet");
        }
        StringBuilder md = new StringBuilder();
        md.append("# Decision Memo: ").append(loan.companyName()).append("\n\n");
        md.append("Loan ID: `").append(loan.id()).append("`\n\n");

        md.append("## Executive Summary\n\n");
        md.append(String.format(Locale.ROOT,
                "Assessment of %s%s for a requested amount of $%,.0f. Final status: **%s**. "
                        + "Final score: %s. Confidence: %s.%n%n",
                loan.companyName(),
                loan.industry() == null ? "" : " (" + loan.industry() + ")",
                loan.requestedAmount(),
                loan.status().displayName(),
                number(loan.finalScore()),
                number(loan.confidenceScore())));
        if (loan.complianceFlag()) {
            md.append("> Rejected by compliance veto. Agent scores were not weighed.\n\n");
        }
        if (loan.lowConfidence()) {
            md.append("> Financials were not available; the risk matrix is neutral.\n\n");
        }

        md.append("## Key Metrics\n\n");
        md.append("| Metric | Value |\n|---|---|\n");
        md.append("| Status | ").append(loan.status().displayName()).append(" |\n");
        md.append("| Final Score | ").append(number(loan.finalScore())).append(" |\n");
        md.append("| Confidence | ").append(number(loan.confidenceScore())).append(" |\n");
        md.append("| Compliance Flag | ").append(loan.complianceFlag()).append(" |\n");
        md.append("| Workflow State | ").append(loan.workflowState()).append(" |\n\n");

        RiskMatrix matrix = loan.riskMatrix();
        if (matrix != null) {
            md.append("## Risk Matrix\n\n");
            md.append("| Category | Score | Evidence |\n|---|---|---|\n");
            category(md, "Financial Risk", matrix.financialRisk());
            category(md, "Growth Strength", matrix.growthStrength());
            category(md, "Regulatory Risk", matrix.regulatoryRisk());
            category(md, "Reputation Risk", matrix.reputationRisk());
            md.append('\n');
        }

        md.append("## Agent Memos\n\n");
        for (Map.Entry<Integer, List<AgentMemo>> round : RoundGrouping.group(loan.agentMemos()).entrySet()) {
            md.append("### Round ").append(round.getKey()).append("\n\n");
            for (AgentMemo memo : round.getValue()) {
                md.append("**").append(memo.agentType().displayName()).append("** (score ")
                        .append(number(memo.riskScore())).append(")\n\n");
                md.append(memo.narrative()).append("\n\n");
                if (!memo.flags().isEmpty()) {
                    md.append("Flags: ").append(String.join(", ", memo.flags())).append("\n\n");
                }
            }
        }

        md.append("## Compliance Notes\n\n").append(complianceNotes(loan)).append("\n");

        if (loan.hasErrors()) {
            md.append("\n## Step Errors\n\n");
            for (AgentStepError error : loan.errors()) {
                md.append("- ").append(error.role() == null ? "Workflow" : error.role().displayName())
                        .append(" round ").append(error.round()).append(": ")
                        .append(error.kind()).append(", ").append(error.message()).append('\n');
            }
        }
        return md.toString();
    }

    private static String complianceNotes(LoanSnapshot loan) {
        StringBuilder notes = new StringBuilder();
        ExtractionResult financials = loan.extractedFinancials();
        if (financials != null && financials.hasComplianceKeywords()) {
            notes.append("Compliance keywords detected: ")
                    .append(String.join(", ", financials.complianceKeywords())).append(". ");
        }
        if (loan.complianceFlag()) {
            notes.append("Application flagged for compliance review.");
        }
        return notes.length() == 0 ? "No compliance issues identified." : notes.toString().trim();
    }

    private static void category(StringBuilder md, String name, CategoryScore score) {
        md.append("| ").append(name).append(" | ").append(score.score()).append(" | ")
                .append(String.join("; ", score.evidence())).append(" |\n");
    }

    private static String number(Double value) {
        return value == null ? NONE : String.format(Locale.ROOT, "%.2f", value);
    }
}
