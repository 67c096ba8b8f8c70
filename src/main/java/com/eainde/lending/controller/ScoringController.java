package com.eainde.lending.controller;

import com.eainde.lending.controller.dto.ConfidenceRequest;
import com.eainde.lending.controller.dto.ConfidenceResponse;
import com.eainde.lending.decision.ConfidenceEstimator;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.RiskMatrix;
import com.eainde.lending.scoring.RiskMatrixScorer;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Stateless scoring previews. Same code paths as a decision run, nothing is stored.
 */
@RestController
@RequestMapping("/scoring")
public class ScoringController {

    private final RiskMatrixScorer scorer;

    public ScoringController(RiskMatrixScorer scorer) {
        this.scorer = scorer;
    }

    @PostMapping("/risk-matrix")
    public RiskMatrix riskMatrix(@RequestBody(required = false) Map<String, Object> financials) {
        return scorer.score(ExtractionResult.fromMap(financials));
    }

    @PostMapping("/confidence")
    public ConfidenceResponse confidence(@Valid @RequestBody ConfidenceRequest request) {
        double variance = Math.abs(request.salesScore() - request.riskScore());
        return new ConfidenceResponse(variance, ConfidenceEstimator.fromVariance(variance));
    }
}
