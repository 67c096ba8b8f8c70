package com.eainde.lending.workflow;

import com.eainde.lending.edges.ComplianceRoutingEdge;
import com.eainde.lending.edges.DivergenceRoutingEdge;
import com.eainde.lending.nodes.ComplianceCheckNode;
import com.eainde.lending.nodes.DebateRoundNode;
import com.eainde.lending.nodes.FinalizeNode;
import com.eainde.lending.nodes.InitialReviewNode;
import com.eainde.lending.nodes.ModeratorRoundNode;
import com.eainde.lending.state.LoanDecisionState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The loan decision state machine as a graph:
 * <pre>
 *   initial_review -> debate_round -+-> moderator_round -+-> compliance_check -+-> finalize -> END
 *                                   +--------------------+                     +-> END (vetoed / held)
 * </pre>
 */
@Component
public class LoanDecisionWorkflowGraph {

    public static final String WORKFLOW_NAME = "loanDecisionWorkflow";

    static final String INITIAL_REVIEW = "initial_review";
    static final String DEBATE_ROUND = "debate_round";
    static final String MODERATOR_ROUND = "moderator_round";
    static final String COMPLIANCE_CHECK = "compliance_check";
    static final String FINALIZE = "finalize";

    private final InitialReviewNode initialReviewNode;
    private final DebateRoundNode debateRoundNode;
    private final ModeratorRoundNode moderatorRoundNode;
    private final ComplianceCheckNode complianceCheckNode;
    private final FinalizeNode finalizeNode;
    private final DivergenceRoutingEdge divergenceRouting;
    private final ComplianceRoutingEdge complianceRouting;

    public LoanDecisionWorkflowGraph(
            InitialReviewNode initialReviewNode,
            DebateRoundNode debateRoundNode,
            ModeratorRoundNode moderatorRoundNode,
            ComplianceCheckNode complianceCheckNode,
            FinalizeNode finalizeNode,
            DivergenceRoutingEdge divergenceRouting,
            ComplianceRoutingEdge complianceRouting) {
        this.initialReviewNode = initialReviewNode;
        this.debateRoundNode = debateRoundNode;
        this.moderatorRoundNode = moderatorRoundNode;
        this.complianceCheckNode = complianceCheckNode;
        this.finalizeNode = finalizeNode;
        this.divergenceRouting = divergenceRouting;
        this.complianceRouting = complianceRouting;
    }

    // The engine picks this bean up by name.
    @Bean(WORKFLOW_NAME)
    public CompiledGraph<LoanDecisionState> build() throws GraphStateException {

        StateGraph<LoanDecisionState> workflow = new StateGraph<>(LoanDecisionState::new);

        workflow.addNode(INITIAL_REVIEW, initialReviewNode);
        workflow.addNode(DEBATE_ROUND, debateRoundNode);
        workflow.addNode(MODERATOR_ROUND, moderatorRoundNode);
        workflow.addNode(COMPLIANCE_CHECK, complianceCheckNode);
        workflow.addNode(FINALIZE, finalizeNode);

        workflow.addEdge(START, INITIAL_REVIEW);
        workflow.addEdge(INITIAL_REVIEW, DEBATE_ROUND);

        workflow.addConditionalEdges(
                DEBATE_ROUND,
                divergenceRouting,
                Map.of(
                        DivergenceRoutingEdge.MODERATE, MODERATOR_ROUND,
                        DivergenceRoutingEdge.SETTLED, COMPLIANCE_CHECK
                )
        );

        workflow.addEdge(MODERATOR_ROUND, COMPLIANCE_CHECK);

        workflow.addConditionalEdges(
                COMPLIANCE_CHECK,
                complianceRouting,
                Map.of(
                        ComplianceRoutingEdge.VETOED, END,
                        ComplianceRoutingEdge.HOLD, END,
                        ComplianceRoutingEdge.CLEAR, FINALIZE
                )
        );

        workflow.addEdge(FINALIZE, END);

        return workflow.compile();
    }
}
