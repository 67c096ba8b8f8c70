package com.eainde.lending.service;

import com.eainde.lending.agents.AgentInvoker;
import com.eainde.lending.agents.AgentOpinion;
import com.eainde.lending.agents.AgentRoster;
import com.eainde.lending.agents.AgentUnavailableException;
import com.eainde.lending.agents.AnalysisAgent;
import com.eainde.lending.agents.StubAgent;
import com.eainde.lending.config.DecisionProperties;
import com.eainde.lending.debate.DebateOrchestrator;
import com.eainde.lending.debate.OrchestrationCancelledException;
import com.eainde.lending.debate.OrchestrationFailedException;
import com.eainde.lending.decision.ComplianceVetoGate;
import com.eainde.lending.decision.DecisionFinalizer;
import com.eainde.lending.edges.ComplianceRoutingEdge;
import com.eainde.lending.edges.DivergenceRoutingEdge;
import com.eainde.lending.execution.AuditEvent;
import com.eainde.lending.execution.AuditEventType;
import com.eainde.lending.execution.AuditTrail;
import com.eainde.lending.model.AgentMemo;
import com.eainde.lending.model.AgentRole;
import com.eainde.lending.model.AgentStepError;
import com.eainde.lending.model.ExtractionResult;
import com.eainde.lending.model.LoanSnapshot;
import com.eainde.lending.model.LoanStatus;
import com.eainde.lending.model.WorkflowState;
import com.eainde.lending.nodes.ComplianceCheckNode;
import com.eainde.lending.nodes.DebateRoundNode;
import com.eainde.lending.nodes.FinalizeNode;
import com.eainde.lending.nodes.InitialReviewNode;
import com.eainde.lending.nodes.ModeratorRoundNode;
import com.eainde.lending.repository.LoanApplicationRepository;
import com.eainde.lending.scoring.RiskMatrixScorer;
import com.eainde.lending.thread.MdcAwareExecutor;
import com.eainde.lending.workflow.LoanDecisionWorkflowGraph;
import com.eainde.lending.workflow.WorkflowEngine;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.state.AgentState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Full decision runs through the compiled graph, with scripted agents in place of the model.
 */
class LoanDecisionServiceTest {

    private MdcAwareExecutor executor;
    private LoanApplicationRepository loans;
    private AuditTrail auditTrail;
    private LoanDecisionService service;

    private StubAgent moderator;

    @BeforeEach
    void setUp() {
        executor = new MdcAwareExecutor("service-test");
        loans = new LoanApplicationRepository();
        auditTrail = new AuditTrail();
        moderator = StubAgent.scoring(AgentRole.MODERATOR, 60.0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    // =========================================================================
    //  Wiring: same graph as production, agents scripted
    // =========================================================================

    private void wire(AnalysisAgent sales, AnalysisAgent risk, AnalysisAgent compliance) throws GraphStateException {
        DecisionProperties properties = new DecisionProperties();
        properties.setAgentTimeout(Duration.ofSeconds(2));
        properties.setRetryBackoff(Duration.ofMillis(10));

        Map<AgentRole, AnalysisAgent> agents = new EnumMap<>(AgentRole.class);
        agents.put(AgentRole.SALES, sales);
        agents.put(AgentRole.RISK, risk);
        agents.put(AgentRole.COMPLIANCE, compliance);
        agents.put(AgentRole.MODERATOR, moderator);

        AgentInvoker invoker = new AgentInvoker(executor, properties);
        DebateOrchestrator orchestrator = new DebateOrchestrator(new AgentRoster(agents), invoker, executor);
        DecisionFinalizer finalizer = new DecisionFinalizer();

        CompiledGraph<? extends AgentState> graph = new LoanDecisionWorkflowGraph(
                new InitialReviewNode(loans, new RiskMatrixScorer(), auditTrail),
                new DebateRoundNode(loans, orchestrator, auditTrail),
                new ModeratorRoundNode(loans, orchestrator, auditTrail),
                new ComplianceCheckNode(loans, new ComplianceVetoGate(), finalizer, auditTrail),
                new FinalizeNode(loans, finalizer, auditTrail),
                new DivergenceRoutingEdge(),
                new ComplianceRoutingEdge()).build();

        Map<String, CompiledGraph<? extends AgentState>> graphs = Map.of(LoanDecisionWorkflowGraph.WORKFLOW_NAME, graph);
        service = new LoanDecisionService(loans, new WorkflowEngine(graphs), auditTrail, executor);
    }

    private String createLoan(ExtractionResult financials) {
        return service.createLoan("Acme Freight", "Logistics", 2_000_000, financials).id();
    }

    private List<AuditEventType> auditTypes(String loanId) {
        return service.auditTrail(loanId).stream().map(AuditEvent::eventType).toList();
    }

    private static ExtractionResult financials(double revenue, double debt, double dscr, boolean collateral,
                                               String... keywords) {
        return new ExtractionResult(revenue, debt, dscr, collateral, List.of(keywords));
    }

    // =========================================================================
    //  Reference scenarios
    // =========================================================================

    @Nested
    @DisplayName("Reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("diverging agents: moderator runs, round-0 scores decide, loan rejected")
        void divergentRejected() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 85.0),
                    StubAgent.scoring(AgentRole.RISK, 45.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 70.0));
            String loanId = createLoan(financials(25_000_000, 8_000_000, 1.1, false));

            LoanSnapshot loan = service.decide(loanId);

            assertThat(loan.workflowState()).isEqualTo(WorkflowState.FINALIZED);
            assertThat(loan.status()).isEqualTo(LoanStatus.REJECTED);
            assertThat(loan.finalScore()).isEqualTo(16.0);
            assertThat(loan.confidenceScore()).isEqualTo(0.50);
            assertThat(loan.complianceFlag()).isFalse();
            assertThat(loan.riskMatrix().financialRisk().score()).isEqualTo(6);
            assertThat(loan.agentMemos()).hasSize(4);
            assertThat(loan.agentMemos().get(3).agentType()).isEqualTo(AgentRole.MODERATOR);
            assertThat(loan.agentMemos().get(3).narrative()).contains("40");
            assertThat(moderator.calls()).isEqualTo(1);
            assertThat(auditTypes(loanId)).contains(AuditEventType.WORKFLOW_START,
                    AuditEventType.RISK_MATRIX, AuditEventType.MODERATOR_TRIGGERED,
                    AuditEventType.FINAL_SCORE_CALC, AuditEventType.CONFIDENCE_CALC,
                    AuditEventType.WORKFLOW_COMPLETE);
        }

        @Test
        @DisplayName("blocking keyword: compliance veto overrides favourable scores")
        void vetoed() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 95.0),
                    StubAgent.scoring(AgentRole.RISK, 20.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 65.0));
            String loanId = createLoan(financials(40_000_000, 6_000_000, 1.6, true, "grey list"));

            LoanSnapshot loan = service.decide(loanId);

            assertThat(loan.status()).isEqualTo(LoanStatus.REJECTED);
            assertThat(loan.finalScore()).isEqualTo(0.0);
            assertThat(loan.confidenceScore()).isEqualTo(1.00);
            assertThat(loan.complianceFlag()).isTrue();
            assertThat(auditTypes(loanId)).contains(AuditEventType.AUTO_REJECT)
                    .doesNotContain(AuditEventType.FINAL_SCORE_CALC);
        }

        @Test
        @DisplayName("strong applicant: approved at the threshold band")
        void approved() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 86.0),
                    StubAgent.scoring(AgentRole.RISK, 35.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 88.0));
            String loanId = createLoan(financials(15_000_000, 5_000_000, 1.35, true));

            LoanSnapshot loan = service.decide(loanId);

            assertThat(loan.status()).isEqualTo(LoanStatus.APPROVED);
            assertThat(loan.finalScore()).isEqualTo(20.4);
            assertThat(loan.confidenceScore()).isEqualTo(0.45);
            assertThat(loan.riskMatrix().financialRisk().score()).isEqualTo(4);
            assertThat(loan.riskMatrix().growthStrength().score()).isEqualTo(8);
        }

        @Test
        @DisplayName("converging agents skip the moderator round")
        void converged() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 70.0),
                    StubAgent.scoring(AgentRole.RISK, 60.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 75.0));
            String loanId = createLoan(financials(5_000_000, 1_000_000, 1.3, false));

            LoanSnapshot loan = service.decide(loanId);

            assertThat(loan.finalScore()).isEqualTo(4.0);
            assertThat(loan.confidenceScore()).isEqualTo(0.90);
            assertThat(loan.agentMemos()).hasSize(3);
            assertThat(moderator.calls()).isZero();
            assertThat(service.auditTrail(loanId)).filteredOn(e -> e.eventType() == AuditEventType.STATE_TRANSITION)
                    .extracting(e -> e.details().get("to"))
                    .containsExactly("DEBATE_ROUND_1", "COMPLIANCE_CHECK", "FINALIZED");
        }

        @Test
        @DisplayName("missing financials run on the neutral matrix and are marked low-confidence")
        void missingFinancials() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 60.0),
                    StubAgent.scoring(AgentRole.RISK, 55.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 70.0));
            String loanId = createLoan(null);

            LoanSnapshot loan = service.decide(loanId);

            assertThat(loan.lowConfidence()).isTrue();
            assertThat(loan.riskMatrix().financialRisk().score()).isEqualTo(5);
            assertThat(loan.isFinalized()).isTrue();
        }
    }

    // =========================================================================
    //  Partial failure
    // =========================================================================

    @Nested
    @DisplayName("Partial failure")
    class PartialFailure {

        @Test
        @DisplayName("a missing Risk score holds the loan, and a retry only re-runs Risk")
        void heldThenResumed() throws GraphStateException {
            AtomicBoolean riskDown = new AtomicBoolean(true);
            StubAgent sales = StubAgent.scoring(AgentRole.SALES, 70.0);
            StubAgent risk = StubAgent.answering(AgentRole.RISK, ctx -> {
                if (riskDown.get()) {
                    throw new AgentUnavailableException(AgentRole.RISK, "Risk model unavailable");
                }
                return new AgentOpinion(62.0, "Adequate coverage", List.of());
            });
            wire(sales, risk, StubAgent.scoring(AgentRole.COMPLIANCE, 75.0));
            String loanId = createLoan(financials(25_000_000, 8_000_000, 1.1, false));

            LoanSnapshot held = service.decide(loanId);

            assertThat(held.isFinalized()).isFalse();
            assertThat(held.workflowState()).isEqualTo(WorkflowState.COMPLIANCE_CHECK);
            assertThat(held.status()).isEqualTo(LoanStatus.PENDING);
            assertThat(held.agentMemos()).extracting(AgentMemo::agentType)
                    .containsExactlyInAnyOrder(AgentRole.SALES, AgentRole.COMPLIANCE);
            assertThat(held.errors()).extracting(AgentStepError::kind)
                    .containsExactly("AGENT_UNAVAILABLE", ComplianceCheckNode.DECISION_INCOMPLETE);
            assertThat(auditTypes(loanId)).contains(AuditEventType.AGENT_FAILED, AuditEventType.DECISION_HELD);

            riskDown.set(false);
            LoanSnapshot resumed = service.decide(loanId);

            assertThat(resumed.isFinalized()).isTrue();
            assertThat(resumed.finalScore()).isEqualTo(3.2);
            assertThat(sales.calls()).isEqualTo(1);
            assertThat(resumed.agentMemos()).hasSize(3);
        }

        @Test
        @DisplayName("all round-0 agents failing fails the run and leaves the loan unfinalized")
        void allFailed() throws GraphStateException {
            wire(StubAgent.failing(AgentRole.SALES),
                    StubAgent.failing(AgentRole.RISK),
                    StubAgent.failing(AgentRole.COMPLIANCE));
            String loanId = createLoan(financials(25_000_000, 8_000_000, 1.1, false));

            assertThatThrownBy(() -> service.decide(loanId))
                    .isInstanceOf(OrchestrationFailedException.class);

            LoanSnapshot loan = service.getLoan(loanId);
            assertThat(loan.isFinalized()).isFalse();
            assertThat(loan.errors()).hasSize(3);
            assertThat(auditTypes(loanId)).contains(AuditEventType.WORKFLOW_FAILED);
            assertThat(service.isRunning(loanId)).isFalse();
        }
    }

    // =========================================================================
    //  Lifecycle guards
    // =========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("a finalized loan cannot be decided again")
        void finalizedIsFrozen() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 70.0),
                    StubAgent.scoring(AgentRole.RISK, 60.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 75.0));
            String loanId = createLoan(null);
            service.decide(loanId);

            assertThatThrownBy(() -> service.decide(loanId))
                    .isInstanceOf(LoanStateConflictException.class);
        }

        @Test
        @DisplayName("unknown loans are reported as not found")
        void unknownLoan() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 70.0),
                    StubAgent.scoring(AgentRole.RISK, 60.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 75.0));

            assertThatThrownBy(() -> service.decide("missing"))
                    .isInstanceOf(LoanNotFoundException.class);
        }

        @Test
        @DisplayName("a second trigger while a run is in flight is rejected")
        void concurrentTrigger() throws Exception {
            wire(StubAgent.slow(AgentRole.SALES, Duration.ofMillis(600), 70.0),
                    StubAgent.scoring(AgentRole.RISK, 60.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 75.0));
            String loanId = createLoan(null);

            Thread first = new Thread(() -> service.decide(loanId));
            first.start();
            awaitRunning(loanId);

            assertThatThrownBy(() -> service.decide(loanId))
                    .isInstanceOf(OrchestrationInProgressException.class);
            first.join(5_000);
            assertThat(service.getLoan(loanId).isFinalized()).isTrue();
        }

        @Test
        @DisplayName("cancelling a run interrupts it and leaves the loan resumable")
        void cancel() throws Exception {
            wire(StubAgent.slow(AgentRole.SALES, Duration.ofMillis(1_500), 70.0),
                    StubAgent.slow(AgentRole.RISK, Duration.ofMillis(1_500), 60.0),
                    StubAgent.slow(AgentRole.COMPLIANCE, Duration.ofMillis(1_500), 75.0));
            String loanId = createLoan(null);
            AtomicReference<Throwable> outcome = new AtomicReference<>();

            Thread runner = new Thread(() -> {
                try {
                    service.decide(loanId);
                } catch (Throwable t) {
                    outcome.set(t);
                }
            });
            runner.start();
            awaitRunning(loanId);
            Thread.sleep(100);

            assertThat(service.cancel(loanId)).isTrue();
            runner.join(5_000);

            assertThat(outcome.get()).isInstanceOf(OrchestrationCancelledException.class);
            LoanSnapshot loan = service.getLoan(loanId);
            assertThat(loan.isFinalized()).isFalse();
            assertThat(loan.status()).isEqualTo(LoanStatus.PENDING);
            assertThat(auditTypes(loanId)).contains(AuditEventType.WORKFLOW_CANCELLED);
        }

        @Test
        @DisplayName("cancel without a run in flight reports false")
        void cancelIdle() throws GraphStateException {
            wire(StubAgent.scoring(AgentRole.SALES, 70.0),
                    StubAgent.scoring(AgentRole.RISK, 60.0),
                    StubAgent.scoring(AgentRole.COMPLIANCE, 75.0));
            String loanId = createLoan(null);

            assertThat(service.cancel(loanId)).isFalse();
        }

        private void awaitRunning(String loanId) throws InterruptedException {
            for (int i = 0; i < 100 && !service.isRunning(loanId); i++) {
                Thread.sleep(10);
            }
            assertThat(service.isRunning(loanId)).isTrue();
        }
    }
}
