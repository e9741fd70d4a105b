package me.golemcore.nsla.domain.loop;

import me.golemcore.nsla.adapter.outbound.solver.Z3SolverAdapter;
import me.golemcore.nsla.domain.model.CompileMode;
import me.golemcore.nsla.domain.model.Fact;
import me.golemcore.nsla.domain.model.FeedbackStatus;
import me.golemcore.nsla.domain.model.IterationRecord;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;
import me.golemcore.nsla.domain.model.RefinementPolicy;
import me.golemcore.nsla.domain.model.RefinementRequest;
import me.golemcore.nsla.domain.model.Rule;
import me.golemcore.nsla.domain.model.SessionFailure;
import me.golemcore.nsla.domain.model.SessionResult;
import me.golemcore.nsla.domain.model.SessionState;
import me.golemcore.nsla.domain.model.StructuralException;
import me.golemcore.nsla.domain.service.ConstraintCompiler;
import me.golemcore.nsla.domain.service.DefaultHistorySummarizer;
import me.golemcore.nsla.domain.service.ExpressionParser;
import me.golemcore.nsla.domain.service.FeedbackInterpreter;
import me.golemcore.nsla.domain.service.GuardrailValidator;
import me.golemcore.nsla.port.outbound.HistorySummarizerPort;
import me.golemcore.nsla.port.outbound.ProposerPort;
import me.golemcore.nsla.port.outbound.SolverBackendException;
import me.golemcore.nsla.port.outbound.SolverPort;
import me.golemcore.nsla.testsupport.Programs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.nsla.domain.model.SessionState.AWAITING_PROPOSAL;
import static me.golemcore.nsla.domain.model.SessionState.CONVERGED;
import static me.golemcore.nsla.domain.model.SessionState.EVALUATING;
import static me.golemcore.nsla.domain.model.SessionState.INIT;
import static me.golemcore.nsla.domain.model.SessionState.SOLVING;
import static me.golemcore.nsla.domain.model.SessionState.VALIDATING;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefinementLoopTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ExpressionParser parser = new ExpressionParser();
    private final GuardrailValidator validator = new GuardrailValidator(parser, "2.1",
            GuardrailValidator.DEFAULT_ADVISORY_KINDS);
    private final FeedbackInterpreter interpreter = new FeedbackInterpreter(Duration.ofSeconds(5));
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private ProposerPort proposer;
    private HistorySummarizerPort summarizer = new DefaultHistorySummarizer(3);

    @BeforeEach
    void setUp() {
        proposer = mock(ProposerPort.class);
        when(proposer.getProviderId()).thenReturn("mock");
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RefinementLoop loop(RefinementPolicy policy, int maxIters) {
        return loop(policy, maxIters, 2000, new Z3SolverAdapter());
    }

    private RefinementLoop loop(RefinementPolicy policy, int maxIters, long proposerTimeoutMs,
            SolverPort solverPort) {
        RefinementLoopConfig config = RefinementLoopConfig.builder()
                .policy(policy)
                .maxIters(maxIters)
                .proposerTimeoutMs(proposerTimeoutMs)
                .build();
        ConstraintCompiler compiler = new ConstraintCompiler(solverPort, validator, parser);
        return new RefinementLoop(validator, compiler, interpreter, proposer, summarizer,
                parser, config, clock);
    }

    private static RefinementRequest request(Program seed) {
        return RefinementRequest.builder()
                .sessionId("s-1")
                .question("Is the debtor liable for the damage?")
                .seed(seed)
                .build();
    }

    @SafeVarargs
    private void proposerReturns(CompletableFuture<Program>... answers) {
        when(proposer.propose(any())).thenReturn(answers[0],
                Arrays.copyOfRange(answers, 1, answers.length));
    }

    private static CompletableFuture<Program> done(Program program) {
        return CompletableFuture.completedFuture(program);
    }

    private static Program missingDamage() {
        Program base = Programs.contractualLiability();
        List<Fact> facts = new ArrayList<>(base.getFacts());
        facts.removeIf(fact -> fact.predicate().equals("DannoPatrimoniale"));
        return base.toBuilder().facts(facts).build();
    }

    private static Program undeclaredPredicate() {
        return Programs.contractualLiabilityBuilder()
                .rules(List.of(new Rule("r1", "Colpa(d) and NessoCausale(d,x)", Programs.QUERY)))
                .build();
    }

    private static Program unparsable() {
        return Programs.contractualLiabilityBuilder()
                .rules(List.of(new Rule("r1", "Inadempimento(d,c) and (", Programs.QUERY)))
                .build();
    }

    // ===== Convergence =====

    @Test
    void shouldConvergeOnSeedWithoutProposing() {
        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3)
                .run(request(Programs.contractualLiabilityWithCausalLink()));

        assertEquals(CONVERGED, result.getTerminalState());
        assertTrue(result.isConverged());
        assertEquals(List.of(INIT, VALIDATING, SOLVING, EVALUATING, CONVERGED), result.getStateTrace());
        assertEquals(1, result.getHistory().size());
        assertEquals(0, result.best().orElseThrow().getIndex());
        assertTrue(result.failureDetails().isEmpty());
        verify(proposer, never()).propose(any());
    }

    @Test
    void shouldConvergeAfterProposerAddsMissingLink() {
        proposerReturns(done(Programs.contractualLiabilityWithCausalLink()));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        assertEquals(CONVERGED, result.getTerminalState());
        assertEquals(List.of(INIT, VALIDATING, SOLVING, EVALUATING, AWAITING_PROPOSAL, VALIDATING, SOLVING,
                EVALUATING, CONVERGED), result.getStateTrace());
        assertEquals(FeedbackStatus.CONSISTENT_NO_ENTAILMENT, result.getHistory().get(0).getFeedback().status());
        assertEquals(List.of("NessoCausale"), result.getHistory().get(0).getFeedback().missingLinks());
        assertEquals(1, result.getBestIteration().getIndex());

        ArgumentCaptor<ProposalContext> captor = ArgumentCaptor.forClass(ProposalContext.class);
        verify(proposer).propose(captor.capture());
        ProposalContext context = captor.getValue();
        assertEquals("s-1", context.getSessionId());
        assertEquals("Is the debtor liable for the damage?", context.getQuestion());
        assertEquals(Programs.contractualLiability(), context.getPriorProgram());
        assertEquals(List.of("NessoCausale"), context.getPriorFeedback().missingLinks());
        assertTrue(context.getHistorySummary().contains("iter 0"));
        assertFalse(context.isRetry());
        assertEquals(1, context.getAttempt());
    }

    @Test
    void shouldRecordIterationDetails() {
        proposerReturns(done(Programs.contractualLiabilityWithCausalLink()));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        IterationRecord seed = result.getHistory().get(0);
        IterationRecord proposed = result.getHistory().get(1);
        assertEquals(0, seed.getProposalAttempts());
        assertEquals(1, proposed.getProposalAttempts());
        assertEquals(CompileMode.STRICT, proposed.getCompileMode());
        assertTrue(proposed.getValidation().ok());
        assertEquals(proposed.getFeedback().fingerprint(), proposed.getFingerprint());
        assertEquals(NOW, proposed.getTimestamp());
        assertFalse(proposed.isFallbackUsed());
    }

    // ===== Stop conditions =====

    @Test
    void shouldStallWhenProposerRepeatsProgram() {
        proposerReturns(done(Programs.contractualLiability()));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 5).run(request(Programs.contractualLiability()));

        assertEquals(SessionState.STALLED, result.getTerminalState());
        assertEquals(2, result.getHistory().size());
        assertEquals(0, result.getBestIteration().getIndex());
    }

    @Test
    void shouldStallWhenFeedbackOscillates() {
        proposerReturns(done(missingDamage()), done(Programs.contractualLiability()));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 5).run(request(Programs.contractualLiability()));

        assertEquals(SessionState.STALLED, result.getTerminalState());
        assertEquals(3, result.getHistory().size());
        assertEquals(List.of("DannoPatrimoniale", "NessoCausale"),
                result.getHistory().get(1).getFeedback().missingLinks());
        assertEquals(0, result.getBestIteration().getIndex());
    }

    @Test
    void shouldExhaustIterationBudget() {
        proposerReturns(done(missingDamage()));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 2).run(request(Programs.contractualLiability()));

        assertEquals(SessionState.EXHAUSTED, result.getTerminalState());
        assertEquals(2, result.getHistory().size());
        assertEquals(0, result.getBestIteration().getIndex());
    }

    @Test
    void shouldStopAfterSeedWhenBudgetIsOne() {
        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 1).run(request(Programs.contractualLiability()));

        assertEquals(SessionState.EXHAUSTED, result.getTerminalState());
        assertEquals(1, result.getHistory().size());
        verify(proposer, never()).propose(any());
    }

    @Test
    void shouldLetRequestOverrideConfiguredBudget() {
        RefinementRequest request = RefinementRequest.builder()
                .seed(Programs.contractualLiability())
                .maxIters(1)
                .build();

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 5).run(request);

        assertEquals(SessionState.EXHAUSTED, result.getTerminalState());
        assertNotNull(result.getSessionId());
    }

    // ===== Policies =====

    @Test
    void shouldFailFastOnBlockingIssues() {
        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(undeclaredPredicate()));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(List.of(INIT, VALIDATING, SessionState.FAILED), result.getStateTrace());
        assertEquals(SessionFailure.Kind.VALIDATION_REJECTED, result.getFailure().kind());
        assertTrue(result.getHistory().isEmpty());
        assertTrue(result.best().isEmpty());
    }

    @Test
    void shouldRetryOnceWithGuardrailIssues() {
        proposerReturns(done(undeclaredPredicate()), done(Programs.contractualLiabilityWithCausalLink()));

        SessionResult result = loop(RefinementPolicy.AUTO_RETRY, 3).run(request(Programs.contractualLiability()));

        assertEquals(CONVERGED, result.getTerminalState());
        assertEquals(List.of(INIT, VALIDATING, SOLVING, EVALUATING, AWAITING_PROPOSAL, VALIDATING,
                AWAITING_PROPOSAL, VALIDATING, SOLVING, EVALUATING, CONVERGED), result.getStateTrace());
        assertEquals(2, result.getHistory().get(1).getProposalAttempts());

        ArgumentCaptor<ProposalContext> captor = ArgumentCaptor.forClass(ProposalContext.class);
        verify(proposer, times(2)).propose(captor.capture());
        ProposalContext retry = captor.getAllValues().get(1);
        assertTrue(retry.isRetry());
        assertEquals(2, retry.getAttempt());
        assertEquals(undeclaredPredicate(), retry.getPriorProgram());
        assertTrue(retry.getGuardrailIssues().get(0).detail().contains("Colpa"));
    }

    @Test
    void shouldRetrySeedWithBlockingIssues() {
        proposerReturns(done(Programs.contractualLiabilityWithCausalLink()));

        SessionResult result = loop(RefinementPolicy.AUTO_RETRY, 3).run(request(undeclaredPredicate()));

        assertEquals(CONVERGED, result.getTerminalState());
        assertEquals(1, result.getHistory().size());
        assertEquals(1, result.getHistory().get(0).getProposalAttempts());
    }

    @Test
    void shouldFailWhenRetryIsRejectedAgain() {
        proposerReturns(done(undeclaredPredicate()), done(undeclaredPredicate()));

        SessionResult result = loop(RefinementPolicy.AUTO_RETRY, 3).run(request(Programs.contractualLiability()));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(SessionFailure.Kind.RETRY_BUDGET_EXHAUSTED, result.getFailure().kind());
        assertEquals(1, result.getHistory().size());
        assertEquals(0, result.getBestIteration().getIndex());
    }

    @Test
    void shouldCompileLenientlyUnderFallbackPolicy() {
        proposerReturns(done(undeclaredPredicate()));

        SessionResult result = loop(RefinementPolicy.FALLBACK_TO_PREVIOUS, 2)
                .run(request(Programs.contractualLiability()));

        IterationRecord lenient = result.getHistory().get(1);
        assertEquals(CompileMode.LENIENT, lenient.getCompileMode());
        assertFalse(lenient.getValidation().ok());
        assertFalse(lenient.isFallbackUsed());
        assertEquals(SessionState.EXHAUSTED, result.getTerminalState());
    }

    @Test
    void shouldReevaluatePreviousProgramWhenLenientCompileFails() {
        proposerReturns(done(unparsable()));

        SessionResult result = loop(RefinementPolicy.FALLBACK_TO_PREVIOUS, 5)
                .run(request(Programs.contractualLiability()));

        IterationRecord fallback = result.getHistory().get(1);
        assertTrue(fallback.isFallbackUsed());
        assertEquals(Programs.contractualLiability(), fallback.getProgram());
        assertEquals(CompileMode.STRICT, fallback.getCompileMode());
        assertEquals(SessionState.STALLED, result.getTerminalState());
    }

    @Test
    void shouldFailWhenSeedCannotCompileWithoutPrevious() {
        SessionResult result = loop(RefinementPolicy.FALLBACK_TO_PREVIOUS, 3).run(request(unparsable()));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(SessionFailure.Kind.COMPILE_ERROR, result.getFailure().kind());
        assertTrue(result.getHistory().isEmpty());
    }

    @Test
    void shouldLetRequestOverrideConfiguredPolicy() {
        proposerReturns(done(Programs.contractualLiabilityWithCausalLink()));
        RefinementRequest request = RefinementRequest.builder()
                .seed(undeclaredPredicate())
                .policy(RefinementPolicy.AUTO_RETRY)
                .build();

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request);

        assertEquals(CONVERGED, result.getTerminalState());
    }

    // ===== Proposer failures =====

    @Test
    void shouldFailOnProposerTimeout() {
        proposerReturns(new CompletableFuture<>());

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3, 50, new Z3SolverAdapter())
                .run(request(Programs.contractualLiability()));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(SessionFailure.Kind.PROPOSER_TIMEOUT, result.getFailure().kind());
        assertEquals(1, result.getHistory().size());
        assertEquals(0, result.getBestIteration().getIndex());
    }

    @Test
    void shouldFailOnProposerError() {
        proposerReturns(CompletableFuture.failedFuture(new IllegalStateException("model unavailable")));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        assertEquals(SessionFailure.Kind.PROPOSER_ERROR, result.getFailure().kind());
        assertEquals("model unavailable", result.getFailure().message());
    }

    @Test
    void shouldFailOnMalformedProposal() {
        proposerReturns(CompletableFuture.failedFuture(new StructuralException("Missing predicate name")));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        assertEquals(SessionFailure.Kind.STRUCTURAL_ERROR, result.getFailure().kind());
    }

    @Test
    void shouldFailWhenProposerThrowsSynchronously() {
        when(proposer.propose(any())).thenThrow(new StructuralException("Program version is required"));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        assertEquals(SessionFailure.Kind.STRUCTURAL_ERROR, result.getFailure().kind());
        assertEquals(1, result.getHistory().size());
    }

    @Test
    void shouldFailWhenProposerReturnsNothing() {
        proposerReturns(done(null));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        assertEquals(SessionFailure.Kind.PROPOSER_ERROR, result.getFailure().kind());
    }

    // ===== Solver =====

    @Test
    void shouldFailOnSolverError() {
        SolverPort solverPort = mock(SolverPort.class);
        when(solverPort.getBackendId()).thenReturn("mock");
        when(solverPort.openContext()).thenThrow(new SolverBackendException("native crash"));

        SessionResult result = loop(RefinementPolicy.FALLBACK_TO_PREVIOUS, 3, 2000, solverPort)
                .run(request(Programs.contractualLiability()));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(SessionFailure.Kind.SOLVER_ERROR, result.getFailure().kind());
        assertEquals(List.of(INIT, VALIDATING, SOLVING, SessionState.FAILED), result.getStateTrace());
    }

    // ===== Unexpected failures =====

    @Test
    void shouldFailWhenSummarizerThrows() {
        summarizer = history -> {
            throw new IllegalStateException("summarizer down");
        };

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(missingDamage()));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(SessionFailure.Kind.INTERNAL_ERROR, result.getFailure().kind());
        assertTrue(result.getFailure().message().contains("summarizer down"));
        assertEquals(1, result.getHistory().size());
        verify(proposer, never()).propose(any());
    }

    @Test
    void shouldFailWhenSolverThrowsUnexpectedException() {
        SolverPort solverPort = mock(SolverPort.class);
        when(solverPort.getBackendId()).thenReturn("mock");
        when(solverPort.openContext()).thenThrow(new IllegalStateException("context pool closed"));

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3, 2000, solverPort)
                .run(request(Programs.contractualLiability()));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(SessionFailure.Kind.INTERNAL_ERROR, result.getFailure().kind());
        assertEquals("context pool closed", result.getFailure().message());
        assertTrue(result.getHistory().isEmpty());
    }

    @Test
    void shouldFailCleanlyOnDeeplyNestedFormula() {
        String nested = "(".repeat(20000) + "Inadempimento(d,c)" + ")".repeat(20000);
        Program seed = Programs.contractualLiabilityBuilder()
                .rules(List.of(new Rule("r1", nested, Programs.QUERY)))
                .build();

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(seed));

        assertEquals(SessionState.FAILED, result.getTerminalState());
        assertEquals(SessionFailure.Kind.VALIDATION_REJECTED, result.getFailure().kind());
    }

    // ===== Cancellation =====

    @Test
    void shouldCancelWhenInterruptedBeforeStart() {
        Thread.currentThread().interrupt();

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        assertEquals(SessionState.CANCELLED, result.getTerminalState());
        assertEquals(List.of(SessionState.CANCELLED), result.getStateTrace());
        assertTrue(result.getHistory().isEmpty());
    }

    @Test
    void shouldCancelWhileAwaitingProposalAndKeepHistory() {
        when(proposer.propose(any())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return new CompletableFuture<Program>();
        });

        SessionResult result = loop(RefinementPolicy.FAIL_FAST, 3).run(request(Programs.contractualLiability()));

        assertEquals(SessionState.CANCELLED, result.getTerminalState());
        assertEquals(1, result.getHistory().size());
        assertEquals(0, result.getBestIteration().getIndex());
        assertTrue(Thread.interrupted());
    }

    @Test
    void shouldRequireSeed() {
        RefinementLoop loop = loop(RefinementPolicy.FAIL_FAST, 3);
        RefinementRequest request = RefinementRequest.builder().build();

        assertThrows(NullPointerException.class, () -> loop.run(request));
    }
}
