package me.golemcore.nsla.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.domain.model.CompileException;
import me.golemcore.nsla.domain.model.CompileMode;
import me.golemcore.nsla.domain.model.CompiledModel;
import me.golemcore.nsla.domain.model.Feedback;
import me.golemcore.nsla.domain.model.FeedbackStatus;
import me.golemcore.nsla.domain.model.Fingerprint;
import me.golemcore.nsla.domain.model.IterationRecord;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;
import me.golemcore.nsla.domain.model.RefinementPolicy;
import me.golemcore.nsla.domain.model.RefinementRequest;
import me.golemcore.nsla.domain.model.SessionFailure;
import me.golemcore.nsla.domain.model.SessionResult;
import me.golemcore.nsla.domain.model.SessionState;
import me.golemcore.nsla.domain.model.StructuralException;
import me.golemcore.nsla.domain.model.ValidationIssue;
import me.golemcore.nsla.domain.model.ValidationResult;
import me.golemcore.nsla.domain.service.BestIterationSelector;
import me.golemcore.nsla.domain.service.ConstraintCompiler;
import me.golemcore.nsla.domain.service.ExpressionCache;
import me.golemcore.nsla.domain.service.ExpressionParser;
import me.golemcore.nsla.domain.service.FeedbackInterpreter;
import me.golemcore.nsla.domain.service.GuardrailValidator;
import me.golemcore.nsla.port.outbound.HistorySummarizerPort;
import me.golemcore.nsla.port.outbound.ProposerPort;
import me.golemcore.nsla.port.outbound.SolverBackendException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded, counterexample-guided refinement loop.
 *
 * <p>
 * State machine:
 *
 * <pre>
 * INIT -> AWAITING_PROPOSAL -> VALIDATING -> SOLVING -> EVALUATING
 *      -> CONVERGED | STALLED | EXHAUSTED | FAILED | CANCELLED
 * </pre>
 *
 * Iteration 0 evaluates the seed program; every later iteration asks the
 * proposer for a new one. After each evaluation the loop stops when the query
 * is entailed ({@code CONVERGED}), when the feedback fingerprint repeats one
 * of the two previous ones ({@code STALLED}), or when the history holds
 * {@code maxIters} iterations ({@code EXHAUSTED}). Termination therefore does
 * not depend on proposer behavior.
 *
 * <p>
 * A session runs on the calling thread. An interrupt is observed at the next
 * state boundary and ends the session as {@code CANCELLED}. Failures never
 * escape as exceptions: they end the session as {@code FAILED} with the
 * committed history intact.
 */
@Slf4j
public class RefinementLoop {

    private final GuardrailValidator validator;
    private final ConstraintCompiler compiler;
    private final FeedbackInterpreter interpreter;
    private final ProposerPort proposer;
    private final HistorySummarizerPort summarizer;
    private final ExpressionParser parser;
    private final RefinementLoopConfig config;
    private final Clock clock;

    public RefinementLoop(GuardrailValidator validator, ConstraintCompiler compiler,
            FeedbackInterpreter interpreter, ProposerPort proposer, HistorySummarizerPort summarizer,
            ExpressionParser parser, RefinementLoopConfig config) {
        this(validator, compiler, interpreter, proposer, summarizer, parser, config, Clock.systemUTC());
    }

    // Visible for testing
    public RefinementLoop(GuardrailValidator validator, ConstraintCompiler compiler,
            FeedbackInterpreter interpreter, ProposerPort proposer, HistorySummarizerPort summarizer,
            ExpressionParser parser, RefinementLoopConfig config, Clock clock) {
        this.validator = validator;
        this.compiler = compiler;
        this.interpreter = interpreter;
        this.proposer = proposer;
        this.summarizer = summarizer;
        this.parser = parser;
        this.config = config;
        this.clock = clock;
    }

    public SessionResult run(RefinementRequest request) {
        Objects.requireNonNull(request.getSeed(), "seed program is required");
        Session session = new Session(request);
        log.info("[Refinement] Session {} started (policy={}, maxIters={}, proposer={})",
                session.id, session.policy, session.maxIters, proposer.getProviderId());

        try {
            session.enter(SessionState.INIT);
            while (true) {
                IterationRecord iteration = runIteration(session);
                session.history.add(iteration);
                SessionState verdict = stopVerdict(session);
                if (verdict != null) {
                    return finish(session, verdict, null);
                }
                session.summary = summarize(session);
            }
        } catch (SessionCancelled e) {
            log.info("[Refinement] Session {} cancelled after {} iteration(s)", session.id,
                    session.history.size());
            return finish(session, SessionState.CANCELLED, null);
        } catch (SessionAbort e) {
            log.warn("[Refinement] Session {} failed ({}): {}", session.id, e.failure.kind(),
                    e.failure.message());
            return finish(session, SessionState.FAILED, e.failure);
        } catch (RuntimeException e) { // NOSONAR - a session ends in a state, never in an exception
            log.error("[Refinement] Session {} failed unexpectedly after {} iteration(s)", session.id,
                    session.history.size(), e);
            return finish(session, SessionState.FAILED,
                    new SessionFailure(SessionFailure.Kind.INTERNAL_ERROR, describe(e)));
        }
    }

    private String summarize(Session session) {
        try {
            return summarizer.summarize(List.copyOf(session.history));
        } catch (RuntimeException e) { // NOSONAR - any summarizer failure ends the session
            throw new SessionAbort(SessionFailure.Kind.INTERNAL_ERROR,
                    "History summarizer failed: " + describe(e));
        }
    }

    // ==================== Iteration ====================

    private IterationRecord runIteration(Session session) {
        int index = session.history.size();
        Program candidate = index == 0 ? session.seed : null;
        int proposals = 0;
        boolean retried = false;
        List<ValidationIssue> retryIssues = List.of();
        String retryError = null;
        Program rejected = null;

        while (true) {
            if (candidate == null) {
                session.enter(SessionState.AWAITING_PROPOSAL);
                proposals++;
                candidate = propose(session, rejected, retryIssues, retryError, proposals);
            }

            session.enter(SessionState.VALIDATING);
            ValidationResult validation = validator.validate(candidate, session.cache);
            CompileMode mode = CompileMode.STRICT;
            if (!validation.ok()) {
                List<ValidationIssue> blocking = validation.blockingIssues();
                log.debug("[Refinement] Session {} iteration {}: {} blocking issue(s)", session.id, index,
                        blocking.size());
                if (session.policy == RefinementPolicy.FAIL_FAST) {
                    throw new SessionAbort(SessionFailure.Kind.VALIDATION_REJECTED,
                            "Guardrail rejected iteration " + index + ": " + blocking);
                }
                if (session.policy == RefinementPolicy.AUTO_RETRY) {
                    if (retried) {
                        throw new SessionAbort(SessionFailure.Kind.RETRY_BUDGET_EXHAUSTED,
                                "Re-proposal for iteration " + index + " was rejected again: " + blocking);
                    }
                    retried = true;
                    retryIssues = blocking;
                    retryError = null;
                    rejected = candidate;
                    candidate = null;
                    continue;
                }
                mode = CompileMode.LENIENT;
            }

            session.enter(SessionState.SOLVING);
            boolean fallbackUsed = false;
            CompiledModel model;
            try {
                model = compiler.compile(candidate, mode, session.cache);
            } catch (CompileException e) {
                if (e.getKind() == CompileException.Kind.SOLVER_ERROR) {
                    throw new SessionAbort(SessionFailure.Kind.SOLVER_ERROR, e.getMessage());
                }
                if (session.policy == RefinementPolicy.AUTO_RETRY) {
                    if (retried) {
                        throw new SessionAbort(SessionFailure.Kind.RETRY_BUDGET_EXHAUSTED,
                                "Re-proposal for iteration " + index + " does not compile: " + e.getMessage());
                    }
                    retried = true;
                    retryIssues = e.getIssues();
                    retryError = e.getMessage();
                    rejected = candidate;
                    candidate = null;
                    continue;
                }
                if (session.policy != RefinementPolicy.FALLBACK_TO_PREVIOUS || session.history.isEmpty()) {
                    throw new SessionAbort(SessionFailure.Kind.COMPILE_ERROR, e.getMessage());
                }
                IterationRecord previous = session.history.get(session.history.size() - 1);
                log.warn("[Refinement] Session {} iteration {} does not compile ({}), re-evaluating iteration {}",
                        session.id, index, e.getMessage(), previous.getIndex());
                candidate = previous.getProgram();
                validation = previous.getValidation();
                mode = previous.getCompileMode();
                fallbackUsed = true;
                model = compileFallback(candidate, mode, session);
            }

            Feedback feedback = evaluate(model, session);
            session.enter(SessionState.EVALUATING);
            log.info("[Refinement] Session {} iteration {}: {} (missing={}, conflicts={})", session.id, index,
                    feedback.status().wireName(), feedback.missingLinks(), feedback.conflictingAxioms());
            return IterationRecord.builder()
                    .index(index)
                    .program(candidate)
                    .validation(validation)
                    .compileMode(mode)
                    .feedback(feedback)
                    .fingerprint(feedback.fingerprint())
                    .proposalAttempts(proposals)
                    .fallbackUsed(fallbackUsed)
                    .timestamp(clock.instant())
                    .build();
        }
    }

    private CompiledModel compileFallback(Program previous, CompileMode mode, Session session) {
        try {
            return compiler.compile(previous, mode, session.cache);
        } catch (CompileException e) {
            SessionFailure.Kind kind = e.getKind() == CompileException.Kind.SOLVER_ERROR
                    ? SessionFailure.Kind.SOLVER_ERROR
                    : SessionFailure.Kind.COMPILE_ERROR;
            throw new SessionAbort(kind, "Previous program no longer compiles: " + e.getMessage());
        }
    }

    private Feedback evaluate(CompiledModel model, Session session) {
        try (model) {
            return interpreter.evaluate(model, session.solverTimeout);
        } catch (SolverBackendException e) {
            throw new SessionAbort(SessionFailure.Kind.SOLVER_ERROR, e.getMessage());
        }
    }

    private Program propose(Session session, Program rejected, List<ValidationIssue> issues, String compileError,
            int attempt) {
        IterationRecord last = session.history.isEmpty() ? null : session.history.get(session.history.size() - 1);
        Program prior = rejected != null ? rejected : last != null ? last.getProgram() : session.seed;
        ProposalContext context = ProposalContext.builder()
                .sessionId(session.id)
                .question(session.question)
                .priorProgram(prior)
                .priorFeedback(last != null ? last.getFeedback() : null)
                .historySummary(session.summary)
                .guardrailIssues(issues)
                .compileError(compileError)
                .attempt(attempt)
                .build();

        CompletableFuture<Program> future;
        try {
            future = proposer.propose(context);
        } catch (StructuralException e) {
            throw new SessionAbort(SessionFailure.Kind.STRUCTURAL_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            throw new SessionAbort(SessionFailure.Kind.PROPOSER_ERROR, describe(e));
        }

        try {
            Program program = future.get(session.proposerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (program == null) {
                throw new SessionAbort(SessionFailure.Kind.PROPOSER_ERROR, "Proposer returned no program");
            }
            return program;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SessionCancelled();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SessionAbort(SessionFailure.Kind.PROPOSER_TIMEOUT,
                    "Proposer did not answer within " + session.proposerTimeout.toMillis() + "ms");
        } catch (CancellationException e) {
            throw new SessionAbort(SessionFailure.Kind.PROPOSER_ERROR, "Proposal was cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StructuralException) {
                throw new SessionAbort(SessionFailure.Kind.STRUCTURAL_ERROR, cause.getMessage());
            }
            if (cause instanceof TimeoutException) {
                throw new SessionAbort(SessionFailure.Kind.PROPOSER_TIMEOUT, describe(cause));
            }
            throw new SessionAbort(SessionFailure.Kind.PROPOSER_ERROR, describe(cause));
        }
    }

    // ==================== Stop conditions ====================

    /**
     * Terminal state after the latest iteration, or {@code null} to continue.
     */
    private SessionState stopVerdict(Session session) {
        List<IterationRecord> history = session.history;
        IterationRecord latest = history.get(history.size() - 1);
        if (latest.getFeedback().status() == FeedbackStatus.CONSISTENT_ENTAILS) {
            return SessionState.CONVERGED;
        }
        Fingerprint fingerprint = latest.getFingerprint();
        for (int back = 2; back <= 3 && history.size() - back >= 0; back++) {
            if (fingerprint.equals(history.get(history.size() - back).getFingerprint())) {
                log.info("[Refinement] Session {} fingerprint repeats iteration {}", session.id,
                        history.get(history.size() - back).getIndex());
                return SessionState.STALLED;
            }
        }
        if (history.size() >= session.maxIters) {
            return SessionState.EXHAUSTED;
        }
        return null;
    }

    private SessionResult finish(Session session, SessionState terminal, SessionFailure failure) {
        session.trace.add(terminal);
        List<IterationRecord> history = List.copyOf(session.history);
        IterationRecord best = BestIterationSelector.select(history).orElse(null);
        session.cache.clear();
        log.info("[Refinement] Session {} finished: {} after {} iteration(s), best={}", session.id, terminal,
                history.size(), best != null ? best.getIndex() : "none");
        return SessionResult.builder()
                .sessionId(session.id)
                .terminalState(terminal)
                .stateTrace(List.copyOf(session.trace))
                .history(history)
                .bestIteration(best)
                .failure(failure)
                .build();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    // ==================== Session state ====================

    /**
     * Mutable state of one run. Confined to the session thread.
     */
    private final class Session {

        private final String id;
        private final String question;
        private final Program seed;
        private final RefinementPolicy policy;
        private final int maxIters;
        private final Duration solverTimeout;
        private final Duration proposerTimeout;
        private final ExpressionCache cache;
        private final List<IterationRecord> history = new ArrayList<>();
        private final List<SessionState> trace = new ArrayList<>();
        private String summary;

        private Session(RefinementRequest request) {
            this.id = request.getSessionId() != null ? request.getSessionId() : UUID.randomUUID().toString();
            this.question = request.getQuestion();
            this.seed = request.getSeed();
            this.policy = request.getPolicy() != null ? request.getPolicy() : config.getPolicy();
            this.maxIters = Math.max(1, request.getMaxIters() != null ? request.getMaxIters() : config.getMaxIters());
            this.solverTimeout = Duration.ofMillis(config.getSolverTimeoutMs());
            this.proposerTimeout = Duration.ofMillis(config.getProposerTimeoutMs());
            this.cache = new ExpressionCache(parser);
        }

        private void enter(SessionState state) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SessionCancelled();
            }
            trace.add(state);
        }
    }

    private static final class SessionAbort extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final transient SessionFailure failure;

        private SessionAbort(SessionFailure.Kind kind, String message) {
            super(message, null, false, false);
            this.failure = new SessionFailure(kind, message);
        }
    }

    private static final class SessionCancelled extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private SessionCancelled() {
            super("Session interrupted", null, false, false);
        }
    }
}
