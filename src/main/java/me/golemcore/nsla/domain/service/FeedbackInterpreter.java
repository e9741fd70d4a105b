package me.golemcore.nsla.domain.service;

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
import me.golemcore.nsla.domain.model.CompiledModel;
import me.golemcore.nsla.domain.model.Expression;
import me.golemcore.nsla.domain.model.Feedback;
import me.golemcore.nsla.domain.model.ParsedClause;
import me.golemcore.nsla.domain.model.SolverCheck;
import me.golemcore.nsla.domain.model.SolverFormula;
import me.golemcore.nsla.domain.model.TrackedAssertion;
import me.golemcore.nsla.port.outbound.SolverContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the solver over a compiled model and turns the verdict into
 * diagnostics.
 *
 * <p>
 * Order of checks: base consistency, then entailment of the query
 * ({@code base and not query} unsatisfiable). Missing links are computed only
 * when the base is consistent and the query is not entailed. They are
 * best-effort: neither minimal nor unique. Stateless; every check runs on a
 * fresh solver instance.
 */
@Slf4j
public class FeedbackInterpreter {

    private final Duration defaultTimeout;

    public FeedbackInterpreter(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public Feedback evaluate(CompiledModel model) {
        return evaluate(model, defaultTimeout);
    }

    /**
     * @throws me.golemcore.nsla.port.outbound.SolverBackendException
     *             if the backend crashes; an undecided check is reported as
     *             {@code unknown} instead
     */
    public Feedback evaluate(CompiledModel model, Duration timeout) {
        SolverContext context = model.context();
        List<TrackedAssertion> base = model.baseAssertions();

        SolverCheck consistency = context.check(base, List.of(), timeout);
        switch (consistency.verdict()) {
        case UNKNOWN:
            log.debug("[Feedback] Consistency check undecided: {}", consistency.reasonUnknown());
            return Feedback.unknown(consistency.reasonUnknown());
        case UNSAT:
            List<String> conflicts = conflictingLabels(base, consistency.unsatCore());
            log.debug("[Feedback] Base is inconsistent, core: {}", conflicts);
            return Feedback.inconsistent(conflicts);
        default:
            break;
        }

        Optional<SolverFormula> query = model.queryFormula();
        if (query.isEmpty()) {
            return Feedback.noEntailment(List.of(), "Consistent; no query was requested");
        }

        SolverFormula negatedQuery = context.not(query.get());
        SolverCheck entailment = context.check(base, List.of(negatedQuery), timeout);
        switch (entailment.verdict()) {
        case UNSAT:
            return Feedback.entails();
        case UNKNOWN:
            log.debug("[Feedback] Entailment check undecided: {}", entailment.reasonUnknown());
            return Feedback.unknown(entailment.reasonUnknown());
        default:
            List<String> missing = missingLinks(model, negatedQuery, timeout);
            log.debug("[Feedback] Query not entailed, missing links: {}", missing);
            return Feedback.noEntailment(missing, missing.isEmpty()
                    ? "Consistent; the query is not entailed"
                    : "Consistent; the query is not entailed, missing: " + String.join(", ", missing));
        }
    }

    /**
     * Rule and axiom labels from the core. Fact labels are reported only when
     * the core holds no rule or axiom.
     */
    private List<String> conflictingLabels(List<TrackedAssertion> base, List<String> core) {
        Map<String, TrackedAssertion> byLabel = base.stream()
                .collect(Collectors.toMap(TrackedAssertion::label, Function.identity()));
        List<String> reported = core.isEmpty()
                ? base.stream().map(TrackedAssertion::label).toList()
                : core;
        List<String> clauses = reported.stream()
                .filter(label -> byLabel.containsKey(label) && byLabel.get(label).isClause())
                .sorted()
                .toList();
        return clauses.isEmpty() ? reported.stream().sorted().toList() : clauses;
    }

    // ==================== Missing links ====================

    private List<String> missingLinks(CompiledModel model, SolverFormula negatedQuery, Duration timeout) {
        Expression query = model.query().orElseThrow();
        Set<String> queryPredicates = query.predicateNames();
        List<TrackedAssertion> base = model.baseAssertions();

        Set<String> flipping = new TreeSet<>();
        for (Expression.Atom candidate : backwardCandidates(model.clauses(), queryPredicates)) {
            Optional<SolverFormula> forced = model.atomFormula(candidate);
            if (forced.isEmpty()) {
                continue;
            }
            SolverCheck check = model.context().check(base, List.of(negatedQuery, forced.get()), timeout);
            if (check.isUnsat()) {
                flipping.add(candidate.predicate());
            }
        }
        if (!flipping.isEmpty()) {
            return List.copyOf(flipping);
        }
        return unsupportedPremises(model, queryPredicates, timeout);
    }

    /**
     * Atoms reachable by walking clause conditions backwards from the query
     * predicates. Atoms of the query predicates themselves are left out:
     * forcing them would trivially flip the verdict.
     */
    private static Set<Expression.Atom> backwardCandidates(List<ParsedClause> clauses, Set<String> queryPredicates) {
        Set<String> targets = new LinkedHashSet<>(queryPredicates);
        Set<Expression.Atom> candidates = new LinkedHashSet<>();
        boolean grown = true;
        while (grown) {
            grown = false;
            for (ParsedClause clause : clauses) {
                if (!clause.concludesAny(targets)) {
                    continue;
                }
                for (Expression.Atom atom : clause.condition().atoms()) {
                    if (queryPredicates.contains(atom.predicate())) {
                        continue;
                    }
                    candidates.add(atom);
                    grown |= targets.add(atom.predicate());
                }
            }
        }
        return candidates;
    }

    /**
     * Fallback when no single candidate flips the verdict: condition atoms of
     * clauses concluding a query predicate that the base does not entail, or
     * the query predicates when nothing concludes them.
     */
    private List<String> unsupportedPremises(CompiledModel model, Set<String> queryPredicates, Duration timeout) {
        List<ParsedClause> concluding = new ArrayList<>();
        for (ParsedClause clause : model.clauses()) {
            if (clause.concludesAny(queryPredicates)) {
                concluding.add(clause);
            }
        }
        if (concluding.isEmpty()) {
            return List.copyOf(new TreeSet<>(queryPredicates));
        }

        Set<String> missing = new TreeSet<>();
        for (ParsedClause clause : concluding) {
            for (Expression.Atom atom : clause.condition().atoms()) {
                if (queryPredicates.contains(atom.predicate()) || missing.contains(atom.predicate())) {
                    continue;
                }
                Optional<SolverFormula> formula = model.atomFormula(atom);
                if (formula.isEmpty()) {
                    continue;
                }
                SolverCheck entailed = model.context().check(model.baseAssertions(),
                        List.of(model.context().not(formula.get())), timeout);
                if (!entailed.isUnsat()) {
                    missing.add(atom.predicate());
                }
            }
        }
        return List.copyOf(missing);
    }
}
