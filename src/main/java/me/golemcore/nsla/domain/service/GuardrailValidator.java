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
import me.golemcore.nsla.domain.model.Axiom;
import me.golemcore.nsla.domain.model.ConstantDecl;
import me.golemcore.nsla.domain.model.Expression;
import me.golemcore.nsla.domain.model.Fact;
import me.golemcore.nsla.domain.model.IssueKind;
import me.golemcore.nsla.domain.model.ParseException;
import me.golemcore.nsla.domain.model.ParsedClause;
import me.golemcore.nsla.domain.model.PredicateDecl;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.Rule;
import me.golemcore.nsla.domain.model.ValidationIssue;
import me.golemcore.nsla.domain.model.ValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Static, read-only checker run before compilation.
 *
 * <p>
 * Accumulates every issue it finds (it never stops at the first one) and
 * reports them grouped by {@link IssueKind} in declaration order. The result
 * is {@code ok} when every issue belongs to the configured advisory kinds.
 * Validation never mutates the program and is idempotent.
 */
@Slf4j
public class GuardrailValidator {

    public static final Set<IssueKind> DEFAULT_ADVISORY_KINDS = Set.copyOf(EnumSet.of(
            IssueKind.CONTRADICTION, IssueKind.UNDECLARED_CONSTANT, IssueKind.VERSION_MISMATCH));

    private static final String QUERY_SUBJECT = "query";

    private final ExpressionParser parser;
    private final String dslVersion;
    private final Set<IssueKind> advisoryKinds;

    public GuardrailValidator(ExpressionParser parser, String dslVersion, Collection<IssueKind> advisoryKinds) {
        this.parser = parser;
        this.dslVersion = dslVersion;
        this.advisoryKinds = advisoryKinds == null || advisoryKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(advisoryKinds));
    }

    public GuardrailValidator(ExpressionParser parser) {
        this(parser, null, DEFAULT_ADVISORY_KINDS);
    }

    public Set<IssueKind> getAdvisoryKinds() {
        return advisoryKinds;
    }

    public ValidationResult validate(Program program) {
        return validate(program, new ExpressionCache(parser));
    }

    public ValidationResult validate(Program program, ExpressionCache cache) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<ParsedClause> clauses = new ArrayList<>();

        checkVersion(program, issues);
        checkFacts(program, issues);
        checkRules(program, cache, issues, clauses);
        checkAxioms(program, cache, issues, clauses);
        checkQuery(program, cache, issues);
        checkContradictions(program, clauses, issues);
        checkDuplicateIds(program, issues);

        List<ValidationIssue> ordered = issues.stream()
                .distinct()
                .sorted(Comparator.comparing(ValidationIssue::kind))
                .toList();
        boolean ok = ordered.stream().allMatch(issue -> advisoryKinds.contains(issue.kind()));
        if (!ordered.isEmpty()) {
            log.debug("[Guardrail] {} issue(s), ok={}: {}", ordered.size(), ok, ordered);
        }
        return new ValidationResult(ok, ordered, advisoryKinds);
    }

    // ==================== Per-element checks ====================

    private void checkVersion(Program program, List<ValidationIssue> issues) {
        if (dslVersion != null && !dslVersion.isBlank() && !dslVersion.equals(program.getVersion())) {
            issues.add(new ValidationIssue(IssueKind.VERSION_MISMATCH, "program",
                    "version '" + program.getVersion() + "' is not supported, expected '" + dslVersion + "'"));
        }
    }

    private void checkFacts(Program program, List<ValidationIssue> issues) {
        for (Fact fact : program.getFacts()) {
            checkAtom(program, fact.toAtom(), "fact:" + fact.toAtom().render(), false, issues);
        }
    }

    private void checkRules(Program program, ExpressionCache cache, List<ValidationIssue> issues,
            List<ParsedClause> clauses) {
        for (Rule rule : program.getRules()) {
            String subject = "rule:" + rule.id();
            Optional<Expression> condition = parse(rule.condition(), subject, "condition", cache, issues);
            Optional<Expression> conclusion = parse(rule.conclusion(), subject, "conclusion", cache, issues);
            condition.ifPresent(expression -> checkAtoms(program, expression, subject, issues));
            conclusion.ifPresent(expression -> checkAtoms(program, expression, subject, issues));
            if (condition.isPresent() && conclusion.isPresent()) {
                clauses.add(ParsedClause.fromRule(rule.id(), condition.get(), conclusion.get()));
            }
        }
    }

    private void checkAxioms(Program program, ExpressionCache cache, List<ValidationIssue> issues,
            List<ParsedClause> clauses) {
        for (Axiom axiom : program.getAxioms()) {
            String subject = "axiom:" + axiom.id();
            Optional<Expression> formula = parse(axiom.formula(), subject, "formula", cache, issues);
            formula.ifPresent(expression -> {
                checkAtoms(program, expression, subject, issues);
                clauses.add(ParsedClause.fromAxiom(axiom.id(), expression));
            });
        }
    }

    private void checkQuery(Program program, ExpressionCache cache, List<ValidationIssue> issues) {
        if (!program.hasQuery()) {
            issues.add(new ValidationIssue(IssueKind.QUERY_ISSUE, QUERY_SUBJECT, "query is absent or blank"));
            return;
        }
        Expression query;
        try {
            query = cache.parse(program.getQuery());
        } catch (ParseException e) {
            issues.add(new ValidationIssue(IssueKind.QUERY_ISSUE, QUERY_SUBJECT,
                    "query does not parse: " + e.getMessage()));
            return;
        }
        checkAtoms(program, query, QUERY_SUBJECT, issues);
    }

    private Optional<Expression> parse(String text, String subject, String part, ExpressionCache cache,
            List<ValidationIssue> issues) {
        try {
            return Optional.of(cache.parse(text));
        } catch (ParseException e) {
            issues.add(new ValidationIssue(IssueKind.PARSE_ERROR, subject, part + ": " + e.getMessage()));
            return Optional.empty();
        }
    }

    private void checkAtoms(Program program, Expression expression, String subject,
            List<ValidationIssue> issues) {
        for (Expression.Atom atom : expression.atoms()) {
            checkAtom(program, atom, subject, QUERY_SUBJECT.equals(subject), issues);
        }
    }

    private void checkAtom(Program program, Expression.Atom atom, String subject, boolean inQuery,
            List<ValidationIssue> issues) {
        Optional<PredicateDecl> declared = program.findPredicate(atom.predicate());
        if (declared.isEmpty() && program.isRuntimeFlag(atom.predicate())) {
            if (atom.arity() != 0) {
                issues.add(new ValidationIssue(IssueKind.ARITY_MISMATCH, subject,
                        "'" + atom.render() + "' uses " + atom.arity() + " argument(s), runtime flag '"
                                + atom.predicate() + "' takes none"));
            }
            return;
        }
        if (declared.isEmpty()) {
            issues.add(new ValidationIssue(inQuery ? IssueKind.QUERY_ISSUE : IssueKind.UNDECLARED_PREDICATE,
                    subject, "predicate '" + atom.predicate() + "' is not declared"));
            return;
        }
        PredicateDecl predicate = declared.get();
        if (predicate.arity() != atom.arity()) {
            issues.add(new ValidationIssue(IssueKind.ARITY_MISMATCH, subject,
                    "'" + atom.render() + "' uses " + atom.arity() + " argument(s), "
                            + predicate.signature() + " is declared"));
            return;
        }
        for (int i = 0; i < atom.arity(); i++) {
            String arg = atom.args().get(i);
            String expectedSort = predicate.argSorts().get(i);
            Optional<ConstantDecl> constant = program.findConstant(arg);
            if (constant.isPresent()) {
                if (!program.isSubsort(constant.get().sort(), expectedSort)) {
                    issues.add(new ValidationIssue(IssueKind.SORT_MISMATCH, subject,
                            "argument " + (i + 1) + " of '" + atom.render() + "' is '" + arg + "' of sort '"
                                    + constant.get().sort() + "', expected '" + expectedSort + "'"));
                }
            } else if (!predicate.allowUndeclaredInstances()) {
                issues.add(new ValidationIssue(IssueKind.UNDECLARED_CONSTANT, subject,
                        "'" + arg + "' in '" + atom.render() + "' is not a declared constant"));
            }
        }
    }

    // ==================== Cross-element checks ====================

    /**
     * Flags two clauses that conclude an atom with opposite polarity when the
     * condition set of one is contained in the other's. Conservative: only
     * literal conjuncts of conclusions are compared.
     */
    private void checkContradictions(Program program, List<ParsedClause> clauses,
            List<ValidationIssue> issues) {
        List<ClauseLiterals> candidates = new ArrayList<>();
        for (Fact fact : program.getFacts()) {
            candidates.add(new ClauseLiterals(fact.label(), Set.of(),
                    List.of(new Literal(fact.toAtom(), fact.value()))));
        }
        for (ParsedClause clause : clauses) {
            String label = clause.kind().name().toLowerCase(Locale.ROOT) + ":" + clause.label();
            candidates.add(new ClauseLiterals(label, new HashSet<>(clause.conditionConjuncts()),
                    literals(clause.conclusion())));
        }

        Set<String> reported = new LinkedHashSet<>();
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                ClauseLiterals first = candidates.get(i);
                ClauseLiterals second = candidates.get(j);
                if (!first.conditions().containsAll(second.conditions())
                        && !second.conditions().containsAll(first.conditions())) {
                    continue;
                }
                for (Literal left : first.literals()) {
                    for (Literal right : second.literals()) {
                        if (left.atom().equals(right.atom()) && left.positive() != right.positive()
                                && reported.add(first.label() + "|" + second.label() + "|" + left.atom())) {
                            issues.add(new ValidationIssue(IssueKind.CONTRADICTION, first.label(),
                                    "'" + first.label() + "' and '" + second.label()
                                            + "' conclude opposite values of '" + left.atom().render() + "'"));
                        }
                    }
                }
            }
        }
    }

    private static List<Literal> literals(Expression conclusion) {
        List<Literal> literals = new ArrayList<>();
        for (Expression conjunct : Expression.conjuncts(conclusion)) {
            if (conjunct instanceof Expression.Atom atom) {
                literals.add(new Literal(atom, true));
            } else if (conjunct instanceof Expression.Not not && not.operand() instanceof Expression.Atom atom) {
                literals.add(new Literal(atom, false));
            }
        }
        return literals;
    }

    private void checkDuplicateIds(Program program, List<ValidationIssue> issues) {
        Set<String> seen = new HashSet<>();
        for (Rule rule : program.getRules()) {
            if (!seen.add(rule.id())) {
                issues.add(new ValidationIssue(IssueKind.DUPLICATE_ID, "rule:" + rule.id(),
                        "id '" + rule.id() + "' is used more than once"));
            }
        }
        for (Axiom axiom : program.getAxioms()) {
            if (!seen.add(axiom.id())) {
                issues.add(new ValidationIssue(IssueKind.DUPLICATE_ID, "axiom:" + axiom.id(),
                        "id '" + axiom.id() + "' is used more than once"));
            }
        }
    }

    private record Literal(Expression.Atom atom, boolean positive) {
    }

    private record ClauseLiterals(String label, Set<Expression> conditions, List<Literal> literals) {
    }
}
