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
import me.golemcore.nsla.domain.model.CompileException;
import me.golemcore.nsla.domain.model.CompileMode;
import me.golemcore.nsla.domain.model.CompiledModel;
import me.golemcore.nsla.domain.model.ConstantDecl;
import me.golemcore.nsla.domain.model.Expression;
import me.golemcore.nsla.domain.model.Fact;
import me.golemcore.nsla.domain.model.ParseException;
import me.golemcore.nsla.domain.model.ParsedClause;
import me.golemcore.nsla.domain.model.PredicateDecl;
import me.golemcore.nsla.domain.model.PredicateSymbol;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.Rule;
import me.golemcore.nsla.domain.model.SolverFormula;
import me.golemcore.nsla.domain.model.SolverTerm;
import me.golemcore.nsla.domain.model.SymbolTable;
import me.golemcore.nsla.domain.model.TrackedAssertion;
import me.golemcore.nsla.domain.model.ValidationResult;
import me.golemcore.nsla.port.outbound.SolverBackendException;
import me.golemcore.nsla.port.outbound.SolverContext;
import me.golemcore.nsla.port.outbound.SolverPort;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a {@link Program} into labeled solver assertions.
 *
 * <p>
 * Every call opens a fresh solver context which the returned
 * {@link CompiledModel} owns. Individuals (declared constants and undeclared
 * argument names alike) become constants of one uninterpreted domain sort, so
 * atoms over the same names always denote the same solver term. Assertions
 * are labeled ({@code fact:<atom>}, rule id, axiom id) and kept in
 * (kind, label) order, which makes verdicts independent of the order of the
 * program's collections.
 */
@Slf4j
public class ConstraintCompiler {

    private final SolverPort solverPort;
    private final GuardrailValidator validator;
    private final ExpressionParser parser;

    public ConstraintCompiler(SolverPort solverPort, GuardrailValidator validator, ExpressionParser parser) {
        this.solverPort = solverPort;
        this.validator = validator;
        this.parser = parser;
    }

    public CompiledModel compile(Program program, CompileMode mode) {
        return compile(program, mode, new ExpressionCache(parser));
    }

    /**
     * @throws CompileException
     *             {@code VALIDATION_REJECTED} in strict mode when the guardrail
     *             reports blocking issues, {@code PARSE_ERROR} when a formula
     *             does not parse, {@code SOLVER_ERROR} when the backend fails
     */
    public CompiledModel compile(Program program, CompileMode mode, ExpressionCache cache) {
        if (mode == CompileMode.STRICT) {
            ValidationResult validation = validator.validate(program, cache);
            if (!validation.ok()) {
                throw CompileException.rejected(validation.blockingIssues());
            }
        }

        SolverContext context;
        try {
            context = solverPort.openContext();
        } catch (SolverBackendException e) {
            throw new CompileException(CompileException.Kind.SOLVER_ERROR,
                    "Cannot open " + solverPort.getBackendId() + " context: " + e.getMessage(), e);
        }

        try {
            CompiledModel model = new Translation(program, mode, cache, context).run();
            log.debug("[Compiler] Compiled program v{} ({}): {} assertion(s), {} symbol(s), query={}",
                    program.getVersion(), mode, model.baseAssertions().size(),
                    model.symbolTable().predicates().size(), model.query().isPresent());
            return model;
        } catch (ParseException e) {
            context.close();
            throw CompileException.parse("Formula does not parse", e);
        } catch (SolverBackendException e) {
            context.close();
            throw new CompileException(CompileException.Kind.SOLVER_ERROR,
                    "Solver backend failed during compilation: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            context.close();
            throw e;
        }
    }

    /**
     * State of a single compilation. Never shared between calls.
     */
    private static final class Translation {

        private final Program program;
        private final CompileMode mode;
        private final ExpressionCache cache;
        private final SolverContext context;
        private final SymbolTable symbols = new SymbolTable();
        private final Map<Expression.Atom, SolverFormula> atomFormulas = new LinkedHashMap<>();
        private final Map<String, Integer> labelCounts = new HashMap<>();
        private final List<TrackedAssertion> assertions = new ArrayList<>();
        private final List<ParsedClause> clauses = new ArrayList<>();

        private Translation(Program program, CompileMode mode, ExpressionCache cache, SolverContext context) {
            this.program = program;
            this.mode = mode;
            this.cache = cache;
            this.context = context;
        }

        private CompiledModel run() {
            declareSymbols();
            for (Fact fact : program.getFacts()) {
                SolverFormula atom = translate(fact.toAtom());
                track(TrackedAssertion.Kind.FACT, fact.label(), fact.value() ? atom : context.not(atom));
            }
            for (Rule rule : program.getRules()) {
                Expression condition = cache.parse(rule.condition());
                Expression conclusion = cache.parse(rule.conclusion());
                clauses.add(ParsedClause.fromRule(rule.id(), condition, conclusion));
                track(TrackedAssertion.Kind.RULE, rule.id(),
                        context.implies(translate(condition), translate(conclusion)));
            }
            for (Axiom axiom : program.getAxioms()) {
                Expression formula = cache.parse(axiom.formula());
                clauses.add(ParsedClause.fromAxiom(axiom.id(), formula));
                track(TrackedAssertion.Kind.AXIOM, axiom.id(), translate(formula));
            }

            Expression query = null;
            SolverFormula queryFormula = null;
            if (program.hasQuery()) {
                query = cache.parse(program.getQuery());
                queryFormula = translate(query);
            }

            return CompiledModel.builder()
                    .program(program)
                    .mode(mode)
                    .baseAssertions(assertions)
                    .clauses(clauses)
                    .query(query)
                    .queryFormula(queryFormula)
                    .atomFormulas(atomFormulas)
                    .symbolTable(symbols)
                    .context(context)
                    .build();
        }

        private void declareSymbols() {
            for (ConstantDecl constant : program.getConstants()) {
                symbols.registerIndividual(constant.name(), context.individual(constant.name()), true);
            }
            for (PredicateDecl predicate : program.getPredicates()) {
                PredicateSymbol symbol = predicate.arity() == 0
                        ? new PredicateSymbol.NullaryAtom(predicate.name(),
                                context.booleanConstant(predicate.name()), false)
                        : new PredicateSymbol.Relation(predicate.name(), predicate.argSorts(),
                                context.relation(predicate.name(), predicate.arity()), false);
                symbols.registerPredicate(predicate.name(), symbol);
            }
            for (String flag : program.runtimeFlags()) {
                symbols.registerPredicate(flag,
                        new PredicateSymbol.NullaryAtom(flag, context.booleanConstant(flag), false));
            }
        }

        private void track(TrackedAssertion.Kind kind, String label, SolverFormula formula) {
            int seen = labelCounts.merge(label, 1, Integer::sum);
            String unique = seen == 1 ? label : label + "#" + seen;
            assertions.add(new TrackedAssertion(kind, unique, formula));
        }

        private SolverFormula translate(Expression expression) {
            if (expression instanceof Expression.True) {
                return context.literal(true);
            }
            if (expression instanceof Expression.False) {
                return context.literal(false);
            }
            if (expression instanceof Expression.Atom atom) {
                return atomFormulas.computeIfAbsent(atom, this::resolveAtom);
            }
            if (expression instanceof Expression.Not not) {
                return context.not(translate(not.operand()));
            }
            if (expression instanceof Expression.And and) {
                return context.and(translate(and.left()), translate(and.right()));
            }
            if (expression instanceof Expression.Or or) {
                return context.or(translate(or.left()), translate(or.right()));
            }
            Expression.Implies implies = (Expression.Implies) expression;
            return context.implies(translate(implies.premise()), translate(implies.consequence()));
        }

        private SolverFormula resolveAtom(Expression.Atom atom) {
            PredicateSymbol symbol = symbols.findPredicate(atom.predicate())
                    .filter(candidate -> !candidate.synthetic())
                    .orElse(null);
            if (symbol == null) {
                return syntheticFlag(atom.predicate(), atom);
            }
            if (symbol.arity() != atom.arity()) {
                return syntheticFlag(atom.predicate() + "#" + atom.arity(), atom);
            }
            if (symbol instanceof PredicateSymbol.NullaryAtom nullary) {
                return nullary.formula();
            }
            PredicateSymbol.Relation relation = (PredicateSymbol.Relation) symbol;
            List<SolverTerm> args = new ArrayList<>(atom.arity());
            for (String arg : atom.args()) {
                args.add(individual(arg));
            }
            return context.apply(relation.handle(), args);
        }

        /**
         * Unresolvable atom: one fresh boolean per key, shared by every use.
         */
        private SolverFormula syntheticFlag(String key, Expression.Atom atom) {
            PredicateSymbol existing = symbols.findPredicate(key).orElse(null);
            if (existing instanceof PredicateSymbol.NullaryAtom nullary) {
                return nullary.formula();
            }
            log.warn("[Compiler] '{}' does not match a declared predicate, using fresh boolean '{}'",
                    atom.render(), key);
            PredicateSymbol.NullaryAtom fresh = new PredicateSymbol.NullaryAtom(key,
                    context.booleanConstant(key), true);
            symbols.registerPredicate(key, fresh);
            return fresh.formula();
        }

        private SolverTerm individual(String name) {
            return symbols.findIndividual(name).orElseGet(() -> {
                SolverTerm term = context.individual(name);
                symbols.registerIndividual(name, term, false);
                return term;
            });
        }
    }
}
