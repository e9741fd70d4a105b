package me.golemcore.nsla.domain.model;

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

import lombok.Builder;
import me.golemcore.nsla.port.outbound.SolverContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Solver-ready form of a program. Owns its solver context and must be closed.
 */
public final class CompiledModel implements AutoCloseable {

    private final Program program;
    private final CompileMode mode;
    private final List<TrackedAssertion> baseAssertions;
    private final List<ParsedClause> clauses;
    private final Expression query;
    private final SolverFormula queryFormula;
    private final Map<Expression.Atom, SolverFormula> atomFormulas;
    private final SymbolTable symbolTable;
    private final SolverContext context;

    @Builder
    private CompiledModel(Program program, CompileMode mode, List<TrackedAssertion> baseAssertions,
            List<ParsedClause> clauses, Expression query, SolverFormula queryFormula,
            Map<Expression.Atom, SolverFormula> atomFormulas, SymbolTable symbolTable, SolverContext context) {
        this.program = program;
        this.mode = mode;
        this.baseAssertions = baseAssertions.stream().sorted(TrackedAssertion.STABLE_ORDER).toList();
        this.clauses = clauses == null ? List.of() : List.copyOf(clauses);
        this.query = query;
        this.queryFormula = queryFormula;
        this.atomFormulas = atomFormulas == null ? Map.of() : Map.copyOf(atomFormulas);
        this.symbolTable = symbolTable;
        this.context = context;
    }

    public Program program() {
        return program;
    }

    public CompileMode mode() {
        return mode;
    }

    /**
     * Base assertions in stable (kind, label) order.
     */
    public List<TrackedAssertion> baseAssertions() {
        return baseAssertions;
    }

    /**
     * Rules and axioms in parsed form.
     */
    public List<ParsedClause> clauses() {
        return clauses;
    }

    public Optional<Expression> query() {
        return Optional.ofNullable(query);
    }

    public Optional<SolverFormula> queryFormula() {
        return Optional.ofNullable(queryFormula);
    }

    /**
     * Solver formula of an atom that occurs somewhere in the program.
     */
    public Optional<SolverFormula> atomFormula(Expression.Atom atom) {
        return Optional.ofNullable(atomFormulas.get(atom));
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public SolverContext context() {
        return context;
    }

    @Override
    public void close() {
        context.close();
    }
}
