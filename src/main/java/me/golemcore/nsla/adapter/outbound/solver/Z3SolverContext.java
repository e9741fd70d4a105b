package me.golemcore.nsla.adapter.outbound.solver;

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

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.UninterpretedSort;
import com.microsoft.z3.Z3Exception;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.domain.model.SolverCheck;
import me.golemcore.nsla.domain.model.SolverFormula;
import me.golemcore.nsla.domain.model.SolverRelation;
import me.golemcore.nsla.domain.model.SolverTerm;
import me.golemcore.nsla.domain.model.TrackedAssertion;
import me.golemcore.nsla.port.outbound.SolverBackendException;
import me.golemcore.nsla.port.outbound.SolverContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SolverContext} over one Z3 {@link Context}. Individuals live in a
 * single uninterpreted sort named {@code Individual}; relations are boolean
 * functions over it.
 */
@Slf4j
class Z3SolverContext implements SolverContext {

    private static final String DOMAIN_SORT = "Individual";
    private static final String TRACK_PREFIX = "track";

    private final Context ctx;
    private final UninterpretedSort domain;
    private boolean closed;

    Z3SolverContext(Context ctx) {
        this.ctx = ctx;
        this.domain = ctx.mkUninterpretedSort(DOMAIN_SORT);
    }

    @Override
    public SolverTerm individual(String name) {
        ensureOpen();
        return new Z3Term(ctx.mkConst(name, domain));
    }

    @Override
    public SolverFormula booleanConstant(String name) {
        ensureOpen();
        return new Z3Formula(ctx.mkBoolConst(name));
    }

    @Override
    public SolverRelation relation(String name, int arity) {
        ensureOpen();
        Sort[] argSorts = new Sort[arity];
        Arrays.fill(argSorts, domain);
        return new Z3Relation(name, arity, ctx.mkFuncDecl(name, argSorts, ctx.getBoolSort()));
    }

    @Override
    public SolverFormula apply(SolverRelation relation, List<SolverTerm> args) {
        ensureOpen();
        Z3Relation z3Relation = unwrap(relation);
        if (args.size() != z3Relation.arity()) {
            throw new SolverBackendException("Relation '" + relation.name() + "' expects " + z3Relation.arity()
                    + " argument(s), got " + args.size());
        }
        Expr<?>[] terms = new Expr<?>[args.size()];
        for (int i = 0; i < terms.length; i++) {
            terms[i] = unwrap(args.get(i));
        }
        return new Z3Formula((BoolExpr) ctx.mkApp(z3Relation.decl(), terms));
    }

    @Override
    public SolverFormula literal(boolean value) {
        ensureOpen();
        return new Z3Formula(value ? ctx.mkTrue() : ctx.mkFalse());
    }

    @Override
    public SolverFormula not(SolverFormula operand) {
        return new Z3Formula(ctx.mkNot(unwrap(operand)));
    }

    @Override
    public SolverFormula and(SolverFormula left, SolverFormula right) {
        return new Z3Formula(ctx.mkAnd(unwrap(left), unwrap(right)));
    }

    @Override
    public SolverFormula or(SolverFormula left, SolverFormula right) {
        return new Z3Formula(ctx.mkOr(unwrap(left), unwrap(right)));
    }

    @Override
    public SolverFormula implies(SolverFormula premise, SolverFormula consequence) {
        return new Z3Formula(ctx.mkImplies(unwrap(premise), unwrap(consequence)));
    }

    @Override
    public SolverCheck check(List<TrackedAssertion> tracked, List<SolverFormula> extra, Duration timeout) {
        ensureOpen();
        try {
            Solver solver = ctx.mkSolver();
            Params params = ctx.mkParams();
            params.add("timeout", timeoutMillis(timeout));
            solver.setParameters(params);

            // fresh constants never collide with program symbols of the same name
            Map<BoolExpr, String> labelsByTracker = new HashMap<>();
            for (TrackedAssertion assertion : tracked) {
                BoolExpr tracker = (BoolExpr) ctx.mkFreshConst(TRACK_PREFIX, ctx.getBoolSort());
                labelsByTracker.put(tracker, assertion.label());
                solver.assertAndTrack(unwrap(assertion.formula()), tracker);
            }
            for (SolverFormula formula : extra) {
                solver.add(unwrap(formula));
            }

            Status status = solver.check();
            if (status == Status.SATISFIABLE) {
                return SolverCheck.sat();
            }
            if (status == Status.UNSATISFIABLE) {
                List<String> core = new ArrayList<>();
                for (BoolExpr tracker : solver.getUnsatCore()) {
                    String label = labelsByTracker.get(tracker);
                    if (label != null) {
                        core.add(label);
                    }
                }
                return SolverCheck.unsat(core);
            }
            String reason = solver.getReasonUnknown();
            log.debug("[Z3] Check undecided: {}", reason);
            return SolverCheck.unknown(reason);
        } catch (Z3Exception e) {
            throw new SolverBackendException("Z3 check failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            ctx.close();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new SolverBackendException("Solver context is closed");
        }
    }

    private static int timeoutMillis(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
    }

    private static BoolExpr unwrap(SolverFormula formula) {
        if (formula instanceof Z3Formula z3Formula) {
            return z3Formula.expr();
        }
        throw new SolverBackendException("Formula was not created by a Z3 context: " + formula);
    }

    private static Expr<UninterpretedSort> unwrap(SolverTerm term) {
        if (term instanceof Z3Term z3Term) {
            return z3Term.expr();
        }
        throw new SolverBackendException("Term was not created by a Z3 context: " + term);
    }

    private static Z3Relation unwrap(SolverRelation relation) {
        if (relation instanceof Z3Relation z3Relation) {
            return z3Relation;
        }
        throw new SolverBackendException("Relation was not created by a Z3 context: " + relation);
    }

    record Z3Formula(BoolExpr expr) implements SolverFormula {
    }

    record Z3Term(Expr<UninterpretedSort> expr) implements SolverTerm {
    }

    record Z3Relation(String name, int arity, FuncDecl<BoolSort> decl) implements SolverRelation {
    }
}
