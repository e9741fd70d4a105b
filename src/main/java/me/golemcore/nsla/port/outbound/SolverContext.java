package me.golemcore.nsla.port.outbound;

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

import me.golemcore.nsla.domain.model.SolverCheck;
import me.golemcore.nsla.domain.model.SolverFormula;
import me.golemcore.nsla.domain.model.SolverRelation;
import me.golemcore.nsla.domain.model.SolverTerm;
import me.golemcore.nsla.domain.model.TrackedAssertion;

import java.time.Duration;
import java.util.List;

/**
 * Formula factory and checker bound to one backend context. Handles created
 * by one context must not be passed to another.
 */
public interface SolverContext extends AutoCloseable {

    /**
     * Individual of the shared uninterpreted domain sort. Repeated calls with
     * the same name return equal handles.
     */
    SolverTerm individual(String name);

    /**
     * Fresh boolean constant.
     */
    SolverFormula booleanConstant(String name);

    /**
     * Uninterpreted relation over the domain sort.
     */
    SolverRelation relation(String name, int arity);

    SolverFormula apply(SolverRelation relation, List<SolverTerm> args);

    SolverFormula literal(boolean value);

    SolverFormula not(SolverFormula operand);

    SolverFormula and(SolverFormula left, SolverFormula right);

    SolverFormula or(SolverFormula left, SolverFormula right);

    SolverFormula implies(SolverFormula premise, SolverFormula consequence);

    /**
     * Checks {@code tracked} together with {@code extra} on a fresh solver
     * instance. Unsat cores report labels of {@code tracked} only.
     */
    SolverCheck check(List<TrackedAssertion> tracked, List<SolverFormula> extra, Duration timeout);

    @Override
    void close();
}
