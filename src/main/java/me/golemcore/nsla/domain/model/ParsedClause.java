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

import java.util.Collection;
import java.util.List;

/**
 * A rule or axiom in {@code condition => conclusion} form. Axioms that are not
 * implications have a {@code true} condition.
 */
public record ParsedClause(TrackedAssertion.Kind kind, String label, Expression condition, Expression conclusion) {

    public static ParsedClause fromRule(String id, Expression condition, Expression conclusion) {
        return new ParsedClause(TrackedAssertion.Kind.RULE, id, condition, conclusion);
    }

    public static ParsedClause fromAxiom(String id, Expression formula) {
        if (formula instanceof Expression.Implies implies) {
            return new ParsedClause(TrackedAssertion.Kind.AXIOM, id, implies.premise(), implies.consequence());
        }
        return new ParsedClause(TrackedAssertion.Kind.AXIOM, id, new Expression.True(), formula);
    }

    public List<Expression> conditionConjuncts() {
        return Expression.conjuncts(condition);
    }

    /**
     * Whether some atom of the conclusion uses one of {@code predicates}.
     */
    public boolean concludesAny(Collection<String> predicates) {
        return conclusion.atoms().stream().anyMatch(atom -> predicates.contains(atom.predicate()));
    }
}
