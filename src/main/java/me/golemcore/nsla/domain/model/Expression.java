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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed boolean formula over predicate atoms.
 *
 * <p>
 * The variant is closed: {@link True}, {@link False}, {@link Atom},
 * {@link Not}, {@link And}, {@link Or}, {@link Implies}. Instances are
 * immutable and compare structurally.
 */
public sealed interface Expression
        permits Expression.True, Expression.False, Expression.Atom, Expression.Not, Expression.And,
        Expression.Or, Expression.Implies {

    /**
     * Canonical infix rendering, re-parseable by the expression parser.
     */
    String render();

    void collectAtoms(List<Atom> sink);

    /**
     * Atoms in left-to-right order, duplicates removed.
     */
    default List<Atom> atoms() {
        List<Atom> all = new ArrayList<>();
        collectAtoms(all);
        return List.copyOf(new LinkedHashSet<>(all));
    }

    default Set<String> predicateNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Atom atom : atoms()) {
            names.add(atom.predicate());
        }
        return names;
    }

    record True() implements Expression {
        @Override
        public String render() {
            return "true";
        }

        @Override
        public void collectAtoms(List<Atom> sink) {
            // no atoms
        }
    }

    record False() implements Expression {
        @Override
        public String render() {
            return "false";
        }

        @Override
        public void collectAtoms(List<Atom> sink) {
            // no atoms
        }
    }

    record Atom(String predicate, List<String> args) implements Expression {

        public Atom {
            Objects.requireNonNull(predicate, "predicate");
            args = args == null ? List.of() : List.copyOf(args);
        }

        public int arity() {
            return args.size();
        }

        @Override
        public String render() {
            return args.isEmpty() ? predicate : predicate + "(" + String.join(",", args) + ")";
        }

        @Override
        public void collectAtoms(List<Atom> sink) {
            sink.add(this);
        }
    }

    record Not(Expression operand) implements Expression {
        @Override
        public String render() {
            return "not " + wrap(operand);
        }

        @Override
        public void collectAtoms(List<Atom> sink) {
            operand.collectAtoms(sink);
        }
    }

    record And(Expression left, Expression right) implements Expression {
        @Override
        public String render() {
            return wrap(left) + " and " + wrap(right);
        }

        @Override
        public void collectAtoms(List<Atom> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }
    }

    record Or(Expression left, Expression right) implements Expression {
        @Override
        public String render() {
            return wrap(left) + " or " + wrap(right);
        }

        @Override
        public void collectAtoms(List<Atom> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }
    }

    record Implies(Expression premise, Expression consequence) implements Expression {
        @Override
        public String render() {
            return wrap(premise) + " implies " + wrap(consequence);
        }

        @Override
        public void collectAtoms(List<Atom> sink) {
            premise.collectAtoms(sink);
            consequence.collectAtoms(sink);
        }
    }

    private static String wrap(Expression expression) {
        if (expression instanceof Atom || expression instanceof True || expression instanceof False
                || expression instanceof Not) {
            return expression.render();
        }
        return "(" + expression.render() + ")";
    }

    /**
     * Flattens nested conjunctions into their conjuncts.
     */
    static List<Expression> conjuncts(Expression expression) {
        List<Expression> out = new ArrayList<>();
        flattenAnd(expression, out);
        return out;
    }

    private static void flattenAnd(Expression expression, List<Expression> out) {
        if (expression instanceof And and) {
            flattenAnd(and.left(), out);
            flattenAnd(and.right(), out);
        } else if (!(expression instanceof True)) {
            out.add(expression);
        }
    }
}
