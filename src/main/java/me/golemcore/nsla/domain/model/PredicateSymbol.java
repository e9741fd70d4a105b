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

import java.util.List;

/**
 * Solver-level symbol for a predicate name, scoped to a single compilation.
 */
public sealed interface PredicateSymbol permits PredicateSymbol.NullaryAtom, PredicateSymbol.Relation {

    String id();

    int arity();

    /**
     * Whether the compiler created this symbol for a name the program did not
     * declare (lenient mode or runtime flag facts).
     */
    boolean synthetic();

    /**
     * 0-arity predicate: a boolean constant.
     */
    record NullaryAtom(String id, SolverFormula formula, boolean synthetic) implements PredicateSymbol {
        @Override
        public int arity() {
            return 0;
        }
    }

    /**
     * n-arity predicate: an uninterpreted relation over the individual domain.
     */
    record Relation(String id, List<String> argSorts, SolverRelation handle, boolean synthetic)
            implements PredicateSymbol {

        public Relation {
            argSorts = List.copyOf(argSorts);
        }

        @Override
        public int arity() {
            return argSorts.size();
        }
    }
}
