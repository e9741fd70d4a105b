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
 * Atomic assertion {@code predicate(args) = value}. A fact without arguments
 * is a bare boolean flag.
 */
public record Fact(String predicate, List<String> args, boolean value) {

    public Fact {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static Fact of(String predicate, String... args) {
        return new Fact(predicate, List.of(args), true);
    }

    public static Fact negated(String predicate, String... args) {
        return new Fact(predicate, List.of(args), false);
    }

    public Expression.Atom toAtom() {
        return new Expression.Atom(predicate, args);
    }

    /**
     * Stable label used to track this fact inside the solver.
     */
    public String label() {
        return "fact:" + (value ? "" : "!") + toAtom().render();
    }
}
