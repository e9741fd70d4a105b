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

import java.util.Collections;
import java.util.List;

/**
 * Predicate signature declared by a program.
 *
 * @param name
 *            predicate name
 * @param arity
 *            number of arguments
 * @param argSorts
 *            expected sort per argument position ({@code arity} entries)
 * @param allowUndeclaredInstances
 *            whether instances may mention individuals that are not declared
 *            constants (runtime-derived facts)
 */
public record PredicateDecl(String name, int arity, List<String> argSorts, boolean allowUndeclaredInstances) {

    public PredicateDecl {
        argSorts = argSorts == null
                ? List.copyOf(Collections.nCopies(Math.max(arity, 0), SortDecl.ENTITY))
                : List.copyOf(argSorts);
    }

    public static PredicateDecl of(String name, int arity) {
        return new PredicateDecl(name, arity, null, false);
    }

    public static PredicateDecl of(String name, String... argSorts) {
        return new PredicateDecl(name, argSorts.length, List.of(argSorts), false);
    }

    public String signature() {
        return name + "/" + arity;
    }
}
