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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name to solver symbol mapping for one compilation. Each predicate name (or
 * lenient {@code name#n} key) maps to exactly one symbol, so the same name can
 * never produce two distinct solver declarations.
 */
public final class SymbolTable {

    private final Map<String, PredicateSymbol> predicates = new LinkedHashMap<>();
    private final Map<String, SolverTerm> individuals = new LinkedHashMap<>();
    private final Set<String> undeclaredIndividuals = new LinkedHashSet<>();

    public Optional<PredicateSymbol> findPredicate(String key) {
        return Optional.ofNullable(predicates.get(key));
    }

    public void registerPredicate(String key, PredicateSymbol symbol) {
        PredicateSymbol previous = predicates.putIfAbsent(key, symbol);
        if (previous != null && previous != symbol) {
            throw new IllegalStateException("Predicate symbol already registered: " + key);
        }
    }

    public Optional<SolverTerm> findIndividual(String name) {
        return Optional.ofNullable(individuals.get(name));
    }

    public void registerIndividual(String name, SolverTerm term, boolean declared) {
        individuals.putIfAbsent(name, term);
        if (!declared) {
            undeclaredIndividuals.add(name);
        }
    }

    public Map<String, PredicateSymbol> predicates() {
        return Collections.unmodifiableMap(predicates);
    }

    public Set<String> individualNames() {
        return Collections.unmodifiableSet(individuals.keySet());
    }

    /**
     * Individuals that appeared as arguments without a constant declaration.
     */
    public Set<String> undeclaredIndividuals() {
        return Collections.unmodifiableSet(undeclaredIndividuals);
    }

    public Set<String> syntheticPredicates() {
        Set<String> names = new LinkedHashSet<>();
        predicates.forEach((key, symbol) -> {
            if (symbol.synthetic()) {
                names.add(key);
            }
        });
        return names;
    }
}
