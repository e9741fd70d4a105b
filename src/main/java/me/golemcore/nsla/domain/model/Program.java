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

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One immutable, versioned instance of the logic DSL produced by a proposer.
 *
 * <p>
 * The constructor is the trust boundary: structural problems (blank names,
 * duplicate declarations, unknown or cyclic sort references, arg-sort count
 * different from arity) raise {@link StructuralException}. Semantic problems
 * (undeclared predicates, arity mismatches in formulas, duplicate rule ids)
 * are left to the guardrail.
 *
 * <p>
 * A bare fact (no arguments) whose predicate is not declared is a runtime
 * flag: it declares an implicit 0-arity predicate of the same name.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Program {

    private final String version;
    private final List<SortDecl> sorts;
    private final List<ConstantDecl> constants;
    private final List<PredicateDecl> predicates;
    private final List<Fact> facts;
    private final List<Rule> rules;
    private final List<Axiom> axioms;
    private final String query;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Map<String, PredicateDecl> predicateIndex;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Map<String, ConstantDecl> constantIndex;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Map<String, String> sortParents;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final Set<String> runtimeFlags;

    @Builder(toBuilder = true)
    private Program(String version, List<SortDecl> sorts, List<ConstantDecl> constants,
            List<PredicateDecl> predicates, List<Fact> facts, List<Rule> rules, List<Axiom> axioms,
            String query) {
        if (version == null || version.isBlank()) {
            throw new StructuralException("Program version is required");
        }
        this.version = version;
        this.sorts = sorts == null ? List.of() : List.copyOf(sorts);
        this.constants = constants == null ? List.of() : List.copyOf(constants);
        this.predicates = predicates == null ? List.of() : List.copyOf(predicates);
        this.facts = facts == null ? List.of() : List.copyOf(facts);
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.axioms = axioms == null ? List.of() : List.copyOf(axioms);
        this.query = query;

        this.sortParents = indexSorts(this.sorts);
        this.constantIndex = indexConstants(this.constants, sortParents);
        this.predicateIndex = indexPredicates(this.predicates, sortParents);
        checkFacts(this.facts);
        this.runtimeFlags = collectRuntimeFlags(this.facts, predicateIndex);
        checkRules(this.rules);
        checkAxioms(this.axioms);
    }

    public Optional<PredicateDecl> findPredicate(String name) {
        return Optional.ofNullable(predicateIndex.get(name));
    }

    public Optional<ConstantDecl> findConstant(String name) {
        return Optional.ofNullable(constantIndex.get(name));
    }

    public boolean isRuntimeFlag(String name) {
        return runtimeFlags.contains(name);
    }

    /**
     * Undeclared predicates introduced by bare facts, in fact order.
     */
    public Set<String> runtimeFlags() {
        return runtimeFlags;
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    /**
     * Whether {@code sort} equals {@code expected} or extends it through the
     * parent chain. Every sort is a subsort of {@link SortDecl#ENTITY}.
     */
    public boolean isSubsort(String sort, String expected) {
        if (expected == null || SortDecl.ENTITY.equals(expected)) {
            return true;
        }
        String current = sort;
        while (current != null) {
            if (current.equals(expected)) {
                return true;
            }
            current = sortParents.get(current);
        }
        return false;
    }

    private static Map<String, String> indexSorts(List<SortDecl> sorts) {
        Map<String, String> parents = new HashMap<>();
        Set<String> declared = new HashSet<>();
        parents.put(SortDecl.ENTITY, null);
        for (SortDecl sort : sorts) {
            requireName(sort == null ? null : sort.name(), "sort");
            if (!declared.add(sort.name())) {
                throw new StructuralException("Duplicate sort declaration: " + sort.name());
            }
            if (SortDecl.ENTITY.equals(sort.name())) {
                if (sort.hasParent()) {
                    throw new StructuralException("Root sort '" + SortDecl.ENTITY + "' cannot have a parent");
                }
                continue;
            }
            parents.put(sort.name(), sort.hasParent() ? sort.parent() : null);
        }
        for (SortDecl sort : sorts) {
            if (sort.hasParent() && !parents.containsKey(sort.parent())) {
                throw new StructuralException(
                        "Sort '" + sort.name() + "' extends undeclared sort '" + sort.parent() + "'");
            }
            Set<String> seen = new HashSet<>();
            String current = sort.name();
            while (current != null) {
                if (!seen.add(current)) {
                    throw new StructuralException("Cyclic sort hierarchy through '" + sort.name() + "'");
                }
                current = parents.get(current);
            }
        }
        return parents;
    }

    private static Map<String, ConstantDecl> indexConstants(List<ConstantDecl> constants,
            Map<String, String> sortParents) {
        Map<String, ConstantDecl> index = new LinkedHashMap<>();
        for (ConstantDecl constant : constants) {
            requireName(constant == null ? null : constant.name(), "constant");
            if (constant.sort() == null || !sortParents.containsKey(constant.sort())) {
                throw new StructuralException(
                        "Constant '" + constant.name() + "' references undeclared sort '" + constant.sort() + "'");
            }
            if (index.put(constant.name(), constant) != null) {
                throw new StructuralException("Duplicate constant declaration: " + constant.name());
            }
        }
        return index;
    }

    private static Map<String, PredicateDecl> indexPredicates(List<PredicateDecl> predicates,
            Map<String, String> sortParents) {
        Map<String, PredicateDecl> index = new LinkedHashMap<>();
        for (PredicateDecl predicate : predicates) {
            requireName(predicate == null ? null : predicate.name(), "predicate");
            if (predicate.arity() < 0) {
                throw new StructuralException("Predicate '" + predicate.name() + "' has negative arity");
            }
            if (predicate.argSorts().size() != predicate.arity()) {
                throw new StructuralException("Predicate '" + predicate.name() + "' declares arity "
                        + predicate.arity() + " but " + predicate.argSorts().size() + " argument sort(s)");
            }
            for (String sort : predicate.argSorts()) {
                if (!sortParents.containsKey(sort)) {
                    throw new StructuralException(
                            "Predicate '" + predicate.name() + "' references undeclared sort '" + sort + "'");
                }
            }
            if (index.put(predicate.name(), predicate) != null) {
                throw new StructuralException("Duplicate predicate declaration: " + predicate.name());
            }
        }
        return index;
    }

    private static void checkFacts(List<Fact> facts) {
        for (Fact fact : facts) {
            requireName(fact == null ? null : fact.predicate(), "fact predicate");
            for (String arg : fact.args()) {
                requireName(arg, "fact argument");
            }
        }
    }

    private static Set<String> collectRuntimeFlags(List<Fact> facts, Map<String, PredicateDecl> predicates) {
        Set<String> flags = new LinkedHashSet<>();
        for (Fact fact : facts) {
            if (fact.args().isEmpty() && !predicates.containsKey(fact.predicate())) {
                flags.add(fact.predicate());
            }
        }
        return Collections.unmodifiableSet(flags);
    }

    private static void checkRules(List<Rule> rules) {
        for (Rule rule : rules) {
            requireName(rule == null ? null : rule.id(), "rule id");
            requireText(rule.condition(), "rule '" + rule.id() + "' condition");
            requireText(rule.conclusion(), "rule '" + rule.id() + "' conclusion");
        }
    }

    private static void checkAxioms(List<Axiom> axioms) {
        for (Axiom axiom : axioms) {
            requireName(axiom == null ? null : axiom.id(), "axiom id");
            requireText(axiom.formula(), "axiom '" + axiom.id() + "' formula");
        }
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new StructuralException("Missing " + what + " name");
        }
    }

    private static void requireText(String text, String what) {
        if (text == null || text.isBlank()) {
            throw new StructuralException("Missing " + what);
        }
    }
}
