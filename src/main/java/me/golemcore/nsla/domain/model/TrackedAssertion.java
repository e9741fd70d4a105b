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

import java.util.Comparator;

/**
 * Base assertion with the stable label used for unsat-core reporting.
 */
public record TrackedAssertion(Kind kind, String label, SolverFormula formula) {

    /**
     * Submission order: by kind, then label.
     */
    public static final Comparator<TrackedAssertion> STABLE_ORDER = Comparator
            .comparing(TrackedAssertion::kind)
            .thenComparing(TrackedAssertion::label);

    public boolean isClause() {
        return kind == Kind.RULE || kind == Kind.AXIOM;
    }

    /**
     * Assertion origin.
     */
    public enum Kind {
        FACT, RULE, AXIOM
    }
}
