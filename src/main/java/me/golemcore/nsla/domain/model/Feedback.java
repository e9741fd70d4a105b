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
 * Result of interpreting a compiled model with the solver.
 *
 * @param status
 *            verdict
 * @param conflictingAxioms
 *            rule/axiom ids from the unsatisfiable core (inconsistent only)
 * @param missingLinks
 *            predicates whose forced truth would flip the verdict
 *            (best-effort, neither minimal nor unique)
 * @param detail
 *            short diagnostic text
 */
public record Feedback(FeedbackStatus status, List<String> conflictingAxioms, List<String> missingLinks,
        String detail) {

    public Feedback {
        conflictingAxioms = conflictingAxioms == null ? List.of() : List.copyOf(conflictingAxioms);
        missingLinks = missingLinks == null ? List.of() : List.copyOf(missingLinks);
    }

    public static Feedback entails() {
        return new Feedback(FeedbackStatus.CONSISTENT_ENTAILS, List.of(), List.of(),
                "Consistent; the query is entailed");
    }

    public static Feedback noEntailment(List<String> missingLinks, String detail) {
        return new Feedback(FeedbackStatus.CONSISTENT_NO_ENTAILMENT, List.of(), missingLinks, detail);
    }

    public static Feedback inconsistent(List<String> conflictingAxioms) {
        return new Feedback(FeedbackStatus.INCONSISTENT, conflictingAxioms, List.of(),
                "Base assertions are contradictory");
    }

    public static Feedback unknown(String reason) {
        return new Feedback(FeedbackStatus.UNKNOWN, List.of(), List.of(),
                "Solver undecided: " + reason);
    }

    public Fingerprint fingerprint() {
        return Fingerprint.of(this);
    }
}
