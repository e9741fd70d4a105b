package me.golemcore.nsla.domain.service;

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

import me.golemcore.nsla.domain.model.Feedback;
import me.golemcore.nsla.domain.model.IterationRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the most useful iteration of a finished session.
 *
 * <p>
 * Preference: entailed, then not entailed (fewest missing links), then
 * inconsistent (fewest conflicting axioms), then unknown. Ties go to the
 * earliest iteration.
 */
public final class BestIterationSelector {

    private static final Comparator<IterationRecord> PREFERENCE = Comparator
            .comparingInt((IterationRecord iteration) -> iteration.getFeedback().status().rank())
            .thenComparingInt(iteration -> diagnosticsSize(iteration.getFeedback()))
            .thenComparingInt(IterationRecord::getIndex);

    private BestIterationSelector() {
    }

    public static Optional<IterationRecord> select(List<IterationRecord> history) {
        if (history == null) {
            return Optional.empty();
        }
        return history.stream().min(PREFERENCE);
    }

    public static Comparator<IterationRecord> preference() {
        return PREFERENCE;
    }

    private static int diagnosticsSize(Feedback feedback) {
        return switch (feedback.status()) {
        case CONSISTENT_NO_ENTAILMENT -> feedback.missingLinks().size();
        case INCONSISTENT -> feedback.conflictingAxioms().size();
        default -> 0;
        };
    }
}
