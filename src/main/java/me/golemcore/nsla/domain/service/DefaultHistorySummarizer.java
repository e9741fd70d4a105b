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
import me.golemcore.nsla.port.outbound.HistorySummarizerPort;

import java.util.List;

/**
 * Deterministic summary of the last few iterations, one line each. The same
 * history always yields the same text, so prompts stay reproducible.
 */
public class DefaultHistorySummarizer implements HistorySummarizerPort {

    static final String EMPTY_HISTORY = "No previous iterations: this is the first proposal.";
    private static final String NONE = "none";

    private final int maxEntries;

    public DefaultHistorySummarizer(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    @Override
    public String summarize(List<IterationRecord> history) {
        if (history == null || history.isEmpty()) {
            return EMPTY_HISTORY;
        }
        List<IterationRecord> tail = history.subList(Math.max(0, history.size() - maxEntries), history.size());
        StringBuilder sb = new StringBuilder("Iteration context (most recent last):");
        for (IterationRecord iteration : tail) {
            Feedback feedback = iteration.getFeedback();
            sb.append("\n- iter ").append(iteration.getIndex())
                    .append(": status=").append(feedback.status().wireName())
                    .append("; missing=").append(joinOrNone(feedback.missingLinks()))
                    .append("; conflicts=").append(joinOrNone(feedback.conflictingAxioms()))
                    .append("; summary=").append(feedback.detail());
            if (iteration.isFallbackUsed()) {
                sb.append(" (previous program re-evaluated)");
            }
        }
        return sb.toString();
    }

    private static String joinOrNone(List<String> values) {
        return values.isEmpty() ? NONE : String.join(", ", values);
    }
}
