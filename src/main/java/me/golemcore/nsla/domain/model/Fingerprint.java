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
 * Hashable summary of a feedback used for stall and oscillation detection.
 * Lists are kept sorted so that ordering noise never changes equality.
 */
public record Fingerprint(FeedbackStatus status, List<String> missingLinks, List<String> conflictingAxioms) {

    public Fingerprint {
        missingLinks = missingLinks.stream().sorted().toList();
        conflictingAxioms = conflictingAxioms.stream().sorted().toList();
    }

    public static Fingerprint of(Feedback feedback) {
        return new Fingerprint(feedback.status(), feedback.missingLinks(), feedback.conflictingAxioms());
    }
}
