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
import java.util.Set;

/**
 * Guardrail verdict: {@code ok} is false when at least one issue falls
 * outside the advisory subset the validator was configured with.
 */
public record ValidationResult(boolean ok, List<ValidationIssue> issues, Set<IssueKind> advisoryKinds) {

    public ValidationResult {
        issues = List.copyOf(issues);
        advisoryKinds = Set.copyOf(advisoryKinds);
    }

    public List<ValidationIssue> blockingIssues() {
        return issues.stream()
                .filter(issue -> !advisoryKinds.contains(issue.kind()))
                .toList();
    }

    public boolean hasIssue(IssueKind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }
}
