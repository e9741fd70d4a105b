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

/**
 * Structured guardrail finding. Not an exception: issues are handled by the
 * refinement policy.
 *
 * @param kind
 *            finding category
 * @param subject
 *            offending element ({@code rule:r1}, {@code axiom:a1},
 *            {@code fact:P(a)}, {@code query}, {@code program})
 * @param detail
 *            human-readable description
 */
public record ValidationIssue(IssueKind kind, String subject, String detail) {

    @Override
    public String toString() {
        return kind.wireName() + " [" + subject + "]: " + detail;
    }
}
