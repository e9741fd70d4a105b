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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a proposer may use to produce the next program.
 */
@Value
@Builder(toBuilder = true)
public class ProposalContext {

    String sessionId;
    String question;
    Program priorProgram;
    Feedback priorFeedback;
    String historySummary;

    @Builder.Default
    List<ValidationIssue> guardrailIssues = List.of();

    /** Message of the compile error that triggered a re-proposal, if any. */
    String compileError;

    /** 1-based proposer call number within the current iteration. */
    @Builder.Default
    int attempt = 1;

    public boolean isRetry() {
        return !guardrailIssues.isEmpty() || compileError != null;
    }
}
