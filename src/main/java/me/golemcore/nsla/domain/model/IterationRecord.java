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

import java.time.Instant;

/**
 * Immutable history entry: one program with its validation and solver
 * feedback.
 */
@Value
@Builder
public class IterationRecord {

    int index;
    Program program;
    ValidationResult validation;
    CompileMode compileMode;
    Feedback feedback;
    Fingerprint fingerprint;

    /** Proposer calls spent on this iteration (0 for the seed). */
    int proposalAttempts;

    /** Whether the previous program was re-evaluated in place of a new one. */
    boolean fallbackUsed;

    Instant timestamp;
}
