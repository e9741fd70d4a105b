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
 * Why a session ended in {@link SessionState#FAILED}.
 */
public record SessionFailure(Kind kind, String message) {

    public enum Kind {
        STRUCTURAL_ERROR,
        VALIDATION_REJECTED,
        COMPILE_ERROR,
        PROPOSER_TIMEOUT,
        PROPOSER_ERROR,
        SOLVER_ERROR,
        RETRY_BUDGET_EXHAUSTED,
        INTERNAL_ERROR
    }
}
