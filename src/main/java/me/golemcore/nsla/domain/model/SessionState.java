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
 * Refinement session states. The last five are terminal.
 */
public enum SessionState {

    INIT,

    AWAITING_PROPOSAL,

    VALIDATING,

    SOLVING,

    EVALUATING,

    CONVERGED,

    STALLED,

    EXHAUSTED,

    FAILED,

    /** The session thread was interrupted at a state boundary. */
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
        case CONVERGED, STALLED, EXHAUSTED, FAILED, CANCELLED -> true;
        default -> false;
        };
    }
}
