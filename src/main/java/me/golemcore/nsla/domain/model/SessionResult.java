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
import java.util.Optional;

/**
 * Terminal outcome of a refinement session.
 */
@Value
@Builder
public class SessionResult {

    String sessionId;
    SessionState terminalState;
    List<SessionState> stateTrace;
    List<IterationRecord> history;
    IterationRecord bestIteration;
    SessionFailure failure;

    public Optional<IterationRecord> best() {
        return Optional.ofNullable(bestIteration);
    }

    public Optional<SessionFailure> failureDetails() {
        return Optional.ofNullable(failure);
    }

    public boolean isConverged() {
        return terminalState == SessionState.CONVERGED;
    }
}
