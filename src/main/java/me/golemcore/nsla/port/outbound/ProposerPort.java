package me.golemcore.nsla.port.outbound;

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

import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;

import java.util.concurrent.CompletableFuture;

/**
 * Port for external program proposers (LLM, human, fixture). Proposals are
 * untrusted: they pass the program constructor and the guardrail before use.
 */
public interface ProposerPort {

    /**
     * Returns the provider identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Produces the next candidate program. The future completes exceptionally
     * when the proposer fails; the caller bounds the wait.
     */
    CompletableFuture<Program> propose(ProposalContext context);

    /**
     * Checks if the proposer is configured and operational.
     */
    boolean isAvailable();
}
