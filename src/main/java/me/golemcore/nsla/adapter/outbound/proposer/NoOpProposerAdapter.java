package me.golemcore.nsla.adapter.outbound.proposer;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op proposer used when no LLM is configured.
 *
 * <p>
 * Returns the prior program unchanged, so a session driven by it converges on
 * the seed or stalls on the next iteration.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpProposerAdapter implements ProposerProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<Program> propose(ProposalContext context) {
        log.debug("NoOpProposerAdapter: echoing prior program for session {}", context.getSessionId());
        if (context.getPriorProgram() == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No proposer configured and no prior program to echo"));
        }
        return CompletableFuture.completedFuture(context.getPriorProgram());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
