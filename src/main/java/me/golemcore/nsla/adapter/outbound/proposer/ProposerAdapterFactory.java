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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;
import me.golemcore.nsla.infrastructure.config.NslaProperties;
import me.golemcore.nsla.port.outbound.ProposerPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the active proposer adapter from {@code nsla.proposer.provider}:
 * <ul>
 * <li>langchain4j - OpenAI-compatible or Anthropic chat models
 * <li>none - echoes the prior program (offline runs, tests)
 * </ul>
 *
 * <p>
 * All adapters are Spring beans; selection happens once in {@link #init()}.
 * An unknown provider falls back to {@code none}.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class ProposerAdapterFactory implements ProposerPort {

    private static final String PROVIDER_NONE = "none";

    private final NslaProperties properties;
    private final List<ProposerProviderAdapter> adapters;

    private ProposerProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        Map<String, ProposerProviderAdapter> adaptersByProvider = new HashMap<>();
        for (ProposerProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered proposer adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getProposer().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("Proposer provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("Active proposer provider: {}", provider);
        }
        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    // ==================== ProposerPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<Program> propose(ProposalContext context) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No proposer adapter registered"));
        }
        return activeAdapter.propose(context);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
