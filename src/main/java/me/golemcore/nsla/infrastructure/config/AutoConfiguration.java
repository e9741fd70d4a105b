package me.golemcore.nsla.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.port.outbound.ProposerPort;
import me.golemcore.nsla.port.outbound.SolverPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup logging.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final NslaProperties properties;
    private final SolverPort solverPort;
    private final ProposerPort proposerPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        NslaProperties.RefinementProperties refinement = properties.getRefinement();
        log.info("NSLA symbolic core v{} starting...", version);
        log.info("Solver backend: {}", solverPort.getBackendId());
        log.info("Proposer: {} (available={})", proposerPort.getProviderId(), proposerPort.isAvailable());
        log.info("Refinement: policy={}, max-iters={}, solver-timeout={}ms, proposer-timeout={}ms",
                refinement.getPolicy(), refinement.getMaxIters(), refinement.getSolverTimeoutMs(),
                refinement.getProposerTimeoutMs());
        log.info("Guardrail: dsl-version={}, advisory={}", properties.getGuardrail().getDslVersion(),
                properties.getGuardrail().getAdvisoryKinds());
    }
}
