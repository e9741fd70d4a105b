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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code nsla.*} prefix:
 * <ul>
 * <li>{@link RefinementProperties} - loop limits, policy, timeouts</li>
 * <li>{@link GuardrailProperties} - DSL version and advisory issue kinds</li>
 * <li>{@link SummarizerProperties} - history summary size</li>
 * <li>{@link SessionsProperties} - concurrent session pool</li>
 * <li>{@link ProposerProperties} - proposer provider selection</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "nsla")
@Data
public class NslaProperties {

    private RefinementProperties refinement = new RefinementProperties();
    private GuardrailProperties guardrail = new GuardrailProperties();
    private SummarizerProperties summarizer = new SummarizerProperties();
    private SessionsProperties sessions = new SessionsProperties();
    private ProposerProperties proposer = new ProposerProperties();

    @Data
    public static class RefinementProperties {
        private int maxIters = 3;
        private String policy = "fail_fast";
        private long solverTimeoutMs = 5000;
        private long proposerTimeoutMs = 60000;
    }

    @Data
    public static class GuardrailProperties {
        private String dslVersion = "2.1";
        private List<String> advisoryKinds = new ArrayList<>(
                List.of("contradiction", "undeclared_constant", "version_mismatch"));
    }

    @Data
    public static class SummarizerProperties {
        private int maxEntries = 3;
    }

    @Data
    public static class SessionsProperties {
        private int maxConcurrent = 4;
    }

    @Data
    public static class ProposerProperties {
        private String provider = "none";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** "openai" (any OpenAI-compatible endpoint) or "anthropic". */
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private Double temperature = 0.0;
        private long timeoutMs = 60000;
        private int maxTokens = 4096;
        private int maxRefinementAttempts = 2;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }
}
