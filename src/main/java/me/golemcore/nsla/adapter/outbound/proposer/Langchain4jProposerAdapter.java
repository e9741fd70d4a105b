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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.domain.model.Fact;
import me.golemcore.nsla.domain.model.Feedback;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;
import me.golemcore.nsla.domain.model.Rule;
import me.golemcore.nsla.domain.model.StructuralException;
import me.golemcore.nsla.domain.model.ValidationIssue;
import me.golemcore.nsla.domain.service.ProgramJsonCodec;
import me.golemcore.nsla.infrastructure.config.NslaProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Proposer backed by a langchain4j chat model (OpenAI-compatible or
 * Anthropic).
 *
 * <p>
 * The prompt carries the DSL contract, the prior program as JSON and the
 * solver diagnostics. The reply must contain one program JSON object. When
 * the proposed program does not mention every predicate reported as a missing
 * link, the model is asked again with an explicit hint, up to
 * {@code nsla.proposer.langchain4j.max-refinement-attempts} calls; the last
 * parsed program is returned either way.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@Slf4j
public class Langchain4jProposerAdapter implements ProposerProviderAdapter {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final int MAX_RATE_LIMIT_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final Pattern JSON_FENCE = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    static final String SYSTEM_PROMPT = """
            You refine logic programs for a symbolic reasoner. Reply with ONE JSON object and nothing else.

            Program format:
            {
              "version": "2.1",
              "sorts": [{"name": "Persona", "parent": "Entity"}],
              "constants": [{"name": "d", "sort": "Persona"}],
              "predicates": [{"name": "Inadempimento", "arity": 2, "arg_sorts": ["Persona", "Contratto"]}],
              "facts": [{"predicate": "Inadempimento", "args": ["d", "c"], "value": true}],
              "rules": [{"id": "r1", "condition": "A(x) and B(x)", "conclusion": "C(x)"}],
              "axioms": [{"id": "a1", "formula": "not (A(x) and D(x))"}],
              "query": "C(x)"
            }

            Formulas use atoms Name(arg, ...) with the connectives not, and, or, implies.
            Every predicate used in a formula must be declared with its exact arity.
            Keep the query unless it is malformed. Add facts, rules or axioms for every missing link.
            """;

    private final NslaProperties properties;
    private final ProgramJsonCodec codec;

    private ChatModel chatModel;
    private volatile boolean initialized;

    @Autowired
    public Langchain4jProposerAdapter(NslaProperties properties, ProgramJsonCodec codec) {
        this.properties = properties;
        this.codec = codec;
    }

    // Visible for testing
    Langchain4jProposerAdapter(NslaProperties properties, ProgramJsonCodec codec, ChatModel chatModel) {
        this.properties = properties;
        this.codec = codec;
        this.chatModel = chatModel;
        this.initialized = true;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        NslaProperties.Langchain4jProperties settings = settings();
        try {
            this.chatModel = createModel(settings);
            initialized = true;
            log.info("Langchain4j proposer initialized with {}/{}", settings.getProvider(), settings.getModel());
        } catch (IllegalStateException e) {
            log.warn("Failed to initialize Langchain4j proposer: {}", e.getMessage());
        }
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean isAvailable() {
        return settings().getProviders().values().stream()
                .anyMatch(provider -> provider.getApiKey() != null && !provider.getApiKey().isBlank());
    }

    @Override
    public CompletableFuture<Program> propose(ProposalContext context) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j proposer is not available");
            }
            return refine(context);
        });
    }

    private Program refine(ProposalContext context) {
        List<String> missingLinks = context.getPriorFeedback() != null
                ? context.getPriorFeedback().missingLinks()
                : List.of();
        int maxAttempts = Math.max(1, settings().getMaxRefinementAttempts());
        String retryHint = null;
        Program lastProgram = null;
        StructuralException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String reply = chat(List.of(SystemMessage.from(SYSTEM_PROMPT),
                    UserMessage.from(buildPrompt(context, retryHint))));
            try {
                Program program = codec.read(extractJson(reply));
                lastProgram = program;
                if (coversMissingLinks(program, missingLinks)) {
                    log.info("[Proposer] Session {}: program accepted on attempt {}/{}", context.getSessionId(),
                            attempt, maxAttempts);
                    return program;
                }
                retryHint = buildRetryHint(missingLinks);
                log.warn("[Proposer] Session {}: reply does not cover missing links {} (attempt {}/{})",
                        context.getSessionId(), missingLinks, attempt, maxAttempts);
            } catch (StructuralException e) {
                lastError = e;
                retryHint = "Your previous reply was not a valid program: " + e.getMessage()
                        + ". Reply with the JSON object only.";
                log.warn("[Proposer] Session {}: unusable reply (attempt {}/{}): {}", context.getSessionId(),
                        attempt, maxAttempts, e.getMessage());
            }
        }
        if (lastProgram != null) {
            return lastProgram;
        }
        throw lastError;
    }

    private String chat(List<ChatMessage> messages) {
        for (int attempt = 0;; attempt++) {
            try {
                ChatResponse response = chatModel.chat(messages);
                return response.aiMessage().text();
            } catch (RateLimitException e) {
                if (attempt >= MAX_RATE_LIMIT_RETRIES) {
                    throw e;
                }
                long backoffMs = INITIAL_BACKOFF_MS << attempt;
                log.warn("[Proposer] Rate limit hit (attempt {}/{}), retrying in {}ms", attempt + 1,
                        MAX_RATE_LIMIT_RETRIES, backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Proposal interrupted during retry backoff", ie);
                }
            }
        }
    }

    // ==================== Prompt ====================

    String buildPrompt(ProposalContext context, String retryHint) {
        StringBuilder sb = new StringBuilder();
        if (context.getQuestion() != null && !context.getQuestion().isBlank()) {
            sb.append("## Question\n").append(context.getQuestion()).append("\n\n");
        }
        if (context.getPriorProgram() != null) {
            sb.append("## Current program\n").append(codec.write(context.getPriorProgram())).append("\n\n");
        }
        Feedback feedback = context.getPriorFeedback();
        if (feedback != null) {
            sb.append("## Solver feedback\n")
                    .append("status: ").append(feedback.status().wireName()).append('\n')
                    .append("missing_links: ").append(feedback.missingLinks()).append('\n')
                    .append("conflicting_axioms: ").append(feedback.conflictingAxioms()).append('\n')
                    .append("detail: ").append(feedback.detail()).append("\n\n");
        }
        if (!context.getGuardrailIssues().isEmpty()) {
            sb.append("## Guardrail issues to fix\n");
            for (ValidationIssue issue : context.getGuardrailIssues()) {
                sb.append("- ").append(issue).append('\n');
            }
            sb.append('\n');
        }
        if (context.getCompileError() != null) {
            sb.append("## Compilation error\n").append(context.getCompileError()).append("\n\n");
        }
        String history = context.getHistorySummary();
        if (history != null && !history.isBlank()) {
            sb.append("## History\n").append(history).append("\n\n");
        }
        if (retryHint != null) {
            sb.append("## Attention\n").append(retryHint).append("\n\n");
        }
        sb.append("Return the refined program as JSON only.");
        return sb.toString();
    }

    static String buildRetryHint(List<String> missingLinks) {
        return "Add facts, rules or axioms for each predicate in missing_links ("
                + String.join(", ", new TreeSet<>(missingLinks)) + ") before answering.";
    }

    /**
     * Whether every missing-link predicate occurs as an atom in the program's
     * facts, rules, axioms or query.
     */
    static boolean coversMissingLinks(Program program, List<String> missingLinks) {
        if (missingLinks.isEmpty()) {
            return true;
        }
        List<String> corpus = new ArrayList<>();
        for (Fact fact : program.getFacts()) {
            corpus.add(fact.predicate() + "(" + String.join(",", fact.args()) + ")");
        }
        for (Rule rule : program.getRules()) {
            corpus.add(rule.condition());
            corpus.add(rule.conclusion());
        }
        program.getAxioms().forEach(axiom -> corpus.add(axiom.formula()));
        if (program.getQuery() != null) {
            corpus.add(program.getQuery());
        }
        String haystack = String.join("\n", corpus).toLowerCase(Locale.ROOT);
        for (String predicate : missingLinks) {
            String token = predicate == null ? "" : predicate.trim().toLowerCase(Locale.ROOT);
            if (!token.isEmpty() && !haystack.contains(token + "(")) {
                return false;
            }
        }
        return true;
    }

    static String extractJson(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new StructuralException("Empty proposer reply");
        }
        Matcher fence = JSON_FENCE.matcher(reply);
        if (fence.find()) {
            return fence.group(1);
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return reply.substring(start, end + 1);
        }
        throw new StructuralException("Proposer reply contains no JSON object");
    }

    // ==================== Model creation ====================

    private NslaProperties.Langchain4jProperties settings() {
        return properties.getProposer().getLangchain4j();
    }

    private ChatModel createModel(NslaProperties.Langchain4jProperties settings) {
        NslaProperties.ProviderProperties config = settings.getProviders().get(settings.getProvider());
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + settings.getProvider()
                    + ". Add nsla.proposer.langchain4j.providers." + settings.getProvider() + ".api-key");
        }
        Duration timeout = Duration.ofMillis(settings.getTimeoutMs());
        if (PROVIDER_ANTHROPIC.equals(settings.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(settings.getModel())
                    .maxRetries(0)
                    .maxTokens(settings.getMaxTokens())
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (settings.getTemperature() != null) {
                builder.temperature(settings.getTemperature());
            }
            return builder.build();
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(settings.getModel())
                .maxRetries(0)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (settings.getTemperature() != null) {
            builder.temperature(settings.getTemperature());
        }
        return builder.build();
    }
}
