package me.golemcore.nsla.domain.loop;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.nsla.domain.model.IssueKind;
import me.golemcore.nsla.domain.model.RefinementPolicy;
import me.golemcore.nsla.domain.service.ConstraintCompiler;
import me.golemcore.nsla.domain.service.DefaultHistorySummarizer;
import me.golemcore.nsla.domain.service.ExpressionParser;
import me.golemcore.nsla.domain.service.FeedbackInterpreter;
import me.golemcore.nsla.domain.service.GuardrailValidator;
import me.golemcore.nsla.domain.service.ProgramJsonCodec;
import me.golemcore.nsla.infrastructure.config.NslaProperties;
import me.golemcore.nsla.port.outbound.HistorySummarizerPort;
import me.golemcore.nsla.port.outbound.ProposerPort;
import me.golemcore.nsla.port.outbound.SolverPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for the refinement loop (domain services + ports). */
@Configuration
public class RefinementConfiguration {

    @Bean
    public ExpressionParser expressionParser() {
        return new ExpressionParser();
    }

    @Bean
    public GuardrailValidator guardrailValidator(ExpressionParser parser, NslaProperties properties) {
        NslaProperties.GuardrailProperties guardrail = properties.getGuardrail();
        return new GuardrailValidator(parser, guardrail.getDslVersion(), advisoryKinds(guardrail.getAdvisoryKinds()));
    }

    @Bean
    public ConstraintCompiler constraintCompiler(SolverPort solverPort, GuardrailValidator validator,
            ExpressionParser parser) {
        return new ConstraintCompiler(solverPort, validator, parser);
    }

    @Bean
    public FeedbackInterpreter feedbackInterpreter(NslaProperties properties) {
        return new FeedbackInterpreter(Duration.ofMillis(properties.getRefinement().getSolverTimeoutMs()));
    }

    @Bean
    public HistorySummarizerPort historySummarizer(NslaProperties properties) {
        return new DefaultHistorySummarizer(properties.getSummarizer().getMaxEntries());
    }

    @Bean
    public ProgramJsonCodec programJsonCodec(ObjectMapper objectMapper, ExpressionParser parser) {
        return new ProgramJsonCodec(objectMapper, parser);
    }

    @Bean
    public RefinementLoopConfig refinementLoopConfig(NslaProperties properties) {
        NslaProperties.RefinementProperties refinement = properties.getRefinement();
        return RefinementLoopConfig.builder()
                .maxIters(refinement.getMaxIters())
                .policy(RefinementPolicy.fromValue(refinement.getPolicy()))
                .solverTimeoutMs(refinement.getSolverTimeoutMs())
                .proposerTimeoutMs(refinement.getProposerTimeoutMs())
                .build();
    }

    @Bean
    public RefinementLoop refinementLoop(GuardrailValidator validator, ConstraintCompiler compiler,
            FeedbackInterpreter interpreter, ProposerPort proposerPort, HistorySummarizerPort summarizer,
            ExpressionParser parser, RefinementLoopConfig config, Clock clock) {
        return new RefinementLoop(validator, compiler, interpreter, proposerPort, summarizer, parser, config,
                clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService refinementExecutor(NslaProperties properties) {
        int threads = Math.max(1, properties.getSessions().getMaxConcurrent());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "refinement-session-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    static Set<IssueKind> advisoryKinds(List<String> names) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        Set<IssueKind> kinds = EnumSet.noneOf(IssueKind.class);
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                kinds.add(IssueKind.valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT)));
            }
        }
        return kinds;
    }
}
