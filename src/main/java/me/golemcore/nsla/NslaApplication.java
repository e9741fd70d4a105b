package me.golemcore.nsla;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Symbolic core of a neuro-symbolic reasoning pipeline.
 *
 * <p>
 * Takes logic programs from a proposer, validates them, compiles them into
 * solver constraints, interprets the verdict into diagnostics and drives a
 * bounded refinement loop until the query is entailed or the loop gives up.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → RefinementLoop, Guardrail, Compiler, Feedback
 * Ports              → SolverPort, ProposerPort, HistorySummarizerPort
 * Adapters           → Z3 solver, langchain4j / no-op proposers
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code nsla.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NslaApplication {

    public static void main(String[] args) {
        SpringApplication.run(NslaApplication.class, args);
    }

}
