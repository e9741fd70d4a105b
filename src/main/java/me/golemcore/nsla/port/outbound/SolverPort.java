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

/**
 * Port for satisfiability backends. Each compilation opens its own context;
 * contexts are never shared.
 */
public interface SolverPort {

    /**
     * Returns the backend identifier (e.g., "z3").
     */
    String getBackendId();

    /**
     * Opens a fresh solver context. The caller owns and must close it.
     *
     * @throws SolverBackendException
     *             if the backend cannot be initialized
     */
    SolverContext openContext();
}
