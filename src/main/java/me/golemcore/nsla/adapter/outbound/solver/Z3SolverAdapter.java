package me.golemcore.nsla.adapter.outbound.solver;

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

import com.microsoft.z3.Context;
import com.microsoft.z3.Z3Exception;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.port.outbound.SolverBackendException;
import me.golemcore.nsla.port.outbound.SolverContext;
import me.golemcore.nsla.port.outbound.SolverPort;
import org.springframework.stereotype.Component;

/**
 * Z3 backend. Each compilation gets its own native {@link Context}; contexts
 * are never pooled or shared between threads.
 */
@Component
@Slf4j
public class Z3SolverAdapter implements SolverPort {

    private static final String BACKEND_ID = "z3";

    @Override
    public String getBackendId() {
        return BACKEND_ID;
    }

    @Override
    public SolverContext openContext() {
        try {
            return new Z3SolverContext(new Context());
        } catch (Z3Exception | UnsatisfiedLinkError e) {
            log.error("[Z3] Failed to create context: {}", e.getMessage());
            throw new SolverBackendException("Cannot create Z3 context: " + e.getMessage(), e);
        }
    }
}
