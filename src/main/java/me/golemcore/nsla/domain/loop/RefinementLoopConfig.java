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

import lombok.Builder;
import lombok.Data;
import me.golemcore.nsla.domain.model.RefinementPolicy;

/**
 * Limits and policy of the refinement loop. Per-request values in
 * {@link me.golemcore.nsla.domain.model.RefinementRequest} take precedence.
 */
@Data
@Builder
public class RefinementLoopConfig {

    @Builder.Default
    private int maxIters = 3;

    @Builder.Default
    private RefinementPolicy policy = RefinementPolicy.FAIL_FAST;

    @Builder.Default
    private long solverTimeoutMs = 5000;

    @Builder.Default
    private long proposerTimeoutMs = 60000;

    public static RefinementLoopConfig defaultConfig() {
        return RefinementLoopConfig.builder().build();
    }
}
