package me.golemcore.nsla.domain.model;

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

import java.util.Locale;

/**
 * How the controller reacts to blocking guardrail issues and compile errors.
 */
public enum RefinementPolicy {

    /** Terminate the session as {@code FAILED}. */
    FAIL_FAST,

    /** Re-propose once per iteration with the issues attached as context. */
    AUTO_RETRY,

    /**
     * Compile leniently; when that also fails, re-evaluate the previous
     * iteration's program.
     */
    FALLBACK_TO_PREVIOUS;

    /**
     * Accepts {@code fail_fast}, {@code FAIL_FAST}, {@code fail-fast}.
     */
    public static RefinementPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FAIL_FAST;
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
