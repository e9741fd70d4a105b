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
 * Solver verdict classification.
 */
public enum FeedbackStatus {

    CONSISTENT_ENTAILS(0),

    CONSISTENT_NO_ENTAILMENT(1),

    INCONSISTENT(2),

    UNKNOWN(3);

    private final int rank;

    FeedbackStatus(int rank) {
        this.rank = rank;
    }

    /**
     * Preference rank used when picking the best iteration (lower is better).
     */
    public int rank() {
        return rank;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
