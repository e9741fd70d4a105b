package me.golemcore.nsla.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.domain.model.Expression;

import java.util.HashMap;
import java.util.Map;

/**
 * Parsed-formula cache scoped to one refinement session. Not thread-safe:
 * a session runs on a single thread and each session gets its own instance.
 */
@Slf4j
public class ExpressionCache {

    private final ExpressionParser parser;
    private final Map<String, Expression> entries = new HashMap<>();
    private int hits;

    public ExpressionCache(ExpressionParser parser) {
        this.parser = parser;
    }

    /**
     * Returns the parsed form of {@code text}, parsing it on first use. Parse
     * failures are not cached.
     */
    public Expression parse(String text) {
        Expression cached = entries.get(text);
        if (cached != null) {
            hits++;
            return cached;
        }
        Expression parsed = parser.parse(text);
        entries.put(text, parsed);
        return parsed;
    }

    public int size() {
        return entries.size();
    }

    public int hits() {
        return hits;
    }

    public void clear() {
        log.debug("[Cache] Dropping {} parsed formula(s), {} hit(s)", entries.size(), hits);
        entries.clear();
        hits = 0;
    }
}
