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

/**
 * Named type tag for individuals (e.g. a legal role or document category).
 *
 * @param name
 *            sort name
 * @param parent
 *            optional parent sort, {@code null} for a root sort
 */
public record SortDecl(String name, String parent) {

    /** Implicit root sort, always available without declaration. */
    public static final String ENTITY = "Entity";

    public static SortDecl root(String name) {
        return new SortDecl(name, null);
    }

    public boolean hasParent() {
        return parent != null && !parent.isBlank();
    }
}
