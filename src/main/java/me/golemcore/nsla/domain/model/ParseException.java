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

import lombok.Getter;

/**
 * Formula text could not be parsed. {@link #getOffset()} is the UTF-8 byte
 * offset of the offending token within {@link #getSource()}.
 */
@Getter
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final int offset;

    public ParseException(String message, String source, int offset) {
        super(message + " at byte " + offset + " in '" + source + "'");
        this.source = source;
        this.offset = offset;
    }
}
