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

import java.util.List;

/**
 * A compilation attempt was refused or failed. Fatal for that attempt only.
 */
@Getter
public class CompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Kind kind;
    private final transient List<ValidationIssue> issues;

    public CompileException(Kind kind, String message, List<ValidationIssue> issues) {
        super(message);
        this.kind = kind;
        this.issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public CompileException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.issues = List.of();
    }

    public static CompileException rejected(List<ValidationIssue> issues) {
        return new CompileException(Kind.VALIDATION_REJECTED,
                "Strict compilation refused: " + issues.size() + " blocking guardrail issue(s)", issues);
    }

    public static CompileException parse(String subject, ParseException cause) {
        return new CompileException(Kind.PARSE_ERROR, subject + ": " + cause.getMessage(), cause);
    }

    /**
     * Compile failure categories.
     */
    public enum Kind {
        /** Strict mode and the guardrail reported blocking issues. */
        VALIDATION_REJECTED,
        /** A formula text failed to parse. */
        PARSE_ERROR,
        /** The solver backend failed while building the context. */
        SOLVER_ERROR
    }
}
