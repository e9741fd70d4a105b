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

import java.util.List;

/**
 * Outcome of one satisfiability check.
 *
 * @param verdict
 *            raw answer
 * @param unsatCore
 *            labels of tracked assertions in the unsatisfiable core (UNSAT
 *            only)
 * @param reasonUnknown
 *            backend explanation when the verdict is UNKNOWN
 */
public record SolverCheck(SolverVerdict verdict, List<String> unsatCore, String reasonUnknown) {

    public SolverCheck {
        unsatCore = unsatCore == null ? List.of() : List.copyOf(unsatCore);
    }

    public static SolverCheck sat() {
        return new SolverCheck(SolverVerdict.SAT, List.of(), null);
    }

    public static SolverCheck unsat(List<String> core) {
        return new SolverCheck(SolverVerdict.UNSAT, core, null);
    }

    public static SolverCheck unknown(String reason) {
        return new SolverCheck(SolverVerdict.UNKNOWN, List.of(), reason);
    }

    public boolean isSat() {
        return verdict == SolverVerdict.SAT;
    }

    public boolean isUnsat() {
        return verdict == SolverVerdict.UNSAT;
    }
}
