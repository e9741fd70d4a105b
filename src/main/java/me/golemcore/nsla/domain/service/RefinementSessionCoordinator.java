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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nsla.domain.loop.RefinementLoop;
import me.golemcore.nsla.domain.model.RefinementRequest;
import me.golemcore.nsla.domain.model.SessionResult;
import me.golemcore.nsla.domain.model.SessionState;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs independent refinement sessions on a bounded executor.
 *
 * <p>
 * Each session is one task; sessions share nothing except this registry of
 * running tasks. {@link #cancel(String)} interrupts the task, which ends the
 * session as {@code CANCELLED} at its next state boundary. A session cancelled
 * before it started completes immediately with an empty history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefinementSessionCoordinator {

    private final RefinementLoop refinementLoop;
    private final ExecutorService refinementExecutor;

    private final Map<String, RunningSession> running = new ConcurrentHashMap<>();

    public CompletableFuture<SessionResult> submit(RefinementRequest request) {
        RefinementRequest effective = request.getSessionId() != null
                ? request
                : RefinementRequest.builder()
                        .sessionId(UUID.randomUUID().toString())
                        .question(request.getQuestion())
                        .seed(request.getSeed())
                        .policy(request.getPolicy())
                        .maxIters(request.getMaxIters())
                        .build();
        String sessionId = effective.getSessionId();

        RunningSession session = new RunningSession(sessionId);
        if (running.putIfAbsent(sessionId, session) != null) {
            throw new IllegalStateException("Session already running: " + sessionId);
        }
        session.task = refinementExecutor.submit(() -> execute(session, effective));
        log.debug("[Sessions] Submitted session {} ({} running)", sessionId, running.size());
        return session.result;
    }

    private void execute(RunningSession session, RefinementRequest request) {
        if (!session.started.compareAndSet(false, true)) {
            return;
        }
        try {
            session.result.complete(refinementLoop.run(request));
        } catch (RuntimeException e) { // NOSONAR - must not kill executor thread
            log.error("[Sessions] Session {} crashed", session.sessionId, e);
            session.result.completeExceptionally(e);
        } catch (Error e) { // NOSONAR - waiting callers must observe the failure
            log.error("[Sessions] Session {} aborted by error", session.sessionId, e);
            session.result.completeExceptionally(e);
            throw e;
        } finally {
            running.remove(session.sessionId, session);
        }
    }

    /**
     * Requests cancellation of a running session.
     *
     * @return {@code false} if no such session is running
     */
    public boolean cancel(String sessionId) {
        RunningSession session = running.get(sessionId);
        if (session == null) {
            return false;
        }
        if (session.started.compareAndSet(false, true)) {
            running.remove(sessionId, session);
            Future<?> task = session.task;
            if (task != null) {
                task.cancel(false);
            }
            session.result.complete(SessionResult.builder()
                    .sessionId(sessionId)
                    .terminalState(SessionState.CANCELLED)
                    .stateTrace(List.of(SessionState.CANCELLED))
                    .history(List.of())
                    .build());
            log.info("[Sessions] Session {} cancelled before start", sessionId);
            return true;
        }
        Future<?> task = session.task;
        boolean cancelled = task != null && task.cancel(true);
        log.info("[Sessions] Cancel requested for session {} (interrupted={})", sessionId, cancelled);
        return true;
    }

    public Set<String> runningSessions() {
        return Set.copyOf(running.keySet());
    }

    private static final class RunningSession {

        private final String sessionId;
        private final CompletableFuture<SessionResult> result = new CompletableFuture<>();
        private final AtomicBoolean started = new AtomicBoolean();
        private volatile Future<?> task;

        private RunningSession(String sessionId) {
            this.sessionId = sessionId;
        }
    }
}
