package me.golemcore.nsla.domain.service;

import me.golemcore.nsla.domain.loop.RefinementLoop;
import me.golemcore.nsla.domain.model.RefinementRequest;
import me.golemcore.nsla.domain.model.SessionResult;
import me.golemcore.nsla.domain.model.SessionState;
import me.golemcore.nsla.testsupport.Programs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefinementSessionCoordinatorTest {

    private RefinementLoop refinementLoop;
    private ExecutorService executor;
    private RefinementSessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        refinementLoop = mock(RefinementLoop.class);
        executor = Executors.newSingleThreadExecutor();
        coordinator = new RefinementSessionCoordinator(refinementLoop, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static RefinementRequest request(String sessionId) {
        return RefinementRequest.builder()
                .sessionId(sessionId)
                .seed(Programs.contractualLiability())
                .build();
    }

    private static SessionResult result(String sessionId, SessionState state) {
        return SessionResult.builder()
                .sessionId(sessionId)
                .terminalState(state)
                .stateTrace(List.of(state))
                .history(List.of())
                .build();
    }

    // ===== Submission =====

    @Test
    void shouldRunSessionOnExecutor() throws Exception {
        when(refinementLoop.run(any())).thenReturn(result("s-1", SessionState.CONVERGED));

        SessionResult result = coordinator.submit(request("s-1")).get(5, TimeUnit.SECONDS);

        assertEquals(SessionState.CONVERGED, result.getTerminalState());
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(coordinator.runningSessions().isEmpty());
    }

    @Test
    void shouldAssignSessionIdWhenMissing() throws Exception {
        when(refinementLoop.run(any())).thenReturn(result("generated", SessionState.EXHAUSTED));

        coordinator.submit(request(null)).get(5, TimeUnit.SECONDS);

        ArgumentCaptor<RefinementRequest> captor = ArgumentCaptor.forClass(RefinementRequest.class);
        verify(refinementLoop).run(captor.capture());
        assertNotNull(captor.getValue().getSessionId());
        assertEquals(Programs.contractualLiability(), captor.getValue().getSeed());
    }

    @Test
    void shouldRejectDuplicateRunningSession() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(refinementLoop.run(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return result("s-1", SessionState.STALLED);
        });

        CompletableFuture<SessionResult> first = coordinator.submit(request("s-1"));

        assertThrows(IllegalStateException.class, () -> coordinator.submit(request("s-1")));
        assertTrue(coordinator.runningSessions().contains("s-1"));
        release.countDown();
        assertEquals(SessionState.STALLED, first.get(5, TimeUnit.SECONDS).getTerminalState());
    }

    @Test
    void shouldPropagateLoopCrash() {
        when(refinementLoop.run(any())).thenThrow(new IllegalStateException("boom"));

        CompletableFuture<SessionResult> future = coordinator.submit(request("s-1"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldCompleteExceptionallyWhenLoopOverflowsStack() throws Exception {
        when(refinementLoop.run(any())).thenThrow(new StackOverflowError());

        CompletableFuture<SessionResult> future = coordinator.submit(request("s-1"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(StackOverflowError.class, error.getCause());
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(coordinator.runningSessions().isEmpty());
    }

    // ===== Cancellation =====

    @Test
    void shouldReturnFalseForUnknownSession() {
        assertFalse(coordinator.cancel("missing"));
    }

    @Test
    void shouldCancelQueuedSessionWithoutRunningIt() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(refinementLoop.run(argThat(request -> request != null && "busy".equals(request.getSessionId()))))
                .thenAnswer(invocation -> {
                    started.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return result("busy", SessionState.EXHAUSTED);
                });

        CompletableFuture<SessionResult> busy = coordinator.submit(request("busy"));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<SessionResult> queued = coordinator.submit(request("queued"));

        assertTrue(coordinator.cancel("queued"));
        SessionResult cancelled = queued.get(5, TimeUnit.SECONDS);
        assertEquals(SessionState.CANCELLED, cancelled.getTerminalState());
        assertTrue(cancelled.getHistory().isEmpty());
        assertFalse(coordinator.runningSessions().contains("queued"));

        release.countDown();
        busy.get(5, TimeUnit.SECONDS);
        verify(refinementLoop, never()).run(argThat(request -> request != null
                && "queued".equals(request.getSessionId())));
    }

    @Test
    void shouldInterruptRunningSession() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(refinementLoop.run(any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                new CountDownLatch(1).await(5, TimeUnit.SECONDS);
                return result("s-1", SessionState.EXHAUSTED);
            } catch (InterruptedException e) {
                return result("s-1", SessionState.CANCELLED);
            }
        });

        CompletableFuture<SessionResult> future = coordinator.submit(request("s-1"));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(coordinator.cancel("s-1"));
        assertEquals(SessionState.CANCELLED, future.get(5, TimeUnit.SECONDS).getTerminalState());
    }
}
