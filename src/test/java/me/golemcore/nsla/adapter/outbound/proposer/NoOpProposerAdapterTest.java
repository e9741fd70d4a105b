package me.golemcore.nsla.adapter.outbound.proposer;

import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;
import me.golemcore.nsla.testsupport.Programs;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class NoOpProposerAdapterTest {

    private final NoOpProposerAdapter adapter = new NoOpProposerAdapter();

    @Test
    void shouldReportNoneProvider() {
        assertEquals("none", adapter.getProviderId());
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldEchoPriorProgram() {
        Program prior = Programs.contractualLiability();

        Program proposed = adapter.propose(ProposalContext.builder().priorProgram(prior).build()).join();

        assertSame(prior, proposed);
    }

    @Test
    void shouldFailWithoutPriorProgram() {
        CompletableFuture<Program> future = adapter.propose(ProposalContext.builder().sessionId("s-1").build());

        assertTrue(future.isCompletedExceptionally());
    }
}
