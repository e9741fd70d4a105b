package me.golemcore.nsla.domain.loop;

import me.golemcore.nsla.domain.model.IssueKind;
import me.golemcore.nsla.domain.model.RefinementPolicy;
import me.golemcore.nsla.domain.service.ExpressionParser;
import me.golemcore.nsla.domain.service.GuardrailValidator;
import me.golemcore.nsla.infrastructure.config.NslaProperties;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RefinementConfigurationTest {

    private final RefinementConfiguration configuration = new RefinementConfiguration();

    // ===== Advisory kinds =====

    @Test
    void shouldMapAdvisoryKindSpellings() {
        Set<IssueKind> kinds = RefinementConfiguration.advisoryKinds(
                List.of(" contradiction", "UNDECLARED-CONSTANT", "version_mismatch", ""));

        assertEquals(Set.of(IssueKind.CONTRADICTION, IssueKind.UNDECLARED_CONSTANT, IssueKind.VERSION_MISMATCH),
                kinds);
    }

    @Test
    void shouldReturnNoAdvisoryKindsForEmptyList() {
        assertTrue(RefinementConfiguration.advisoryKinds(List.of()).isEmpty());
        assertTrue(RefinementConfiguration.advisoryKinds(null).isEmpty());
        assertTrue(RefinementConfiguration.advisoryKinds(Arrays.asList(null, " ")).isEmpty());
    }

    @Test
    void shouldRejectUnknownAdvisoryKind() {
        List<String> names = List.of("typo");

        assertThrows(IllegalArgumentException.class, () -> RefinementConfiguration.advisoryKinds(names));
    }

    @Test
    void shouldConfigureGuardrailFromProperties() {
        NslaProperties properties = new NslaProperties();
        properties.getGuardrail().setAdvisoryKinds(List.of("duplicate_id"));

        GuardrailValidator validator = configuration.guardrailValidator(new ExpressionParser(), properties);

        assertEquals(Set.of(IssueKind.DUPLICATE_ID), validator.getAdvisoryKinds());
    }

    // ===== Loop =====

    @Test
    void shouldBuildLoopConfigFromProperties() {
        NslaProperties properties = new NslaProperties();
        properties.getRefinement().setMaxIters(7);
        properties.getRefinement().setPolicy("auto-retry");
        properties.getRefinement().setSolverTimeoutMs(1500);
        properties.getRefinement().setProposerTimeoutMs(9000);

        RefinementLoopConfig config = configuration.refinementLoopConfig(properties);

        assertEquals(7, config.getMaxIters());
        assertEquals(RefinementPolicy.AUTO_RETRY, config.getPolicy());
        assertEquals(1500, config.getSolverTimeoutMs());
        assertEquals(9000, config.getProposerTimeoutMs());
    }

    @Test
    void shouldUseDefaultsFromFreshProperties() {
        RefinementLoopConfig config = configuration.refinementLoopConfig(new NslaProperties());

        assertEquals(RefinementLoopConfig.defaultConfig(), config);
    }

    @Test
    void shouldRunSessionsOnNamedDaemonThreads() throws Exception {
        NslaProperties properties = new NslaProperties();
        properties.getSessions().setMaxConcurrent(0);
        ExecutorService executor = configuration.refinementExecutor(properties);
        try {
            Future<String> name = executor.submit(() -> Thread.currentThread().getName()
                    + ":" + Thread.currentThread().isDaemon());

            assertEquals("refinement-session-1:true", name.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
