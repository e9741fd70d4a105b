package me.golemcore.nsla.adapter.outbound.solver;

import me.golemcore.nsla.domain.model.SolverCheck;
import me.golemcore.nsla.domain.model.SolverFormula;
import me.golemcore.nsla.domain.model.SolverRelation;
import me.golemcore.nsla.domain.model.SolverTerm;
import me.golemcore.nsla.domain.model.SolverVerdict;
import me.golemcore.nsla.domain.model.TrackedAssertion;
import me.golemcore.nsla.port.outbound.SolverBackendException;
import me.golemcore.nsla.port.outbound.SolverContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class Z3SolverAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final Z3SolverAdapter adapter = new Z3SolverAdapter();
    private SolverContext context;

    @BeforeEach
    void setUp() {
        context = adapter.openContext();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private static TrackedAssertion fact(String label, SolverFormula formula) {
        return new TrackedAssertion(TrackedAssertion.Kind.FACT, label, formula);
    }

    @Test
    void shouldReportBackendId() {
        assertEquals("z3", adapter.getBackendId());
    }

    @Test
    void shouldBeSatisfiableForConsistentAssertions() {
        SolverFormula p = context.booleanConstant("P");
        SolverFormula q = context.booleanConstant("Q");

        SolverCheck check = context.check(List.of(fact("fact:P", p),
                new TrackedAssertion(TrackedAssertion.Kind.RULE, "r1", context.implies(p, q))), List.of(), TIMEOUT);

        assertEquals(SolverVerdict.SAT, check.verdict());
        assertTrue(check.unsatCore().isEmpty());
    }

    @Test
    void shouldReportUnsatCoreLabels() {
        SolverFormula p = context.booleanConstant("P");
        SolverFormula q = context.booleanConstant("Q");

        SolverCheck check = context.check(List.of(fact("fact:P", p), fact("fact:!P", context.not(p)),
                fact("fact:Q", q)), List.of(), TIMEOUT);

        assertTrue(check.isUnsat());
        assertTrue(check.unsatCore().containsAll(List.of("fact:P", "fact:!P")));
        assertFalse(check.unsatCore().contains("fact:Q"));
    }

    @Test
    void shouldExcludeUntrackedFormulasFromCore() {
        SolverFormula p = context.booleanConstant("P");

        SolverCheck check = context.check(List.of(fact("fact:P", p)), List.of(context.not(p)), TIMEOUT);

        assertTrue(check.isUnsat());
        assertEquals(List.of("fact:P"), check.unsatCore());
    }

    @Test
    void shouldKeepTrackedAssertionsApartFromSameNamedConstants() {
        SolverFormula lookalike = context.booleanConstant("__track_0");
        SolverFormula track = context.booleanConstant("track");
        SolverFormula trackBang = context.booleanConstant("track!0");

        SolverCheck check = context.check(List.of(fact("fact:!__track_0", context.not(lookalike)),
                fact("fact:!track", context.not(track)), fact("fact:!track!0", context.not(trackBang))),
                List.of(), TIMEOUT);

        assertTrue(check.isSat());
    }

    @Test
    void shouldShareIndividualsByName() {
        SolverRelation owes = context.relation("Owes", 2);
        SolverTerm debtor = context.individual("d");
        SolverTerm creditor = context.individual("c");
        SolverFormula stated = context.apply(owes, List.of(debtor, creditor));
        SolverFormula queried = context.apply(owes, List.of(context.individual("d"), context.individual("c")));

        SolverCheck check = context.check(List.of(fact("fact:Owes(d,c)", stated)), List.of(context.not(queried)),
                TIMEOUT);

        assertTrue(check.isUnsat());
    }

    @Test
    void shouldRejectWrongArgumentCount() {
        SolverRelation owes = context.relation("Owes", 2);
        List<SolverTerm> args = List.of(context.individual("d"));

        assertThrows(SolverBackendException.class, () -> context.apply(owes, args));
    }

    @Test
    void shouldRejectForeignFormula() {
        SolverFormula foreign = mock(SolverFormula.class);

        assertThrows(SolverBackendException.class, () -> context.not(foreign));
    }

    @Test
    void shouldRefuseUseAfterClose() {
        SolverContext closed = adapter.openContext();
        closed.close();
        closed.close();

        assertThrows(SolverBackendException.class, () -> closed.booleanConstant("P"));
        assertThrows(SolverBackendException.class, () -> closed.check(List.of(), List.of(), TIMEOUT));
    }

    @Test
    void shouldTreatTrueLiteralAsSatisfiable() {
        SolverCheck check = context.check(List.of(), List.of(context.literal(true)), Duration.ZERO);

        assertTrue(check.isSat());
    }
}
