package dumb.obligato;

import dumb.obligato.Obligation.Body;
import dumb.obligato.Obligation.Mode;
import dumb.obligato.Obligation.Opacity;
import dumb.obligato.Obligation.Status;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ObligationGraphTest {

    private static Obligation obl(int pos, String type, Integer... deps) {
        return new Obligation(Obligation.name("p", pos), Term.of(type), "", new TreeSet<>(List.of(deps)),
                Status.DEFAULT, null, null);
    }

    /** 0 <- 1 <- 2, and 3 depending on 0 only. */
    private static List<Obligation> diamond() {
        return new ArrayList<>(List.of(
                obl(0, "A"),
                obl(1, "(B ?p_obligation_1)", 0),
                obl(2, "(C ?p_obligation_2)", 1),
                obl(3, "(D ?p_obligation_1)", 0)));
    }

    @Test
    void dependenciesAreTransitive() {
        var obls = diamond();
        assertEquals(Set.of(0, 1), ObligationGraph.dependencies(obls, 2));
        assertEquals(Set.of(), ObligationGraph.dependencies(obls, 0));
        assertEquals(Set.of(1, 2, 3), ObligationGraph.dependents(obls, 0));
        assertEquals(Set.of(2), ObligationGraph.dependents(obls, 1));
    }

    @Test
    void attemptableOnceDependenciesAreSolved() {
        var obls = diamond();
        assertEquals(List.of(0), ObligationGraph.attemptable(obls));
        obls.set(0, obls.get(0).withBody(new Body.Inline(Term.of("a"))));
        assertEquals(List.of(1, 3), ObligationGraph.attemptable(obls));
        assertEquals(1, ObligationGraph.firstAttemptable(obls).getAsInt());
        assertFalse(ObligationGraph.isAttemptable(obls, 0));
        assertEquals(3, ObligationGraph.remaining(obls));
        assertEquals(List.of("p_obligation_2"), ObligationGraph.unsolved(obls, List.of(0, 1)));
    }

    @Test
    void substitutionOfUnsolvedFails() {
        var obls = diamond();
        var env = new Kernel.Basic().env();
        assertThrows(IllegalStateException.class, () -> ObligationGraph.substitution(false, obls, List.of(0), env));
    }

    @Test
    void transparentSolutionsUnfoldOnlyWhenExpanding() {
        var kernel = new Kernel.Basic();
        kernel.declare(Kernel.ConstantEntry.definition("p_obligation_1", Term.of("A"), Term.of("(mk a)"), false,
                Kernel.Kind.OBLIGATION, Kernel.Scope.GLOBAL, Universes.EMPTY));
        var obls = diamond();
        obls.set(0, obls.get(0).withStatus(new Status(Opacity.TRANSPARENT, Mode.DEFINE))
                .withBody(new Body.Defined("p_obligation_1")));
        var env = kernel.env();
        var folded = ObligationGraph.substitution(false, obls, List.of(0), env).get(0);
        assertEquals(Term.Atom.of("p_obligation_1"), folded.term());
        assertEquals(Term.of("A"), folded.type());
        assertEquals(Term.of("(mk a)"), ObligationGraph.substitution(true, obls, List.of(0), env).get(0).term());

        obls.set(0, obls.get(0).withStatus(Status.DEFAULT));
        assertEquals(Term.Atom.of("p_obligation_1"), ObligationGraph.substitution(true, obls, List.of(0), env).get(0).term());
    }

    @Test
    void substDepsFillsSolvedDependencies() {
        var obls = diamond();
        var env = new Kernel.Basic().env();
        obls.set(0, obls.get(0).withBody(new Body.Inline(Term.of("a"))));
        obls.set(1, obls.get(1).withBody(new Body.Inline(Term.of("(b a)"))));
        assertEquals(Term.of("(C (b a))"), ObligationGraph.substDeps(obls, 2, env).type());
        assertSame(obls.get(0), ObligationGraph.substDeps(obls, 0, env));
    }

    @Test
    void bodyIsSetOnce() {
        var o = obl(0, "A").withBody(new Body.Inline(Term.of("a")));
        assertThrows(IllegalStateException.class, () -> o.withBody(new Body.Inline(Term.of("b"))));
    }
}
