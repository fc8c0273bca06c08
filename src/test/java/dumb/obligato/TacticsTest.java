package dumb.obligato;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TacticsTest {

    private static Proof goal(String statement) {
        return Proof.start("t", Proof.Info.theorem(), new Kernel.Basic().env(), Universes.EMPTY, Term.of(statement));
    }

    private static Term solve(String statement, Tactic tactic) {
        return goal(statement).by(tactic).proof().returnProof().entries().get(0).body();
    }

    @ParameterizedTest
    @ValueSource(strings = {"idtac", "assumption", "trivial", "split", "intro", "intros", "admit", "program_simpl", "auto"})
    void libraryTacticsAreNamed(String name) {
        assertEquals(name, Tactics.named(name).orElseThrow().name());
    }

    @Test
    void unknownNameIsEmpty() {
        assertTrue(Tactics.named("omega").isEmpty());
    }

    @Test
    void programSimplSolvesWhatItCan() {
        assertEquals(Term.of("(fun H A (fun H1 B (conj H H1)))"), solve("(-> A (-> B (and A B)))", Tactics.PROGRAM_SIMPL));
        var left = goal("(and True P)").by(Tactics.PROGRAM_SIMPL).proof();
        assertEquals(1, left.openGoals());
        assertEquals(Term.of("P"), left.focusedGoal().orElseThrow().conclusion());
    }

    @Test
    void programSimplNeverFails() {
        var p = goal("P").by(Tactics.PROGRAM_SIMPL).proof();
        assertEquals(1, p.openGoals());
    }

    @Test
    void autoFailsUnlessSolved() {
        assertThrows(ProgramException.TacticFailure.class, () -> goal("(and True P)").by(Tactics.AUTO));
        assertEquals(Term.of("(conj I (eq_refl a))"), solve("(and True (= a a))", Tactics.AUTO));
    }

    @Test
    void introsNamesFreshHypotheses() {
        var p = goal("(-> A (-> B C))").by(Tactics.INTROS).proof();
        assertEquals(List.of("H", "H1"), p.focusedGoal().orElseThrow().context().stream().map(Tactic.Hyp::name).toList());
        var named = goal("(-> A A)").by(Tactics.intro("a")).proof();
        assertEquals("a", named.focusedGoal().orElseThrow().context().get(0).name());
    }

    @Test
    void exactRejectsHoles() {
        assertThrows(ProgramException.TacticFailure.class, () -> goal("P").by(Tactics.exact("(f ?x)")));
        assertEquals(Term.of("(f x)"), solve("P", Tactics.exact("(f x)")));
    }

    @Test
    void combinators() {
        assertEquals(Term.of("(conj I I)"), solve("(and True True)", Tactics.then(Tactics.SPLIT, Tactics.TRIVIAL)));
        assertEquals(Term.of("I"), solve("True", Tactics.first(Tactics.SPLIT, Tactics.TRIVIAL)));
        var tried = goal("P").by(Tactics.tryTactic(Tactics.SPLIT)).proof();
        assertEquals(1, tried.openGoals());
        var e = assertThrows(ProgramException.TacticFailure.class, () -> goal("P").by(Tactics.fail("nope")));
        assertEquals("nope", e.getMessage());
        assertThrows(ProgramException.TacticFailure.class, () -> goal("P").by(Tactics.solve(Tactics.IDTAC)));
    }
}
