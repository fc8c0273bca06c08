package dumb.obligato;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProofTest {

    private Kernel kernel;

    @BeforeEach
    void setUp() {
        kernel = new Kernel.Basic();
    }

    private Proof start(String statement) {
        return Proof.start("lem", Proof.Info.theorem(), kernel.env(), Universes.EMPTY, Term.of(statement));
    }

    @Test
    void tacticsTransformTheGoals() {
        var p = start("(-> A (and A True))");
        assertEquals(1, p.openGoals());
        var intro = p.by(Tactics.INTRO);
        assertTrue(intro.safe());
        var q = intro.proof();
        assertEquals(1, p.openGoals());
        assertEquals(Term.of("(and A True)"), q.focusedGoal().orElseThrow().conclusion());
        assertEquals("H", q.focusedGoal().orElseThrow().context().get(0).name());

        var split = q.by(Tactics.SPLIT).proof();
        assertEquals(2, split.openGoals());
        var done = split.by(Tactics.ASSUMPTION).proof().by(Tactics.TRIVIAL).proof();
        assertEquals(0, done.openGoals());
        assertTrue(done.focusedGoal().isEmpty());
        var out = done.returnProof();
        assertEquals(Term.of("(fun H A (conj H I))"), out.entries().get(0).body());
        assertEquals(Term.of("(-> A (and A True))"), out.entries().get(0).type());
        assertTrue(out.safe());
    }

    @Test
    void failingTacticKeepsTheState() {
        var p = start("A");
        assertThrows(ProgramException.TacticFailure.class, () -> p.by(Tactics.INTRO));
        assertEquals(1, p.openGoals());
        Tactic broken = (g, r) -> {
            throw new ArithmeticException("bad");
        };
        var e = assertThrows(ProgramException.TacticFailure.class, () -> p.by(broken));
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void noGoalLeft() {
        var p = start("True").by(Tactics.TRIVIAL).proof();
        var e = assertThrows(ProgramException.TacticFailure.class, () -> p.by(Tactics.IDTAC));
        assertEquals("No such goal.", e.getMessage());
    }

    @Test
    void unsafeStepsAreTracked() {
        var applied = start("P").by(Tactics.ADMIT);
        assertFalse(applied.safe());
        assertFalse(applied.proof().safe());
        assertFalse(applied.proof().returnProof().safe());
    }

    @Test
    void incompleteProofsCannotBeReturned() {
        var p = start("(and A B)").by(Tactics.SPLIT).proof();
        var e = assertThrows(ProgramException.IncompleteProof.class, p::returnProof);
        assertTrue(e.getMessage().contains("2 goals"));
        var partial = p.returnPartialProof();
        assertTrue(partial.entries().get(0).body().containsVar());
    }

    @Test
    void endlineTacticRunsAfterTheStep() {
        var p = start("(-> A A)").setEndlineTactic(Tactics.ASSUMPTION);
        assertTrue(p.endline().isPresent());
        var done = p.byEndline(Tactics.INTRO).proof();
        assertEquals(0, done.openGoals());
        assertEquals(Term.of("(fun H A H)"), done.returnProof().entries().get(0).body());
    }

    @Test
    void dependentProofsHaveOneGoalPerStatement() {
        var p = Proof.startDependent(List.of("a", "b"), Proof.Info.theorem(), kernel.env(), Universes.EMPTY,
                List.of(Term.of("True"), Term.of("(= x x)")));
        var done = p.by(Tactics.TRIVIAL).proof().by(Tactics.TRIVIAL).proof();
        var out = done.returnProof();
        assertEquals(List.of(Term.of("I"), Term.of("(eq_refl x)")), out.entries().stream().map(Proof.Output.Entry::body).toList());
        assertThrows(IllegalArgumentException.class, () -> Proof.startDependent(List.of("a"), Proof.Info.theorem(),
                kernel.env(), Universes.EMPTY, List.of(Term.of("(P ?hole)"))));
        assertThrows(IllegalArgumentException.class, () -> Proof.startDependent(List.of("a", "b"), Proof.Info.theorem(),
                kernel.env(), Universes.EMPTY, List.of(Term.of("P"))));
    }

    @Test
    void usedVariablesAreClosedOverTheirTypes() {
        kernel.openSection("S");
        kernel.addSectionVariable("A", Term.of("Type"));
        kernel.addSectionVariable("y", Term.of("nat"));
        kernel.addSectionVariable("x", Term.of("A"));
        var p = start("(P x)");
        var used = p.setUsedVariables(List.of("x"));
        assertEquals(List.of("A", "x"), used.closure().stream().map(Tactic.Hyp::name).toList());
        assertTrue(used.proof().usedVariables().isPresent());
        assertThrows(ProgramException.class, () -> used.proof().setUsedVariables(List.of("y")));
        assertThrows(ProgramException.class, () -> p.setUsedVariables(List.of("z")));
    }

    @Test
    void usedVariablesNeedAnOpenProof() {
        kernel.addSectionVariable("x", Term.of("A"));
        var done = start("True").by(Tactics.TRIVIAL).proof();
        assertEquals(0, done.openGoals());
        var e = assertThrows(ProgramException.class, () -> done.setUsedVariables(List.of("x")));
        assertTrue(e.getMessage().contains("already complete"));
        assertTrue(done.usedVariables().isEmpty());
    }

    @Test
    void closedProofIsConsumedOnce() {
        var po = start("True").by(Tactics.TRIVIAL).proof().close(true);
        assertTrue(po.isForced());
        assertEquals(Term.of("I"), po.consume().entries().get(0).body());
        assertThrows(IllegalStateException.class, po::consume);
    }

    @Test
    void futureProofIsForcedLazily() {
        var p = start("True").by(Tactics.TRIVIAL).proof();
        var runs = new AtomicInteger();
        var po = p.closeFuture("lem", true, Deferred.of("lem", () -> {
            runs.incrementAndGet();
            return p.returnProof();
        }));
        assertFalse(po.isForced());
        assertEquals(0, runs.get());
        po.consume();
        assertEquals(1, runs.get());
        assertThrows(IllegalArgumentException.class, () -> p.closeFuture("other", true, Deferred.of("lem", p::returnProof)));
    }

    @Test
    void environmentCanBeRefreshed() {
        var p = start("A");
        assertSame(p, p.updateGlobalEnv(kernel.env()));
        kernel.declare(Kernel.ConstantEntry.assumption("a", Term.of("A"), Kernel.Scope.GLOBAL, Universes.EMPTY));
        var q = p.updateGlobalEnv(kernel.env());
        assertNotSame(p, q);
        assertTrue(q.env().contains("a"));
        assertEquals(Term.of("a"), q.by(Tactics.exact("a")).proof().returnProof().entries().get(0).body());
    }
}
