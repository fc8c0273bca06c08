package dumb.obligato;

import dumb.obligato.Tactic.Goal;
import dumb.obligato.Tactic.Hyp;
import dumb.obligato.Tactic.Refiner;
import dumb.obligato.Tactic.Step;
import dumb.obligato.Term.Atom;
import dumb.obligato.Term.Lst;

import java.util.*;

/**
 * The built-in tactic library. Propositions use {@code (-> A B)}, {@code (and A B)},
 * {@code (= a b)} and {@code True}; proofs are built from {@code fun}, {@code conj},
 * {@code eq_refl} and {@code I}.
 */
public enum Tactics {
    ;

    public static final String IMPL = "->", AND = "and", EQ = "=", TRUE = "True";
    private static final int MAX_REPEAT = 64;

    public static final Tactic IDTAC = Tactic.named("idtac", (g, r) -> new Step(g.hole(), List.of(g), true));

    public static final Tactic ASSUMPTION = Tactic.named("assumption", (g, r) -> {
        for (var i = g.context().size() - 1; i >= 0; i--) {
            var h = g.context().get(i);
            if (h.type().equals(g.conclusion())) return Step.solved(Atom.of(h.name()));
        }
        throw r.fail("No such assumption: " + g.conclusion().toKif());
    });

    public static final Tactic TRIVIAL = Tactic.named("trivial", (g, r) -> {
        var c = g.conclusion();
        if (c.equals(Atom.of(TRUE))) return Step.solved(Atom.of("I"));
        if (c instanceof Lst l && l.is(EQ, 3) && l.get(1).equals(l.get(2)))
            return Step.solved(new Lst(Atom.of("eq_refl"), l.get(1)));
        return ASSUMPTION.apply(g, r);
    });

    public static final Tactic SPLIT = Tactic.named("split", (g, r) -> {
        if (!(g.conclusion() instanceof Lst l && l.is(AND, 3)))
            throw r.fail("split: not a conjunction: " + g.conclusion().toKif());
        var left = r.goal(g.context(), l.get(1));
        var right = r.goal(g.context(), l.get(2));
        return new Step(new Lst(Atom.of("conj"), left.hole(), right.hole()), List.of(left, right), true);
    });

    public static final Tactic INTRO = intro(null);

    public static final Tactic INTROS = Tactic.named("intros", repeat(INTRO));

    /** Closes any goal without a proof; the result depends on an admitted assumption. */
    public static final Tactic ADMIT = Tactic.named("admit", (g, r) ->
            new Step(new Lst(Atom.of("admit"), g.conclusion()), List.of(), false));

    /** Simplification run on every obligation goal; never fails. */
    public static final Tactic PROGRAM_SIMPL = Tactic.named("program_simpl", repeat(first(TRIVIAL, SPLIT, INTRO)));

    public static final Tactic AUTO = Tactic.named("auto", solve(PROGRAM_SIMPL));

    private static final Map<String, Tactic> BY_NAME = Map.of(
            "idtac", IDTAC,
            "assumption", ASSUMPTION,
            "trivial", TRIVIAL,
            "split", SPLIT,
            "intro", INTRO,
            "intros", INTROS,
            "admit", ADMIT,
            "program_simpl", PROGRAM_SIMPL,
            "auto", AUTO);

    public static Optional<Tactic> named(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static Tactic fail(String message) {
        return Tactic.named("fail", (g, r) -> {
            throw r.fail(message);
        });
    }

    public static Tactic exact(Term proof) {
        return Tactic.named("exact " + proof.toKif(), (g, r) -> {
            if (proof.containsVar()) throw r.fail("exact: term has unresolved holes " + proof.vars());
            return Step.solved(proof);
        });
    }

    public static Tactic exact(String kif) {
        return exact(Term.of(kif));
    }

    /** Introduces the premise of an implication under the given name, or a fresh {@code H<n>}. */
    public static Tactic intro(String name) {
        return Tactic.named(name == null ? "intro" : "intro " + name, (g, r) -> {
            if (!(g.conclusion() instanceof Lst l && l.is(IMPL, 3)))
                throw r.fail("intro: no product to introduce in " + g.conclusion().toKif());
            var h = name != null ? name : fresh(g);
            if (g.hyp(h).isPresent()) throw r.fail("intro: " + h + " is already used");
            var sub = r.goal(g.with(new Hyp(h, l.get(1))), l.get(2));
            return new Step(new Lst(Atom.of("fun"), Atom.of(h), l.get(1), sub.hole()), List.of(sub), true);
        });
    }

    private static String fresh(Goal g) {
        for (var i = 0; ; i++) {
            var n = i == 0 ? "H" : "H" + i;
            if (g.hyp(n).isEmpty() && !Term.atoms(g.conclusion()).contains(Atom.of(n))) return n;
        }
    }

    /** Applies {@code second} to every subgoal produced by {@code first}. */
    public static Tactic then(Tactic first, Tactic second) {
        return Tactic.named(first.name() + "; " + second.name(), (g, r) -> {
            var s = first.apply(g, r);
            return onSubgoals(s, second, r);
        });
    }

    private static Step onSubgoals(Step s, Tactic t, Refiner r) {
        var bind = new HashMap<Term.Var, Term>();
        var goals = new ArrayList<Goal>();
        var safe = s.safe();
        for (var sub : s.subgoals()) {
            var st = t.apply(sub, r);
            bind.put(sub.hole(), st.proof());
            goals.addAll(st.subgoals());
            safe &= st.safe();
        }
        return new Step(Term.subst(s.proof(), bind), goals, safe);
    }

    public static Tactic first(Tactic... alternatives) {
        var names = Arrays.stream(alternatives).map(Tactic::name).toList();
        return Tactic.named("first [" + String.join(" | ", names) + "]", (g, r) -> {
            ProgramException.TacticFailure last = null;
            for (var t : alternatives) {
                try {
                    return t.apply(g, r);
                } catch (ProgramException.TacticFailure e) {
                    last = e;
                }
            }
            throw last != null ? last : r.fail("first: no alternatives");
        });
    }

    public static Tactic tryTactic(Tactic t) {
        return Tactic.named("try " + t.name(), first(t, IDTAC));
    }

    /** Applies {@code t} until it fails, then recursively on what it produced. */
    public static Tactic repeat(Tactic t) {
        return Tactic.named("repeat " + t.name(), (g, r) -> repeat(t, g, r, 0));
    }

    private static Step repeat(Tactic t, Goal g, Refiner r, int depth) {
        if (depth >= MAX_REPEAT) return IDTAC.apply(g, r);
        Step s;
        try {
            s = t.apply(g, r);
        } catch (ProgramException.TacticFailure e) {
            return IDTAC.apply(g, r);
        }
        if (s.subgoals().size() == 1 && s.subgoals().get(0).equals(g)) return s;
        return onSubgoals(s, (sub, rr) -> repeat(t, sub, rr, depth + 1), r);
    }

    /** Fails unless {@code t} closes the goal completely. */
    public static Tactic solve(Tactic t) {
        return Tactic.named("solve [" + t.name() + "]", (g, r) -> {
            var s = t.apply(g, r);
            if (!s.subgoals().isEmpty())
                throw r.fail(t.name() + " left " + s.subgoals().size() + " goal(s) open");
            return s;
        });
    }
}
