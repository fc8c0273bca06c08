package dumb.obligato;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A proof step over a single goal. Implementations either return a {@link Step} or throw
 * {@link ProgramException.TacticFailure}; they never mutate the goal they are given.
 */
@FunctionalInterface
public interface Tactic {

    Step apply(Goal goal, Refiner r);

    default String name() {
        return "<tactic>";
    }

    static Tactic named(String name, Tactic t) {
        return new Tactic() {
            @Override
            public Step apply(Goal goal, Refiner r) {
                return t.apply(goal, r);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    record Hyp(String name, Term type) {
        public Hyp {
            requireNonNull(name);
            requireNonNull(type);
        }

        @Override
        public String toString() {
            return name + " : " + type.toKif();
        }
    }

    /** An open goal; {@code hole} stands for its proof inside the partial proof term. */
    record Goal(Term.Var hole, List<Hyp> context, Term conclusion) {
        public Goal {
            requireNonNull(hole);
            context = List.copyOf(context);
            requireNonNull(conclusion);
        }

        public Optional<Hyp> hyp(String name) {
            for (var i = context.size() - 1; i >= 0; i--)
                if (context.get(i).name().equals(name)) return Optional.of(context.get(i));
            return Optional.empty();
        }

        public List<Hyp> with(Hyp h) {
            var c = new ArrayList<>(context);
            c.add(h);
            return c;
        }

        @Override
        public String toString() {
            var sb = new StringBuilder();
            context.forEach(h -> sb.append("  ").append(h).append('\n'));
            return sb.append("  ============================\n  ").append(conclusion.toKif()).toString();
        }
    }

    /** Result of a tactic: a proof of the goal mentioning the holes of the new subgoals. */
    record Step(Term proof, List<Goal> subgoals, boolean safe) {
        public Step {
            requireNonNull(proof);
            subgoals = List.copyOf(subgoals);
        }

        public static Step solved(Term proof) {
            return new Step(proof, List.of(), true);
        }
    }

    /** Per-application context handed to tactics: the environment and fresh goal holes. */
    final class Refiner {
        public final Kernel.Environment env;
        private int next;

        Refiner(Kernel.Environment env, int next) {
            this.env = requireNonNull(env);
            this.next = next;
        }

        public Goal goal(List<Hyp> context, Term conclusion) {
            return new Goal(Term.Var.of("?goal_" + next++), context, conclusion);
        }

        int next() {
            return next;
        }

        public ProgramException.TacticFailure fail(String message) {
            return new ProgramException.TacticFailure(message);
        }
    }
}
