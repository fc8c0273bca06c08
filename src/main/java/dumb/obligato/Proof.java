package dumb.obligato;

import dumb.obligato.Kernel.GlobalRef;
import dumb.obligato.Tactic.Goal;
import dumb.obligato.Tactic.Hyp;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.obligato.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * An interactive proof in progress. Instances are immutable: a successful tactic yields
 * a new state, a failing one leaves the receiver as it was.
 */
public final class Proof {
    private final List<String> names;
    private final List<Term> statements;
    private final List<Term> roots;
    private final List<Goal> goals;
    private final Universes universes;
    private final Info info;
    private final Kernel.Environment env;
    private final @Nullable Tactic endline;
    private final @Nullable List<Hyp> usedVariables;
    private final boolean safe;
    private final int nextHole;

    private Proof(List<String> names, List<Term> statements, List<Term> roots, List<Goal> goals, Universes universes,
                  Info info, Kernel.Environment env, @Nullable Tactic endline, @Nullable List<Hyp> usedVariables,
                  boolean safe, int nextHole) {
        this.names = names;
        this.statements = statements;
        this.roots = roots;
        this.goals = goals;
        this.universes = universes;
        this.info = info;
        this.env = env;
        this.endline = endline;
        this.usedVariables = usedVariables;
        this.safe = safe;
        this.nextHole = nextHole;
    }

    public static Proof start(String name, Info info, Kernel.Environment env, Universes universes, Term statement) {
        return startDependent(List.of(name), info, env, universes, List.of(statement));
    }

    /** One goal per statement, proved together and declared under the matching name. */
    public static Proof startDependent(List<String> names, Info info, Kernel.Environment env, Universes universes, List<Term> statements) {
        if (names.isEmpty() || names.size() != statements.size())
            throw new IllegalArgumentException("Expected one name per statement: " + names + " / " + statements.size());
        var r = new Tactic.Refiner(env, 0);
        var goals = new ArrayList<Goal>();
        for (var s : statements) {
            if (s.containsVar()) throw new IllegalArgumentException("Statement has unresolved holes: " + s.toKif());
            goals.add(r.goal(List.of(), s));
        }
        var roots = goals.stream().<Term>map(Goal::hole).toList();
        return new Proof(List.copyOf(names), List.copyOf(statements), roots, List.copyOf(goals),
                universes.withLevels(Universes.levelsOf(statements.toArray(Term[]::new))),
                requireNonNull(info), requireNonNull(env), null, null, true, r.next());
    }

    public String name() {
        return names.get(0);
    }

    public List<String> names() {
        return names;
    }

    public List<Term> statements() {
        return statements;
    }

    public List<Goal> goals() {
        return goals;
    }

    public int openGoals() {
        return goals.size();
    }

    public Optional<Goal> focusedGoal() {
        return goals.isEmpty() ? Optional.empty() : Optional.of(goals.get(0));
    }

    public Universes universes() {
        return universes;
    }

    public Info info() {
        return info;
    }

    public Kernel.Environment env() {
        return env;
    }

    public Optional<Tactic> endline() {
        return Optional.ofNullable(endline);
    }

    public Optional<List<Hyp>> usedVariables() {
        return Optional.ofNullable(usedVariables);
    }

    /** Whether every step so far was safe. */
    public boolean safe() {
        return safe;
    }

    /** Applies {@code tactic} to the first open goal. */
    public Applied by(Tactic tactic) {
        var goal = focusedGoal().orElseThrow(() -> new ProgramException.TacticFailure("No such goal."));
        var r = new Tactic.Refiner(env, nextHole);
        Tactic.Step step;
        try {
            step = tactic.apply(goal, r);
        } catch (ProgramException.TacticFailure e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProgramException.TacticFailure(tactic.name() + " failed: " + e.getMessage(), e);
        }
        var bind = Map.of(goal.hole(), step.proof());
        var newRoots = roots.stream().map(t -> Term.subst(t, bind)).toList();
        var newGoals = new ArrayList<>(step.subgoals());
        newGoals.addAll(goals.subList(1, goals.size()));
        var u = universes.withLevels(Universes.levelsOf(step.proof()));
        var next = new Proof(names, statements, newRoots, List.copyOf(newGoals), u, info, env, endline, usedVariables,
                safe && step.safe(), r.next());
        return new Applied(next, step.safe());
    }

    /** Applies {@code tactic} followed by the endline tactic, if one is set. */
    public Applied byEndline(Tactic tactic) {
        return by(endline == null ? tactic : Tactics.then(tactic, endline));
    }

    public Proof setEndlineTactic(Tactic tactic) {
        return new Proof(names, statements, roots, goals, universes, info, env, requireNonNull(tactic), usedVariables, safe, nextHole);
    }

    /** Continues with an environment that reflects registrations made since the proof started. */
    public Proof updateGlobalEnv(Kernel.Environment env) {
        return env == this.env ? this
                : new Proof(names, statements, roots, goals, universes, info, env, endline, usedVariables, safe, nextHole);
    }

    /**
     * Declares the section variables the proof may use. The result is closed under the
     * variables mentioned by their types, in section order.
     */
    public UsedVariables setUsedVariables(List<String> vars) {
        if (goals.isEmpty()) throw new ProgramException("Proof of " + names.get(0) + " is already complete");
        if (usedVariables != null) throw new ProgramException("Used section variables can be declared only once");
        var section = env.sectionVariables();
        var todo = new ArrayDeque<>(vars);
        var closure = new HashSet<String>();
        while (!todo.isEmpty()) {
            var v = todo.poll();
            var type = section.get(v);
            if (type == null) throw new ProgramException("Unknown section variable " + v);
            if (closure.add(v))
                Term.atoms(type).stream().map(Term.Atom::value).filter(section::containsKey).forEach(todo::add);
        }
        var hyps = new ArrayList<Hyp>();
        section.forEach((n, t) -> {
            if (closure.contains(n)) hyps.add(new Hyp(n, t));
        });
        var p = new Proof(names, statements, roots, goals, universes, info, env, endline, List.copyOf(hyps), safe, nextHole);
        return new UsedVariables(List.copyOf(hyps), p);
    }

    public Output returnProof() {
        if (!goals.isEmpty()) throw new ProgramException.IncompleteProof(name(), goals.size());
        return output();
    }

    /** Like {@link #returnProof()} but tolerates open goals; their holes stay in the terms. */
    public Output returnPartialProof() {
        if (goals.isEmpty()) warning("The proof of " + name() + " is complete, consider closing it normally");
        return output();
    }

    private Output output() {
        var entries = new ArrayList<Output.Entry>(roots.size());
        for (var i = 0; i < roots.size(); i++) entries.add(new Output.Entry(roots.get(i), statements.get(i)));
        return new Output(entries, universes, safe);
    }

    public ProofObject close(boolean opaque) {
        var out = returnProof();
        return new ProofObject(names, statements, universes, opaque, Deferred.done(name(), out));
    }

    /**
     * Closes the proof with its term produced by {@code output}, forced later and at most
     * once. {@code feedbackId} identifies the computation for whoever forces it.
     */
    public ProofObject closeFuture(String feedbackId, boolean opaque, Deferred<Output> output) {
        if (!output.key.equals(feedbackId))
            throw new IllegalArgumentException("Deferred proof " + output.key + " does not belong to " + feedbackId);
        return new ProofObject(names, statements, universes, opaque, output);
    }

    @Override
    public String toString() {
        if (goals.isEmpty()) return name() + ": no more goals.";
        var sb = new StringBuilder(name()).append(": ").append(goals.size()).append(" goal").append(goals.size() == 1 ? "" : "s");
        for (var i = 0; i < goals.size(); i++)
            sb.append("\n goal ").append(i + 1).append(":\n").append(goals.get(i));
        return sb.toString();
    }

    public record Applied(Proof proof, boolean safe) {
    }

    public record UsedVariables(List<Hyp> closure, Proof proof) {
    }

    /** The proof terms, one per statement, with the universes they need. */
    public record Output(List<Entry> entries, Universes universes, boolean safe) {
        public Output {
            entries = List.copyOf(entries);
            requireNonNull(universes);
        }

        public record Entry(Term body, Term type) {
        }
    }

    public record Info(Ending ending, @Nullable Hook hook, Kernel.Scope scope, Kernel.Kind kind) {
        public Info {
            requireNonNull(ending);
            requireNonNull(scope);
            requireNonNull(kind);
        }

        public static Info theorem() {
            return new Info(Ending.REGULAR, null, Kernel.Scope.GLOBAL, Kernel.Kind.THEOREM);
        }

        public Info withHook(@Nullable Hook hook) {
            return new Info(ending, hook, scope, kind);
        }
    }

    /** What happens when the proof is saved. */
    public sealed interface Ending permits Ending.Regular, Ending.EndObligation, Ending.EndDerive, Ending.EndEquations {

        Regular REGULAR = new Regular();

        record Regular() implements Ending {
        }

        /** The proof solves obligation {@code num} (0-based) of {@code program}. */
        record EndObligation(String program, int num, ObligationResolver auto) implements Ending {
            public EndObligation {
                requireNonNull(program);
                requireNonNull(auto);
            }
        }

        record EndDerive(String f, String name, Finisher finisher) implements Ending {
        }

        record EndEquations(String name, Finisher finisher) implements Ending {
        }
    }

    /** Tries to solve the given obligations (all when {@code null}) of a program. */
    @FunctionalInterface
    public interface ObligationResolver {
        Progress resolve(@Nullable String program, @Nullable Set<Integer> obligations, @Nullable Tactic tactic);
    }

    /** Declares whatever a specialised proof ending produces; called once with minimized universes. */
    @FunctionalInterface
    public interface Finisher {
        List<GlobalRef> finish(Output output, Universes universes, Kernel kernel);
    }
}
