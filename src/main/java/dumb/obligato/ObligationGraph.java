package dumb.obligato;

import java.util.*;

/**
 * Dependency queries over the obligations of one program. Positions are fixed when the
 * program is created, so index sets stay valid while obligations get solved.
 */
public enum ObligationGraph {
    ;

    /** Transitive closure of the dependencies of obligation {@code i}. */
    public static SortedSet<Integer> dependencies(List<Obligation> obls, int i) {
        var out = new TreeSet<Integer>();
        var todo = new ArrayDeque<>(obls.get(i).deps());
        while (!todo.isEmpty()) {
            var d = todo.poll();
            if (out.add(d)) todo.addAll(obls.get(d).deps());
        }
        return out;
    }

    /** Obligations whose dependencies include {@code i}, directly or transitively. */
    public static SortedSet<Integer> dependents(List<Obligation> obls, int i) {
        var out = new TreeSet<Integer>();
        var todo = new ArrayDeque<Integer>();
        todo.add(i);
        while (!todo.isEmpty()) {
            var n = todo.poll();
            for (var j = 0; j < obls.size(); j++)
                if (obls.get(j).deps().contains(n) && out.add(j)) todo.add(j);
        }
        return out;
    }

    /** Unsolved, and every dependency already has a body. */
    public static boolean isAttemptable(List<Obligation> obls, int i) {
        var o = obls.get(i);
        return !o.isSolved() && o.deps().stream().allMatch(d -> obls.get(d).isSolved());
    }

    public static List<Integer> attemptable(List<Obligation> obls) {
        var out = new ArrayList<Integer>();
        for (var i = 0; i < obls.size(); i++) if (isAttemptable(obls, i)) out.add(i);
        return out;
    }

    public static OptionalInt firstAttemptable(List<Obligation> obls) {
        for (var i = 0; i < obls.size(); i++) if (isAttemptable(obls, i)) return OptionalInt.of(i);
        return OptionalInt.empty();
    }

    public static int remaining(List<Obligation> obls) {
        return (int) obls.stream().filter(o -> !o.isSolved()).count();
    }

    public static List<String> unsolved(List<Obligation> obls, Collection<Integer> indices) {
        return indices.stream().map(obls::get).filter(o -> !o.isSolved()).map(Obligation::name).toList();
    }

    /**
     * The term and type replacing each of {@code indices}. With {@code expand}, solutions
     * held by transparent constants are unfolded to their bodies; otherwise they are
     * referenced by name.
     *
     * @throws IllegalStateException if one of the obligations has no body yet
     */
    public static List<Substitution> substitution(boolean expand, List<Obligation> obls, Collection<Integer> indices,
                                                  Kernel.Environment env) {
        var out = new ArrayList<Substitution>(indices.size());
        for (var i : new TreeSet<>(indices)) {
            var o = obls.get(i);
            var body = o.body();
            if (body == null) throw new IllegalStateException("Obligation " + o.name() + " has no body yet");
            Term term;
            if (body instanceof Obligation.Body.Inline in) term = in.term();
            else {
                var c = ((Obligation.Body.Defined) body).constant();
                term = expand && o.status().transparent()
                        ? env.unfold(c).orElse(Term.Atom.of(c))
                        : Term.Atom.of(c);
            }
            out.add(new Substitution(o.name(), o.hole(), term, o.type()));
        }
        return out;
    }

    public static Map<Term.Var, Term> bindings(List<Substitution> subst) {
        var m = new HashMap<Term.Var, Term>();
        subst.forEach(s -> m.put(s.hole(), s.term()));
        return m;
    }

    /** Obligation {@code i} with the solutions of its dependencies substituted into its type. */
    public static Obligation substDeps(List<Obligation> obls, int i, Kernel.Environment env) {
        var obl = obls.get(i);
        var deps = dependencies(obls, i);
        if (deps.isEmpty()) return obl;
        var t = Term.subst(obl.type(), bindings(substitution(false, obls, deps, env)));
        return t == obl.type() ? obl : obl.withType(t);
    }

    public record Substitution(String name, Term.Var hole, Term term, Term type) {
    }
}
