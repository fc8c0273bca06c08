package dumb.obligato;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.obligato.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * A declaration whose term still has holes. It stays in the {@link Programs} registry,
 * mutated as its obligations are solved, until its final term has been registered.
 */
public class ProgramDecl {
    public final String name;
    public final Declare.CInfo info;
    public final List<Kernel.Notation> notations;
    public final List<String> deps;
    public final Term type;
    public final Term body;
    public final @Nullable FixpointKind fixpoint;
    public final List<String> args;
    final UnaryOperator<Term> reduce;
    final @Nullable Tactic tactic;
    private Universes universes;
    private List<Obligation> obligations;
    private int remaining;
    private boolean admitted;
    private @Nullable Kernel.GlobalRef defined;

    private ProgramDecl(String name, Declare.CInfo info, List<Kernel.Notation> notations, List<String> deps, Term type,
                        Term body, @Nullable FixpointKind fixpoint, List<String> args, UnaryOperator<Term> reduce,
                        @Nullable Tactic tactic, Universes universes, List<Obligation> obligations) {
        this.name = name;
        this.info = info;
        this.notations = notations;
        this.deps = deps;
        this.type = type;
        this.body = body;
        this.fixpoint = fixpoint;
        this.args = args;
        this.reduce = reduce;
        this.tactic = tactic;
        this.universes = universes;
        this.obligations = obligations;
        this.remaining = ObligationGraph.remaining(obligations);
    }

    /**
     * Names the obligations {@code <name>_obligation_<k>} and renames the holes given in
     * the specs accordingly, in the body, the type and the obligation types.
     *
     * @throws IllegalArgumentException if the dependencies are out of range or cyclic, or
     *                                  if a term mentions a hole that is not an obligation
     */
    public static ProgramDecl make(String name, Declare.CInfo info, List<Kernel.Notation> notations,
                                   UnaryOperator<Term> reduce, List<String> deps, Universes universes, Term type,
                                   Term body, @Nullable FixpointKind fixpoint, List<String> args,
                                   @Nullable Tactic tactic, List<Obligation.Spec> specs) {
        requireNonNull(name);
        var n = specs.size();
        var rename = new HashMap<Term.Var, Term>();
        for (var i = 0; i < n; i++) {
            var h = specs.get(i).hole();
            if (h != null && rename.put(h, Obligation.hole(Obligation.name(name, i))) != null)
                throw new IllegalArgumentException("Hole " + h + " is bound to more than one obligation");
        }
        var obls = new ArrayList<Obligation>(n);
        for (var i = 0; i < n; i++) {
            var s = specs.get(i);
            for (var d : s.deps())
                if (d < 0 || d >= n || d == i)
                    throw new IllegalArgumentException("Obligation " + (i + 1) + " of " + name + " has invalid dependency " + d);
            obls.add(new Obligation(Obligation.name(name, i), Term.subst(s.type(), rename), s.location(), s.deps(),
                    s.status(), s.tactic(), null));
        }
        checkAcyclic(name, obls);
        var t = Term.subst(type, rename);
        var b = Term.subst(body, rename);
        var holes = new HashSet<Term.Var>();
        obls.forEach(o -> holes.add(o.hole()));
        checkHoles(name, t, holes);
        checkHoles(name, b, holes);
        for (var i = 0; i < n; i++) {
            var allowed = new HashSet<Term.Var>();
            ObligationGraph.dependencies(obls, i).forEach(d -> allowed.add(obls.get(d).hole()));
            checkHoles(obls.get(i).name(), obls.get(i).type(), allowed);
        }
        return new ProgramDecl(name, requireNonNull(info), List.copyOf(notations), List.copyOf(deps), t, b, fixpoint,
                List.copyOf(args), requireNonNull(reduce), tactic,
                universes.withLevels(Universes.levelsOf(t, b)), List.copyOf(obls));
    }

    private static void checkHoles(String where, Term t, Set<Term.Var> allowed) {
        for (var v : t.vars())
            if (!allowed.contains(v))
                throw new IllegalArgumentException("Unknown placeholder " + v + " in " + where);
    }

    private static void checkAcyclic(String name, List<Obligation> obls) {
        var state = new int[obls.size()];
        for (var i = 0; i < obls.size(); i++) visit(name, obls, i, state);
    }

    private static void visit(String name, List<Obligation> obls, int i, int[] state) {
        if (state[i] == 2) return;
        if (state[i] == 1) throw new IllegalArgumentException("Cyclic obligation dependencies in " + name + " at " + (i + 1));
        state[i] = 1;
        for (var d : obls.get(i).deps()) visit(name, obls, d, state);
        state[i] = 2;
    }

    public List<Obligation> obligations() {
        return obligations;
    }

    public Obligation obligation(int i) {
        return obligations.get(i);
    }

    public int remaining() {
        return remaining;
    }

    public Universes universes() {
        return universes;
    }

    /** Some obligation was admitted or solved with an unsafe step. */
    public boolean admitted() {
        return admitted;
    }

    public Optional<Kernel.GlobalRef> defined() {
        return Optional.ofNullable(defined);
    }

    public boolean isFixpoint() {
        return fixpoint != null;
    }

    public Progress progress() {
        if (defined != null) return new Progress.Defined(defined);
        return remaining == 0 ? Progress.DEPENDENT : new Progress.Remain(remaining);
    }

    void setUniverses(Universes universes) {
        this.universes = requireNonNull(universes);
    }

    void markAdmitted() {
        admitted = true;
    }

    void markDefined(Kernel.GlobalRef ref) {
        if (defined != null) throw new IllegalStateException("Program " + name + " was already defined as " + defined);
        defined = requireNonNull(ref);
    }

    /** Replaces the obligations; bodies may only appear, never change or disappear. */
    void update(List<Obligation> obls, int rem) {
        if (defined != null) throw new IllegalStateException("Program " + name + " is already defined");
        if (obls.size() != obligations.size())
            throw new IllegalStateException("Obligation count of " + name + " changed from " + obligations.size() + " to " + obls.size());
        for (var i = 0; i < obls.size(); i++) {
            var before = obligations.get(i).body();
            if (before != null && !before.equals(obls.get(i).body()))
                throw new IllegalStateException("Body of " + obligations.get(i).name() + " changed after being solved");
        }
        var actual = ObligationGraph.remaining(obls);
        if (actual != rem)
            throw new IllegalStateException("Program " + name + ": " + rem + " obligations reported remaining, " + actual + " unsolved");
        obligations = List.copyOf(obls);
        remaining = rem;
    }

    /** The program term with solved obligations filled in; open ones stay holes, or {@code _} when hidden. */
    public String show(boolean hideObligations, Kernel.Environment env) {
        var bind = new HashMap<Term.Var, Term>();
        var solved = new ArrayList<Integer>();
        for (var i = 0; i < obligations.size(); i++) {
            var o = obligations.get(i);
            if (o.isSolved()) solved.add(i);
            else if (hideObligations) bind.put(o.hole(), Term.Atom.of("_"));
        }
        bind.putAll(ObligationGraph.bindings(ObligationGraph.substitution(false, obligations, solved, env)));
        return name + " : " + Term.subst(type, bind).toKif() + " :=\n  " + Term.subst(body, bind).toKif();
    }

    public JsonNode toJson() {
        var n = Json.node()
                .put("name", name)
                .put("remaining", remaining)
                .put("admitted", admitted);
        var arr = n.putArray("obligations");
        for (var o : obligations) {
            var on = arr.addObject()
                    .put("name", o.name())
                    .put("type", o.type().toKif())
                    .put("location", o.location())
                    .put("opacity", o.status().opacity().name())
                    .put("mode", o.status().mode().name())
                    .put("solved", o.isSolved());
            var ds = on.putArray("deps");
            o.deps().forEach(d -> ds.add(d + 1));
        }
        if (!deps.isEmpty()) {
            var ds = n.putArray("dependsOn");
            deps.forEach(ds::add);
        }
        return n;
    }

    @Override
    public String toString() {
        return "ProgramDecl[" + name + ", " + progress() + ']';
    }

    public sealed interface FixpointKind permits FixpointKind.Fixpoint, FixpointKind.CoFixpoint {

        /** Structurally recursive group; {@code structArgs} names the decreasing argument per member, null to guess. */
        record Fixpoint(List<String> structArgs) implements FixpointKind {
            public Fixpoint {
                structArgs = Collections.unmodifiableList(new ArrayList<>(structArgs));
            }
        }

        record CoFixpoint() implements FixpointKind {
        }
    }
}
