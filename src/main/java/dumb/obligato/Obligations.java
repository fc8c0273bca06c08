package dumb.obligato;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.obligato.Declare.CInfo;
import dumb.obligato.ProgramDecl.FixpointKind;
import dumb.obligato.util.Events;
import dumb.obligato.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import static dumb.obligato.util.Log.debug;
import static dumb.obligato.util.Log.message;
import static java.util.Objects.requireNonNull;

/** The program-mode commands: declaring programs and solving, showing or admitting their obligations. */
public class Obligations {

    final Kernel kernel;
    final Programs programs;
    final Events events;
    final Configuration config;
    final Declare declare;

    public Obligations(Kernel kernel, Programs programs, Events events, Configuration config, Declare declare) {
        this.kernel = requireNonNull(kernel);
        this.programs = requireNonNull(programs);
        this.events = requireNonNull(events);
        this.config = requireNonNull(config);
        this.declare = requireNonNull(declare);
    }

    /**
     * Registers a program and runs the automatic pass over its obligations.
     *
     * @param specs obligations in an order where dependencies come first
     */
    public Progress addDefinition(String name, Term type, Term body, Universes uctx, Options opts,
                                  List<Obligation.Spec> specs) {
        declare.checkFresh(name);
        var prg = ProgramDecl.make(name, opts.info, opts.notations, opts.reduce, opts.deps, uctx, type, body, null,
                List.of(), opts.tactic, specs);
        register(prg);
        if (prg.remaining() == 0) return declare.finishProgram(prg, kernel.env());
        return config.autoSolve() ? autoSolveObligations(name, null, null) : prg.progress();
    }

    /**
     * Registers a group of mutually recursive programs. The group is declared at once when
     * the last of its obligations is solved; until then members without obligations left
     * report {@link Progress.Dependent}.
     *
     * @return the progress of the first member
     */
    public Progress addMutualDefinitions(List<RecMember> members, Universes uctx, Options opts, FixpointKind kind) {
        if (members.isEmpty()) throw new IllegalArgumentException("Empty recursive group");
        if (kind instanceof FixpointKind.Fixpoint f && f.structArgs().size() != members.size())
            throw new IllegalArgumentException("Expected " + members.size() + " structural arguments, got " + f.structArgs().size());
        var names = members.stream().map(RecMember::name).toList();
        if (new HashSet<>(names).size() != names.size())
            throw new IllegalArgumentException("Duplicate name in recursive group " + names);
        names.forEach(declare::checkFresh);
        var info = opts.info.withKind(kind instanceof FixpointKind.CoFixpoint ? Kernel.Kind.COFIXPOINT : Kernel.Kind.FIXPOINT);
        var prgs = new ArrayList<ProgramDecl>();
        for (var m : members)
            prgs.add(ProgramDecl.make(m.name, info, opts.notations, opts.reduce, names, uctx, m.type, m.body, kind,
                    m.args, opts.tactic, m.obligations));
        prgs.forEach(this::register);
        if (config.autoSolve())
            for (var p : prgs)
                if (p.remaining() > 0 && programs.find(p.name).isPresent()) autoSolveObligations(p.name, null, null);
        var first = prgs.get(0);
        return first.defined().isPresent() ? first.progress() : declare.finishProgram(first, kernel.env());
    }

    private void register(ProgramDecl prg) {
        programs.add(prg);
        var n = prg.obligations().size();
        message(prg.name + " has type-checked, generating " + n + " obligation" + (n == 1 ? "" : "s"));
        events.emit(new Event.ProgramAddedEvent(prg.name, n, prg.remaining()));
    }

    /**
     * Tries the attemptable obligations in position order until a pass solves none. Only
     * obligations with a tactic of their own, or when {@code tactic} or the program
     * provides one, are attempted; failures leave the obligation open.
     */
    public Progress autoSolveObligations(@Nullable String name, @Nullable Set<Integer> only, @Nullable Tactic tactic) {
        var prg = name != null ? programs.get(name) : programs.uniqueOpen(null);
        return solvePass(prg, only, o -> o.tactic() != null ? o.tactic() : tactic != null ? tactic : prg.tactic, true);
    }

    private Progress solvePass(ProgramDecl prg, @Nullable Set<Integer> only, Function<Obligation, Tactic> strategy,
                               boolean auto) {
        var changed = true;
        while (changed && prg.defined().isEmpty() && prg.remaining() > 0) {
            changed = false;
            for (var i = 0; i < prg.obligations().size() && prg.defined().isEmpty(); i++) {
                if (only != null && !only.contains(i)) continue;
                if (!ObligationGraph.isAttemptable(prg.obligations(), i)) continue;
                var t = strategy.apply(prg.obligation(i));
                if (t == null) continue;
                if (solveByTactic(prg, i, t, auto).isPresent()) changed = true;
            }
        }
        return prg.progress();
    }

    /** Solves obligation {@code i} with {@code tactic}; empty when the tactic does not prove it. */
    private Optional<Progress> solveByTactic(ProgramDecl prg, int i, Tactic tactic, boolean auto) {
        var env = kernel.env();
        var obl = ObligationGraph.substDeps(prg.obligations(), i, env);
        Declare.Built built;
        try {
            built = declare.buildByTactic(env, prg.universes(), obl.type(), tactic);
        } catch (ProgramException.TacticFailure | ProgramException.IncompleteProof e) {
            debug(obl.name() + ": " + tactic.name() + " did not solve it: " + e.getMessage());
            return Optional.empty();
        }
        var d = declare.declareObligation(prg, obl, built.universes(), built.type(), built.body(), built.safe(), env);
        var obls = new ArrayList<>(prg.obligations());
        obls.set(i, d.obligation());
        var rem = prg.remaining() - 1;
        events.emit(new Event.ObligationSolvedEvent(prg.name, obl.name(), rem, auto));
        return Optional.of(declare.updateObls(prg, obls, rem, d.env()));
    }

    /**
     * Starts the proof of obligation {@code num} (1-based) of the named, or the only open,
     * program. The default tactic is tried first; {@code tactic}, when given, becomes the
     * endline tactic of the proof.
     */
    public Proof obligation(int num, @Nullable String name, @Nullable Tactic tactic) {
        var prg = programs.uniqueOpen(name);
        var i = index(prg, num);
        var env = kernel.env();
        var obl = ObligationGraph.substDeps(prg.obligations(), i, env);
        var info = new Proof.Info(new Proof.Ending.EndObligation(prg.name, i, this::autoSolveObligations), null,
                Kernel.Scope.GLOBAL, Kernel.Kind.OBLIGATION);
        var pf = Proof.start(obl.name(), info, env, prg.universes(), obl.type());
        var dflt = obl.tactic() != null ? obl.tactic() : prg.tactic != null ? prg.tactic : config.tactic();
        pf = pf.by(Tactics.tryTactic(dflt)).proof();
        return tactic != null ? pf.setEndlineTactic(tactic) : pf;
    }

    /** Starts the proof of the first attemptable obligation. */
    public Proof nextObligation(@Nullable String name, @Nullable Tactic tactic) {
        var prg = programs.uniqueOpen(name);
        var i = ObligationGraph.firstAttemptable(prg.obligations())
                .orElseThrow(() -> new ProgramException.UnknownObligation("No more obligations for " + prg.name));
        return obligation(i + 1, prg.name, tactic);
    }

    private int index(ProgramDecl prg, int num) {
        var i = num - 1;
        if (i < 0 || i >= prg.obligations().size())
            throw new ProgramException.UnknownObligation(prg.name + " has no obligation " + num);
        var obls = prg.obligations();
        if (obls.get(i).isSolved())
            throw new ProgramException.UnknownObligation("Obligation " + num + " of " + prg.name + " is already solved");
        var missing = ObligationGraph.unsolved(obls, ObligationGraph.dependencies(obls, i));
        if (!missing.isEmpty()) throw new ProgramException.DependenciesUnsolved(obls.get(i).name(), missing);
        return i;
    }

    private Tactic manual(ProgramDecl prg, Obligation obl, @Nullable Tactic tactic) {
        if (tactic != null) return tactic;
        if (obl.tactic() != null) return obl.tactic();
        return prg.tactic != null ? prg.tactic : config.tactic();
    }

    /**
     * Solves obligation {@code num} (1-based) non-interactively.
     *
     * @throws ProgramException.TacticFailure if the tactic fails or leaves goals open
     */
    public Progress solveObligation(int num, @Nullable String name, @Nullable Tactic tactic) {
        var prg = programs.uniqueOpen(name);
        var i = index(prg, num);
        var t = manual(prg, prg.obligation(i), tactic);
        var p = solveByTactic(prg, i, t, false)
                .orElseThrow(() -> new ProgramException.TacticFailure(t.name() + " did not solve obligation " + num + " of " + prg.name));
        return p instanceof Progress.Remain && config.autoSolve() ? autoSolveObligations(prg.name, null, null) : p;
    }

    /** Like {@link #solveObligation} but reports the unchanged progress when the tactic does not prove it. */
    public Progress trySolveObligation(int num, @Nullable String name, @Nullable Tactic tactic) {
        var prg = programs.uniqueOpen(name);
        var i = index(prg, num);
        var p = solveByTactic(prg, i, manual(prg, prg.obligation(i), tactic), false);
        return p.isPresent() ? p.get() : prg.progress();
    }

    /** Tries every open obligation of the program, in position order, until no more can be solved. */
    public Progress solveObligations(@Nullable String name, @Nullable Tactic tactic) {
        var prg = programs.uniqueOpen(name);
        return solvePass(prg, null, o -> manual(prg, o, tactic), false);
    }

    /** {@link #solveObligations} when a program is open; empty otherwise. */
    public Optional<Progress> trySolveObligations(@Nullable String name, @Nullable Tactic tactic) {
        if (name == null ? programs.numPending() != 1 : programs.find(name).isEmpty()) return Optional.empty();
        return Optional.of(solveObligations(name, tactic));
    }

    public Map<String, Progress> solveAllObligations(@Nullable Tactic tactic) {
        var out = new LinkedHashMap<String, Progress>();
        for (var n : programs.names()) {
            var prg = programs.find(n).orElse(null);
            if (prg == null) continue;
            out.put(n, prg.remaining() > 0 ? solveObligations(n, tactic) : prg.progress());
        }
        return out;
    }

    /** Unsolved obligations of the named program, or of every program. */
    public String showObligations(@Nullable String name) {
        var prgs = name != null ? List.of(programs.get(name)) : programs.all();
        var env = kernel.env();
        var sb = new StringBuilder();
        for (var prg : prgs) {
            var rem = prg.remaining();
            sb.append(rem == 0 ? "No more obligations remaining for " + prg.name
                    : rem + " obligation" + (rem == 1 ? "" : "s") + " remaining for " + prg.name).append('\n');
            for (var i = 0; i < prg.obligations().size(); i++) {
                if (prg.obligation(i).isSolved() || !ObligationGraph.isAttemptable(prg.obligations(), i)) continue;
                var o = ObligationGraph.substDeps(prg.obligations(), i, env);
                sb.append("Obligation ").append(i + 1).append(" of ").append(prg.name).append(":\n  ")
                        .append(o.type().toKif()).append('\n');
            }
        }
        var s = sb.toString();
        message(s.strip());
        return s;
    }

    public String showTerm(@Nullable String name) {
        var prg = name != null ? programs.get(name) : programs.uniqueOpen(null);
        return prg.show(config.hideObligations(), kernel.env());
    }

    /** The open programs and their obligations. */
    public JsonNode status() {
        var arr = Json.array();
        programs.all().forEach(p -> arr.add(p.toJson()));
        return arr;
    }

    /** Closes every open obligation of the program with an assumption. */
    public Progress admitObligations(@Nullable String name) {
        var prg = programs.uniqueOpen(name);
        var all = new TreeSet<Integer>();
        for (var i = 0; i < prg.obligations().size(); i++) all.add(i);
        return declare.admitObligations(prg, all);
    }

    public void checkProgramLibraries() {
        var loaded = kernel.env().libraries();
        var missing = config.requiredLibraries().stream().filter(l -> !loaded.contains(l)).toList();
        if (!missing.isEmpty()) throw new ProgramException.MissingLibraries(missing);
    }

    /** Drops a program, together with the rest of its recursive group, without declaring it. */
    public List<String> abandon(@Nullable String name) {
        var prg = programs.uniqueOpen(name);
        var names = prg.isFixpoint() ? prg.deps : List.of(prg.name);
        var out = new ArrayList<String>();
        for (var n : names)
            programs.remove(n).ifPresent(p -> {
                out.add(p.name);
                events.emit(new Event.ProgramRemovedEvent(p.name, "abandoned"));
            });
        message("Abandoned " + String.join(", ", out));
        return out;
    }

    /** One member of a recursive group. */
    public record RecMember(String name, Term type, List<String> args, Term body, List<Obligation.Spec> obligations) {
        public RecMember {
            requireNonNull(name);
            requireNonNull(type);
            args = List.copyOf(args);
            requireNonNull(body);
            obligations = List.copyOf(obligations);
        }
    }

    /**
     * @param tactic program-wide tactic for obligations without one of their own
     * @param reduce applied to obligation solutions and to the final term
     * @param deps   programs that must be defined before this one
     */
    public record Options(CInfo info, @Nullable Tactic tactic, UnaryOperator<Term> reduce,
                          List<Kernel.Notation> notations, List<String> deps) {
        public Options {
            requireNonNull(info);
            requireNonNull(reduce);
            notations = List.copyOf(notations);
            deps = List.copyOf(deps);
        }

        public static Options defaults() {
            return new Options(CInfo.definition(), null, UnaryOperator.identity(), List.of(), List.of());
        }

        public Options withInfo(CInfo info) {
            return new Options(info, tactic, reduce, notations, deps);
        }

        public Options withHook(@Nullable Hook hook) {
            return withInfo(info.withHook(hook));
        }

        public Options withTactic(@Nullable Tactic tactic) {
            return new Options(info, tactic, reduce, notations, deps);
        }

        public Options withReduce(UnaryOperator<Term> reduce) {
            return new Options(info, tactic, reduce, notations, deps);
        }

        public Options withNotations(List<Kernel.Notation> notations) {
            return new Options(info, tactic, reduce, notations, deps);
        }

        public Options withDeps(List<String> deps) {
            return new Options(info, tactic, reduce, notations, deps);
        }
    }
}
