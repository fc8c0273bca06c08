package dumb.obligato;

import dumb.obligato.Kernel.ConstantEntry;
import dumb.obligato.Kernel.Environment;
import dumb.obligato.Kernel.GlobalRef;
import dumb.obligato.Obligation.Body;
import dumb.obligato.Obligation.Mode;
import dumb.obligato.Obligation.Opacity;
import dumb.obligato.ProgramDecl.FixpointKind;
import dumb.obligato.Proof.Ending;
import dumb.obligato.util.Events;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.obligato.util.Log.error;
import static dumb.obligato.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Turns finished proofs and fully solved programs into kernel declarations. Each step
 * takes the environment it may assume and continues with the one the kernel hands back.
 */
public class Declare {

    final Kernel kernel;
    final Programs programs;
    final Events events;
    final Configuration config;

    public Declare(Kernel kernel, Programs programs, Events events, Configuration config) {
        this.kernel = requireNonNull(kernel);
        this.programs = requireNonNull(programs);
        this.events = requireNonNull(events);
        this.config = requireNonNull(config);
    }

    /** Universes a declaration is registered with: only the levels its terms use, minimized once. */
    static Universes finalUniverses(Universes uctx, Term... terms) {
        var used = Universes.levelsOf(terms);
        return uctx.withLevels(used).minimize(used).restrict(used);
    }

    /** Fails if {@code name} is taken in the environment or by an open program. */
    void checkFresh(String name) {
        if (kernel.env().contains(name) || programs.find(name).isPresent())
            throw new ProgramException.AlreadyDeclared(name);
    }

    public GlobalRef declareDefinition(String name, CInfo info, Term type, Term body, Universes uctx) {
        checkFresh(name);
        var u = finalUniverses(uctx, type, body);
        var d = kernel.declare(ConstantEntry.definition(name, type, body, info.opaque, info.kind, info.scope, u));
        message(name + " is defined");
        callHook(null, info.hook, new Hook.Info(u, List.of(), info.scope, d.ref()));
        return d.ref();
    }

    public GlobalRef declareAssumption(String name, CInfo info, Term type, Universes uctx) {
        checkFresh(name);
        var u = finalUniverses(uctx, type);
        var d = kernel.declare(ConstantEntry.assumption(name, type, info.scope, u));
        message(name + " is assumed");
        callHook(null, info.hook, new Hook.Info(u, List.of(), info.scope, d.ref()));
        return d.ref();
    }

    /** Registers a program whose obligations are all solved and removes it from the registry. */
    Progress declareDefinition(ProgramDecl prg, Environment env) {
        var all = allIndices(prg);
        var subst = ObligationGraph.substitution(true, prg.obligations(), all, env);
        var bind = ObligationGraph.bindings(subst);
        var body = prg.reduce.apply(Term.subst(prg.body, bind));
        var type = prg.reduce.apply(Term.subst(prg.type, bind));
        var u = finalUniverses(prg.universes(), type, body);
        var entry = ConstantEntry.definition(prg.name, type, body, prg.info.opaque, prg.info.kind, prg.info.scope, u)
                .unsafe(prg.admitted())
                .notations(prg.notations);
        kernel.checkCurrent(env);
        var d = kernel.declare(entry);
        var ref = d.ref();
        defined(prg, ref, d.env());
        callHook(prg.name, prg.info.hook, new Hook.Info(u, obligationTerms(subst), prg.info.scope, ref));
        return new Progress.Defined(ref);
    }

    /**
     * Registers the members of a (co)fixpoint group together. Each member becomes a
     * constant selecting its position out of the shared recursive block.
     */
    Progress declareMutualDefinition(List<ProgramDecl> members, Environment env) {
        var first = members.get(0);
        var kind = requireNonNull(first.fixpoint, () -> first.name + " is not a fixpoint");
        var names = new ArrayList<Term>();
        var blocks = new ArrayList<Term>();
        var types = new ArrayList<Term>();
        var uctx = Universes.EMPTY;
        var obligationTerms = new ArrayList<Hook.ObligationTerm>();
        for (var p : members) {
            var subst = ObligationGraph.substitution(true, p.obligations(), allIndices(p), env);
            var bind = ObligationGraph.bindings(subst);
            var type = p.reduce.apply(Term.subst(p.type, bind));
            var body = p.reduce.apply(Term.subst(p.body, bind));
            names.add(Term.Atom.of(p.name));
            types.add(type);
            blocks.add(new Term.Lst(Term.Atom.of(p.name), type, body));
            uctx = uctx.union(p.universes());
            obligationTerms.addAll(obligationTerms(subst));
        }
        var block = new Term.Lst(blocks);
        var bodies = new ArrayList<Term>();
        for (var i = 0; i < members.size(); i++) bodies.add(recursive(kind, i, block));
        var all = new ArrayList<>(types);
        all.addAll(bodies);
        var u = finalUniverses(uctx, all.toArray(Term[]::new));
        var entries = new ArrayList<ConstantEntry>();
        var admitted = members.stream().anyMatch(ProgramDecl::admitted);
        for (var i = 0; i < members.size(); i++) {
            var p = members.get(i);
            entries.add(ConstantEntry.definition(p.name, types.get(i), bodies.get(i), p.info.opaque, p.info.kind,
                            p.info.scope, u)
                    .unsafe(admitted)
                    .notations(p.notations));
        }
        kernel.checkCurrent(env);
        var d = kernel.declareMutual(entries);
        for (var i = 0; i < members.size(); i++) defined(members.get(i), d.refs().get(i), d.env());
        message(String.join(", ", names.stream().map(Term::toKif).toList())
                + (members.size() == 1 ? " is " : " are ") + "recursively defined");
        callHook(first.name, first.info.hook, new Hook.Info(u, obligationTerms, first.info.scope, d.ref()));
        return new Progress.Defined(d.ref());
    }

    private static Term recursive(FixpointKind kind, int i, Term block) {
        var idx = Term.Atom.of(Integer.toString(i));
        if (kind instanceof FixpointKind.Fixpoint f) {
            var struct = f.structArgs().stream().<Term>map(a -> Term.Atom.of(a != null ? a : "_")).toList();
            return new Term.Lst(Term.Atom.of("fix"), new Term.Lst(struct), idx, block);
        }
        return new Term.Lst(Term.Atom.of("cofix"), idx, block);
    }

    private void defined(ProgramDecl prg, GlobalRef ref, Environment env) {
        programs.remove(prg.name);
        prg.markDefined(ref);
        kernel.checkCurrent(env);
        events.emit(new Event.ProgramDefinedEvent(prg.name, List.of(ref.name()), prg.admitted()));
        events.emit(new Event.ProgramRemovedEvent(prg.name, "defined"));
        if (prg.fixpoint == null) message(prg.name + " is defined");
    }

    private static List<Integer> allIndices(ProgramDecl prg) {
        var all = new ArrayList<Integer>();
        for (var i = 0; i < prg.obligations().size(); i++) all.add(i);
        return all;
    }

    private static List<Hook.ObligationTerm> obligationTerms(List<ObligationGraph.Substitution> subst) {
        return subst.stream().map(s -> new Hook.ObligationTerm(s.name(), s.term())).toList();
    }

    /**
     * Records the solution of {@code obl}. Obligations to be expanded keep the
     * term itself; the others become a constant of their own.
     */
    DeclaredObligation declareObligation(ProgramDecl prg, Obligation obl, Universes uctx, Term type, Term body,
                                         boolean safe, Environment env) {
        var b = prg.reduce.apply(body);
        Obligation solved;
        var out = env;
        if (obl.status().mode() == Mode.EXPAND) solved = obl.withBody(new Body.Inline(b));
        else {
            var opaque = obl.status().opacity() == Opacity.OPAQUE && !config.transparentObligations();
            var entry = ConstantEntry.definition(obl.name(), prg.reduce.apply(type), b, opaque, Kernel.Kind.OBLIGATION,
                    Kernel.Scope.GLOBAL, uctx).unsafe(!safe);
            kernel.checkCurrent(env);
            var d = kernel.declare(entry);
            message(obl.name() + " is defined");
            solved = obl.withBody(new Body.Defined(d.ref().name()));
            out = d.env();
        }
        if (!safe) prg.markAdmitted();
        prg.setUniverses(prg.universes().union(uctx));
        return new DeclaredObligation(solved.body() instanceof Body.Defined, solved, out);
    }

    /**
     * Stores new obligations for {@code prg} and, once none remain, finalizes it unless it
     * still waits on other programs.
     */
    Progress updateObls(ProgramDecl prg, List<Obligation> obls, int rem, Environment env) {
        prg.update(obls, rem);
        if (rem > 0) {
            message(rem + " obligation" + (rem == 1 ? "" : "s") + " remaining for " + prg.name);
            return new Progress.Remain(rem);
        }
        return finishProgram(prg, env);
    }

    Progress finishProgram(ProgramDecl prg, Environment env) {
        var p = tryFinish(prg, env);
        if (p instanceof Progress.Defined) recheckDependents();
        return p;
    }

    private Progress tryFinish(ProgramDecl prg, Environment env) {
        if (prg.defined().isPresent()) return prg.progress();
        if (prg.remaining() > 0) return new Progress.Remain(prg.remaining());
        if (prg.isFixpoint()) {
            var members = new ArrayList<ProgramDecl>();
            for (var n : prg.deps) {
                var m = programs.find(n).orElse(null);
                if (m == null || m.remaining() > 0) return Progress.DEPENDENT;
                members.add(m);
            }
            declareMutualDefinition(members, env);
            return prg.progress();
        }
        for (var n : prg.deps)
            if (!n.equals(prg.name) && programs.find(n).isPresent()) return Progress.DEPENDENT;
        return declareDefinition(prg, env);
    }

    /** Finalizes waiting programs until a pass defines none of them. */
    private void recheckDependents() {
        boolean changed;
        do {
            changed = false;
            for (var p : programs.dependent()) {
                if (programs.find(p.name).isEmpty()) continue;
                if (tryFinish(p, kernel.env()) instanceof Progress.Defined) changed = true;
            }
        } while (changed);
    }

    /** Fails if some program still has unsolved obligations when {@code scope} closes. */
    public void checkSolvedObligations(String scope) {
        var open = programs.all().stream().filter(p -> p.remaining() > 0).map(p -> p.name).toList();
        if (!open.isEmpty()) throw new ProgramException.UnsolvedObligations(scope, open);
    }

    /** Proves {@code type} with a single tactic application, outside any interactive session. */
    public Built buildByTactic(Environment env, Universes uctx, Term type, Tactic tactic) {
        var pf = Proof.start("tactic_proof", Proof.Info.theorem(), env, uctx, type).by(tactic).proof();
        var out = pf.returnProof();
        var e = out.entries().get(0);
        return new Built(e.body(), e.type(), out.universes(), out.safe());
    }

    /** Saves a completed proof under its own name, or under {@code id} when given. */
    public Progress saveLemmaProved(Proof proof, boolean opaque, @Nullable String id) {
        checkClosing(proof.info(), opaque);
        return finish(proof.close(opaque), proof.info(), id, proof.env());
    }

    public Progress saveLemmaProvedDelayed(ProofObject po, Proof.Info info, @Nullable String id) {
        checkClosing(info, po.opaque);
        return finish(po, info, id, kernel.env());
    }

    /** Declares the statements of an unfinished proof as assumptions. */
    public Progress saveLemmaAdmitted(Proof proof) {
        return admitted(proof.names(), proof.statements(), proof.universes(), proof.info());
    }

    public Progress saveLemmaAdmittedDelayed(ProofObject po, Proof.Info info) {
        po.markConsumed();
        return admitted(po.names, po.statements, po.universes, info);
    }

    private void checkClosing(Proof.Info info, boolean opaque) {
        if (!(info.ending() instanceof Ending.EndObligation eo) || !opaque) return;
        var obl = programs.get(eo.program()).obligation(eo.num());
        if (obl.status().mode() == Mode.EXPAND || config.transparentObligations())
            throw new ProgramException(obl.name() + " must be transparent, close it with Defined");
    }

    private Progress finish(ProofObject po, Proof.Info info, @Nullable String id, Environment env) {
        var ending = info.ending();
        if (ending instanceof Ending.EndObligation eo) return obligationProved(eo, po, env);
        if (ending instanceof Ending.EndDerive ed) return finished(ed.finisher(), po, info);
        if (ending instanceof Ending.EndEquations eq) return finished(eq.finisher(), po, info);
        if (id != null && po.names.size() != 1)
            throw new ProgramException("Cannot rename a proof of " + po.names.size() + " statements");
        if (id != null) checkFresh(id);
        else po.names.forEach(this::checkFresh);
        var out = po.consume();
        var terms = new ArrayList<Term>();
        out.entries().forEach(e -> {
            terms.add(e.type());
            terms.add(e.body());
        });
        var u = finalUniverses(out.universes(), terms.toArray(Term[]::new));
        var entries = new ArrayList<ConstantEntry>();
        for (var i = 0; i < po.names.size(); i++) {
            var e = out.entries().get(i);
            var name = id != null ? id : po.names.get(i);
            entries.add(ConstantEntry.definition(name, e.type(), e.body(), po.opaque, info.kind(), info.scope(), u)
                    .unsafe(!out.safe()));
        }
        kernel.checkCurrent(env);
        var d = kernel.declareMutual(entries);
        d.refs().forEach(r -> message(r + " is defined"));
        callHook(null, info.hook(), new Hook.Info(u, List.of(), info.scope(), d.ref()));
        return new Progress.Defined(d.ref());
    }

    private Progress obligationProved(Ending.EndObligation eo, ProofObject po, Environment env) {
        var prg = programs.get(eo.program());
        var obl = prg.obligation(eo.num());
        if (obl.isSolved()) throw new ProgramException.UnknownObligation(obl.name() + " is already solved");
        var out = po.consume();
        var e = out.entries().get(0);
        var opacity = po.opaque ? Opacity.OPAQUE : Opacity.TRANSPARENT;
        var closed = obl.withStatus(new Obligation.Status(opacity, obl.status().mode()));
        var declared = declareObligation(prg, closed, out.universes(), e.type(), e.body(), out.safe(), env);
        var obls = new ArrayList<>(prg.obligations());
        obls.set(eo.num(), declared.obligation());
        var rem = prg.remaining() - 1;
        events.emit(new Event.ObligationSolvedEvent(prg.name, obl.name(), rem, false));
        var progress = updateObls(prg, obls, rem, declared.env());
        return cascade(prg, eo, progress);
    }

    /** Retries the obligations that were waiting on the one just closed. */
    private Progress cascade(ProgramDecl prg, Ending.EndObligation eo, Progress progress) {
        if (!(progress instanceof Progress.Remain) || !config.autoSolve()) return progress;
        var waiting = ObligationGraph.dependents(prg.obligations(), eo.num());
        return waiting.isEmpty() ? progress : eo.auto().resolve(prg.name, waiting, null);
    }

    private Progress finished(Proof.Finisher finisher, ProofObject po, Proof.Info info) {
        var out = po.consume();
        var terms = new ArrayList<Term>();
        out.entries().forEach(e -> {
            terms.add(e.type());
            terms.add(e.body());
        });
        var u = finalUniverses(out.universes(), terms.toArray(Term[]::new));
        var refs = finisher.finish(out, u, kernel);
        if (refs.isEmpty()) throw new ProgramException("Proof of " + po.name() + " declared nothing");
        callHook(null, info.hook(), new Hook.Info(u, List.of(), info.scope(), refs.get(0)));
        return new Progress.Defined(refs.get(0));
    }

    private Progress admitted(List<String> names, List<Term> statements, Universes uctx, Proof.Info info) {
        var ending = info.ending();
        if (ending instanceof Ending.EndObligation eo) {
            var prg = programs.get(eo.program());
            return cascade(prg, eo, admitObligations(prg, Set.of(eo.num())));
        }
        if (!(ending instanceof Ending.Regular))
            throw new ProgramException("Proof of " + names.get(0) + " cannot be admitted");
        names.forEach(this::checkFresh);
        var u = finalUniverses(uctx, statements.toArray(Term[]::new));
        var entries = new ArrayList<ConstantEntry>();
        for (var i = 0; i < names.size(); i++)
            entries.add(ConstantEntry.assumption(names.get(i), statements.get(i), info.scope(), u));
        var d = kernel.declareMutual(entries);
        d.refs().forEach(r -> message(r + " is assumed"));
        callHook(null, info.hook(), new Hook.Info(u, List.of(), info.scope(), d.ref()));
        return new Progress.Defined(d.ref());
    }

    /**
     * Closes the given unsolved obligations of {@code prg} with assumptions of their types,
     * then continues as if they had been proved. Dependencies outside of {@code indices}
     * must already be solved.
     */
    Progress admitObligations(ProgramDecl prg, Set<Integer> indices) {
        var obls = new ArrayList<>(prg.obligations());
        var todo = new TreeSet<Integer>();
        for (var i : indices) {
            if (i < 0 || i >= obls.size()) throw new ProgramException.UnknownObligation("No obligation " + (i + 1) + " in " + prg.name);
            if (!obls.get(i).isSolved()) todo.add(i);
        }
        for (var i : todo) {
            var missing = ObligationGraph.dependencies(obls, i).stream()
                    .filter(d -> !todo.contains(d) && !obls.get(d).isSolved())
                    .map(d -> obls.get(d).name())
                    .toList();
            if (!missing.isEmpty()) throw new ProgramException.DependenciesUnsolved(obls.get(i).name(), missing);
        }
        var env = kernel.env();
        if (todo.isEmpty()) return updateObls(prg, obls, prg.remaining(), env);
        var order = new ArrayList<Integer>();
        var types = new ArrayList<Term>();
        var bodies = new ArrayList<>(obls);
        while (order.size() < todo.size()) {
            for (var i : todo) {
                if (order.contains(i) || !ObligationGraph.isAttemptable(bodies, i)) continue;
                var t = ObligationGraph.substDeps(bodies, i, env).type();
                order.add(i);
                types.add(t);
                bodies.set(i, bodies.get(i).withBody(new Body.Defined(bodies.get(i).name())));
            }
        }
        var entries = new ArrayList<ConstantEntry>();
        for (var k = 0; k < order.size(); k++)
            entries.add(ConstantEntry.assumption(obls.get(order.get(k)).name(), types.get(k), Kernel.Scope.GLOBAL,
                    Universes.of(types.get(k))));
        kernel.checkCurrent(env);
        var d = kernel.declareMutual(entries);
        prg.markAdmitted();
        var rem = prg.remaining();
        for (var i : order) {
            rem--;
            events.emit(new Event.ObligationSolvedEvent(prg.name, obls.get(i).name(), rem, false));
        }
        message("Admitted " + order.size() + " obligation" + (order.size() == 1 ? "" : "s") + " of " + prg.name);
        return updateObls(prg, bodies, rem, d.env());
    }

    /** Runs a hook; failures are reported and the registration stays. */
    void callHook(@Nullable String program, @Nullable Hook hook, Hook.Info info) {
        if (hook == null) return;
        try {
            hook.call(info);
        } catch (Exception e) {
            error("Hook of " + info.ref() + " failed: " + e.getMessage());
            events.emit(new Event.HookFailedEvent(program, info.ref().name(), String.valueOf(e.getMessage())));
        }
    }

    /**
     * How a declaration is registered.
     *
     * @param poly whether the universes stay local to the declaration
     */
    public record CInfo(boolean poly, boolean opaque, Kernel.Kind kind, Kernel.Scope scope, @Nullable Hook hook) {
        public CInfo {
            requireNonNull(kind);
            requireNonNull(scope);
        }

        public static CInfo definition() {
            return new CInfo(false, false, Kernel.Kind.DEFINITION, Kernel.Scope.GLOBAL, null);
        }

        public CInfo withHook(@Nullable Hook hook) {
            return new CInfo(poly, opaque, kind, scope, hook);
        }

        public CInfo withKind(Kernel.Kind kind) {
            return new CInfo(poly, opaque, kind, scope, hook);
        }

        public CInfo withScope(Kernel.Scope scope) {
            return new CInfo(poly, opaque, kind, scope, hook);
        }

        public CInfo withOpaque(boolean opaque) {
            return new CInfo(poly, opaque, kind, scope, hook);
        }
    }

    record DeclaredObligation(boolean defined, Obligation obligation, Environment env) {
    }

    public record Built(Term body, Term type, Universes universes, boolean safe) {
    }
}
