package dumb.obligato;

import dumb.obligato.util.Events;
import dumb.obligato.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static dumb.obligato.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * One document being processed: the kernel, the open programs and the stack of
 * interactive proofs. Commands run one at a time on the caller's thread.
 */
public class Session {

    public final Kernel kernel;
    public final Programs programs = new Programs();
    public final Events events = Events.direct();
    public final Configuration config;
    public final Declare declare;
    public final Obligations obligations;
    private final Deque<Proof> proofs = new ArrayDeque<>();
    private final Deque<String> sections = new ArrayDeque<>();

    public Session() {
        this(new Kernel.Basic(), Configuration.load());
    }

    /**
     * Log messages are published on the bus of the most recently constructed or
     * {@linkplain #attachLog() attached} session, since {@link Log} is a static facade.
     */
    public Session(Kernel kernel, Configuration config) {
        this.kernel = requireNonNull(kernel);
        this.config = requireNonNull(config);
        this.declare = new Declare(kernel, programs, events, config);
        this.obligations = new Obligations(kernel, programs, events, config, declare);
        attachLog();
    }

    /** Routes {@link Log} messages to this session's event bus. */
    public void attachLog() {
        Log.setEvents(events);
    }

    public Kernel.GlobalRef define(String name, Term type, Term body) {
        return declare.declareDefinition(name, Declare.CInfo.definition(), type, body, Universes.of(type, body));
    }

    public Kernel.GlobalRef assume(String name, Term type) {
        return declare.declareAssumption(name, Declare.CInfo.definition().withKind(Kernel.Kind.AXIOM), type, Universes.of(type));
    }

    public Progress program(String name, Term type, Term body, Obligation.Spec... obligations) {
        return program(name, type, body, Obligations.Options.defaults(), List.of(obligations));
    }

    public Progress program(String name, Term type, Term body, Obligations.Options opts, List<Obligation.Spec> obligations) {
        return this.obligations.addDefinition(name, type, body, Universes.of(type, body), opts, obligations);
    }

    public Proof startLemma(String name, Term statement) {
        return startLemma(name, statement, Proof.Info.theorem());
    }

    public Proof startLemma(String name, Term statement, Proof.Info info) {
        declare.checkFresh(name);
        return push(Proof.start(name, info, kernel.env(), Universes.EMPTY, statement));
    }

    /** Opens obligation {@code num} (1-based) of the named, or the only open, program. */
    public Proof obligation(int num, @Nullable String program, @Nullable Tactic tactic) {
        return push(obligations.obligation(num, program, tactic));
    }

    public Proof nextObligation(@Nullable String program, @Nullable Tactic tactic) {
        return push(obligations.nextObligation(program, tactic));
    }

    private Proof push(Proof p) {
        proofs.push(p);
        message(p.toString());
        return p;
    }

    public Proof current() {
        var p = proofs.peek();
        if (p == null) throw new ProgramException("No proof in progress");
        return p;
    }

    public boolean inProof() {
        return !proofs.isEmpty();
    }

    /** Applies {@code tactic} to the focused goal of the current proof. */
    public Proof by(Tactic tactic) {
        return replace(current().by(tactic).proof());
    }

    /** Like {@link #by(Tactic)}, running the endline tactic afterwards. */
    public Proof byEndline(Tactic tactic) {
        return replace(current().byEndline(tactic).proof());
    }

    public Proof setUsedVariables(List<String> vars) {
        return replace(current().setUsedVariables(vars).proof());
    }

    private Proof replace(Proof p) {
        proofs.pop();
        proofs.push(p);
        return p;
    }

    public Progress qed() {
        return save(true, null);
    }

    /** Saves the current proof under {@code name} instead of its own. */
    public Progress qed(String name) {
        return save(true, name);
    }

    /** Saves the current proof transparently. */
    public Progress defined() {
        return save(false, null);
    }

    private Progress save(boolean opaque, @Nullable String name) {
        var p = current().updateGlobalEnv(kernel.env());
        var progress = declare.saveLemmaProved(p, opaque, name);
        proofs.pop();
        return progress;
    }

    public Progress admitted() {
        var p = current();
        var progress = declare.saveLemmaAdmitted(p);
        proofs.pop();
        return progress;
    }

    /**
     * Closes the current proof without building its term yet. The term is computed when
     * {@link #save(Closed)} forces it.
     */
    public Closed closeDelayed(boolean opaque) {
        var p = current();
        if (p.openGoals() > 0) throw new ProgramException.IncompleteProof(p.name(), p.openGoals());
        var po = p.closeFuture(p.name(), opaque, Deferred.of(p.name(), p::returnProof));
        proofs.pop();
        return new Closed(po, p.info());
    }

    public Progress save(Closed closed) {
        return declare.saveLemmaProvedDelayed(closed.proof(), closed.info(), null);
    }

    public void abort() {
        var p = proofs.poll();
        if (p == null) throw new ProgramException("No proof in progress");
        message(p.name() + " aborted");
    }

    public void require(String library) {
        kernel.load(library);
    }

    public void openSection(String name) {
        kernel.openSection(name);
        sections.push(name);
    }

    public void variable(String name, Term type) {
        kernel.addSectionVariable(name, type);
    }

    /** Closes the innermost section; refused while some program still has obligations. */
    public void endSection() {
        var name = sections.peek();
        if (name == null) throw new ProgramException("No open section");
        declare.checkSolvedObligations("section " + name);
        kernel.closeSection();
        sections.pop();
    }

    public record Closed(ProofObject proof, Proof.Info info) {
    }
}
