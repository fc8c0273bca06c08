package dumb.obligato;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A closed proof awaiting registration. The statements and starting universes are
 * available immediately; the proof terms may still have to be computed.
 */
public final class ProofObject {
    public final List<String> names;
    public final List<Term> statements;
    public final Universes universes;
    public final boolean opaque;
    private final Deferred<Proof.Output> output;
    private final AtomicBoolean consumed = new AtomicBoolean();

    ProofObject(List<String> names, List<Term> statements, Universes universes, boolean opaque, Deferred<Proof.Output> output) {
        this.names = List.copyOf(names);
        this.statements = List.copyOf(statements);
        this.universes = requireNonNull(universes);
        this.opaque = opaque;
        this.output = requireNonNull(output);
    }

    public String name() {
        return names.get(0);
    }

    public boolean isForced() {
        return output.isForced();
    }

    /** Forces the proof terms. A proof object can be handed to the finalizer only once. */
    Proof.Output consume() {
        if (!consumed.compareAndSet(false, true))
            throw new IllegalStateException("Proof object " + name() + " was already consumed");
        return output.force();
    }

    void markConsumed() {
        if (!consumed.compareAndSet(false, true))
            throw new IllegalStateException("Proof object " + name() + " was already consumed");
    }
}
