package dumb.obligato;

import dumb.obligato.Obligation.Spec;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;

abstract class AbstractTest {

    protected Session session;
    protected final List<Event> events = new ArrayList<>();

    static Term t(String kif) {
        return Term.of(kif);
    }

    static Spec spec(String hole, String type, Integer... deps) {
        return Spec.of(t(type), deps).hole(hole);
    }

    Configuration config() {
        return new Configuration();
    }

    @BeforeEach
    void setUp() {
        session = new Session(new Kernel.Basic(), config());
        events.clear();
        session.events.on(Event.ProgramAddedEvent.class, events::add);
        session.events.on(Event.ObligationSolvedEvent.class, events::add);
        session.events.on(Event.ProgramDefinedEvent.class, events::add);
        session.events.on(Event.ProgramRemovedEvent.class, events::add);
        session.events.on(Event.HookFailedEvent.class, events::add);
    }

    <E extends Event> List<E> events(Class<E> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    Kernel.Constant constant(String name) {
        return session.kernel.env().lookup(name).orElseThrow(() -> new AssertionError(name + " is not declared"));
    }

    ProgramDecl program(String name) {
        return session.programs.find(name).orElseThrow(() -> new AssertionError(name + " is not open"));
    }

    /** Solves obligation {@code num} of {@code prg} interactively with an exact term. */
    Progress prove(String prg, int num, String proof) {
        session.obligation(num, prg, null);
        session.by(Tactics.exact(proof));
        return session.qed();
    }
}
