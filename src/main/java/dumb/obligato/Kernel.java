package dumb.obligato;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.obligato.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * The checker and global store of declarations. Every registration produces a new
 * {@link Environment} snapshot; callers must continue with the snapshot they got back
 * rather than one captured earlier.
 */
public interface Kernel {

    Environment env();

    Declared declare(ConstantEntry entry);

    /** Registers a group at once; either every member is registered or none is. */
    Declared declareMutual(List<ConstantEntry> entries);

    default void checkCurrent(Environment seen) {
        var now = env();
        if (seen.version() != now.version()) throw new StaleEnvironmentException(seen.version(), now.version());
    }

    void openSection(String name);

    void addSectionVariable(String name, Term type);

    void closeSection();

    void load(String library);

    enum Kind {DEFINITION, THEOREM, LEMMA, FIXPOINT, COFIXPOINT, AXIOM, OBLIGATION}

    enum Scope {GLOBAL, LOCAL}

    record GlobalRef(String name) {
        public GlobalRef {
            requireNonNull(name);
        }

        public Term term() {
            return Term.Atom.of(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Notation(String notation, Term expansion) {
        public Notation {
            requireNonNull(notation);
            requireNonNull(expansion);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ConstantEntry(String name, Term type, @Nullable Term body, boolean opaque, Kind kind, Scope scope,
                         Universes universes, boolean unsafe, List<Notation> notations) {
        public ConstantEntry {
            requireNonNull(name);
            requireNonNull(type);
            requireNonNull(kind);
            requireNonNull(scope);
            requireNonNull(universes);
            notations = List.copyOf(notations);
        }

        public static ConstantEntry definition(String name, Term type, Term body, boolean opaque, Kind kind, Scope scope, Universes universes) {
            return new ConstantEntry(name, type, requireNonNull(body), opaque, kind, scope, universes, false, List.of());
        }

        public static ConstantEntry assumption(String name, Term type, Scope scope, Universes universes) {
            return new ConstantEntry(name, type, null, true, Kind.AXIOM, scope, universes, false, List.of());
        }

        public ConstantEntry unsafe(boolean unsafe) {
            return new ConstantEntry(name, type, body, opaque, kind, scope, universes, unsafe, notations);
        }

        public ConstantEntry notations(List<Notation> notations) {
            return new ConstantEntry(name, type, body, opaque, kind, scope, universes, unsafe, notations);
        }
    }

    /**
     * A registered constant. {@code admitted} is set when it is an assumption, was built
     * with an unsafe proof step, or mentions a constant that is admitted.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Constant(String name, Term type, @Nullable Term body, boolean opaque, Kind kind, Scope scope,
                    Universes universes, boolean admitted, @Nullable String section, List<Notation> notations) {

        public boolean isAssumption() {
            return body == null;
        }

        public GlobalRef ref() {
            return new GlobalRef(name);
        }
    }

    record Environment(long version, Map<String, Constant> constants, Map<String, Term> sectionVariables,
                       Set<String> libraries) {

        public Optional<Constant> lookup(String name) {
            return Optional.ofNullable(constants.get(name));
        }

        public boolean contains(String name) {
            return constants.containsKey(name) || sectionVariables.containsKey(name);
        }

        /** Body of a transparent constant. */
        public Optional<Term> unfold(String name) {
            return lookup(name).filter(c -> !c.opaque() && c.body() != null).map(Constant::body);
        }
    }

    record Declared(List<GlobalRef> refs, Environment env) {
        public Declared {
            refs = List.copyOf(refs);
        }

        public GlobalRef ref() {
            return refs.get(0);
        }
    }

    class Basic implements Kernel {
        private final Map<String, Constant> constants = new LinkedHashMap<>();
        private final Deque<Section> sections = new ArrayDeque<>();
        private final Set<String> libraries = new LinkedHashSet<>();
        private long version = 0;
        private Environment env;

        public Basic() {
            this.env = snapshot();
        }

        @Override
        public Environment env() {
            return env;
        }

        @Override
        public Declared declare(ConstantEntry entry) {
            return declareMutual(List.of(entry));
        }

        @Override
        public Declared declareMutual(List<ConstantEntry> entries) {
            if (entries.isEmpty()) throw new IllegalArgumentException("Nothing to declare");
            var names = new HashSet<String>();
            for (var e : entries) {
                if (env.contains(e.name()) || !names.add(e.name())) throw new ProgramException.AlreadyDeclared(e.name());
                check(e);
            }
            var refs = new ArrayList<GlobalRef>(entries.size());
            var section = sections.peek();
            for (var e : entries) {
                var c = new Constant(e.name(), e.type(), e.body(), e.opaque() || e.body() == null, e.kind(), e.scope(),
                        e.universes().withLevels(Universes.levelsOf(e.type(), e.body())),
                        admitted(e, names), section != null ? section.name : null, e.notations());
                constants.put(c.name(), c);
                if (section != null && c.scope() == Scope.LOCAL) section.locals.add(c.name());
                refs.add(c.ref());
            }
            env = snapshot();
            message("Declared " + String.join(", ", names));
            return new Declared(refs, env);
        }

        private void check(ConstantEntry e) {
            if (e.type().containsVar() || (e.body() != null && e.body().containsVar()))
                throw new ProgramException.KernelError("Declaration of " + e.name() + " has unresolved placeholders: "
                        + (e.body() != null ? e.body().vars() : e.type().vars()));
            if (!e.universes().isConsistent())
                throw new ProgramException.KernelError("Universe inconsistency in " + e.name() + ": " + e.universes());
        }

        private boolean admitted(ConstantEntry e, Set<String> group) {
            if (e.unsafe() || e.body() == null) return true;
            var refs = new HashSet<>(Term.atoms(e.type()));
            refs.addAll(Term.atoms(e.body()));
            return refs.stream()
                    .map(Term.Atom::value)
                    .filter(n -> !group.contains(n))
                    .map(constants::get)
                    .filter(Objects::nonNull)
                    .anyMatch(Constant::admitted);
        }

        @Override
        public void openSection(String name) {
            sections.push(new Section(name));
            env = snapshot();
        }

        @Override
        public void addSectionVariable(String name, Term type) {
            var s = sections.peek();
            if (s == null) throw new ProgramException.KernelError("Variable " + name + " declared outside of a section");
            if (env.contains(name)) throw new ProgramException.AlreadyDeclared(name);
            s.variables.put(name, type);
            env = snapshot();
        }

        @Override
        public void closeSection() {
            var s = sections.poll();
            if (s == null) throw new ProgramException.KernelError("No open section");
            s.locals.forEach(constants::remove);
            env = snapshot();
        }

        @Override
        public void load(String library) {
            if (libraries.add(library)) env = snapshot();
        }

        private Environment snapshot() {
            var vars = new LinkedHashMap<String, Term>();
            var it = sections.descendingIterator();
            while (it.hasNext()) vars.putAll(it.next().variables);
            return new Environment(version++,
                    Collections.unmodifiableMap(new LinkedHashMap<>(constants)),
                    Collections.unmodifiableMap(vars),
                    Collections.unmodifiableSet(new LinkedHashSet<>(libraries)));
        }

        private static final class Section {
            final String name;
            final Map<String, Term> variables = new LinkedHashMap<>();
            final List<String> locals = new ArrayList<>();

            Section(String name) {
                this.name = name;
            }
        }
    }
}
