package dumb.obligato;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * KIF-style term: atoms, {@code ?variables} and lists. Variables are the holes of
 * partial terms; a term is closed when it contains none.
 */
sealed public interface Term permits Term.Atom, Term.Var, Term.Lst {

    static Term subst(Term term, Map<Var, ? extends Term> bindings) {
        if (bindings.isEmpty() || !term.containsVar()) return term;
        if (term instanceof Var v) {
            var b = bindings.get(v);
            return b != null ? b : v;
        }
        if (term instanceof Lst l) {
            var changed = false;
            var out = new ArrayList<Term>(l.size());
            for (var sub : l.terms) {
                var s = subst(sub, bindings);
                if (s != sub) changed = true;
                out.add(s);
            }
            return changed ? new Lst(out) : l;
        }
        return term;
    }

    /** Atoms occurring anywhere in the term. */
    static Set<Atom> atoms(Term term) {
        var out = new HashSet<Atom>();
        collectAtoms(term, out);
        return out;
    }

    private static void collectAtoms(Term term, Set<Atom> out) {
        if (term instanceof Atom a) out.add(a);
        else if (term instanceof Lst l) l.terms.forEach(t -> collectAtoms(t, out));
    }

    static Term of(String kif) {
        try {
            var terms = KifParser.parseKif(kif);
            if (terms.size() != 1)
                throw new IllegalArgumentException("Expected exactly one term, found " + terms.size() + " in: " + kif);
            return terms.get(0);
        } catch (KifParser.ParseException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    String toKif();

    boolean containsVar();

    Set<Var> vars();

    record Var(String name) implements Term {
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(256);

        public Var {
            requireNonNull(name);
            if (!name.startsWith("?") || name.length() < 2)
                throw new IllegalArgumentException("Variable name must start with '?' and have length > 1: " + name);
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        @Override
        public String toKif() {
            return name;
        }

        @Override
        public boolean containsVar() {
            return true;
        }

        @Override
        public Set<Var> vars() {
            return Set.of(this);
        }

        @Override
        public String toString() {
            return toKif();
        }
    }

    final class Lst implements Term {
        public final List<Term> terms;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String kifStringCache;
        private volatile Set<Var> variablesCache;
        private volatile Boolean containsVariableCache;

        public Lst(List<Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Lst(Term... terms) {
            this(List.of(terms));
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        public Optional<String> op() {
            return terms.isEmpty() || !(terms.get(0) instanceof Atom a) ? Optional.empty() : Optional.of(a.value());
        }

        public boolean is(String op, int size) {
            return size() == size && op().filter(op::equals).isPresent();
        }

        @Override
        public String toKif() {
            if (kifStringCache == null)
                kifStringCache = terms.stream().map(Term::toKif).collect(Collectors.joining(" ", "(", ")"));
            return kifStringCache;
        }

        @Override
        public boolean containsVar() {
            if (containsVariableCache == null) containsVariableCache = terms.stream().anyMatch(Term::containsVar);
            return containsVariableCache;
        }

        @Override
        public Set<Var> vars() {
            if (variablesCache == null)
                variablesCache = terms.stream().flatMap(t -> t.vars().stream()).collect(Collectors.toUnmodifiableSet());
            return variablesCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = terms.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return toKif();
        }
    }

    record Atom(String value) implements Term {
        private static final Pattern SAFE_ATOM_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-+*/.<>=:!#%&'@]+$");
        private static final Map<String, Atom> internCache = new ConcurrentHashMap<>(1024);

        public Atom {
            requireNonNull(value);
        }

        public static Atom of(String value) {
            return internCache.computeIfAbsent(value, Atom::new);
        }

        @Override
        public String toKif() {
            var needsQuotes = value.isEmpty() || !SAFE_ATOM_PATTERN.matcher(value).matches();
            return needsQuotes ? '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"' : value;
        }

        @Override
        public boolean containsVar() {
            return false;
        }

        @Override
        public Set<Var> vars() {
            return Set.of();
        }

        @Override
        public String toString() {
            return toKif();
        }
    }
}
