package dumb.obligato;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Universe context: the levels a declaration mentions and the ordering constraints
 * between them. Levels occur in terms as {@code (Type <level>)}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Universes(SortedSet<String> levels, SortedSet<Constraint> constraints) {

    public static final String TYPE = "Type";
    public static final Universes EMPTY = new Universes(new TreeSet<>(), new TreeSet<>());

    public Universes {
        levels = Collections.unmodifiableSortedSet(new TreeSet<>(levels));
        constraints = Collections.unmodifiableSortedSet(new TreeSet<>(constraints));
        for (var c : constraints)
            if (!levels.contains(c.left()) || !levels.contains(c.right()))
                throw new IllegalArgumentException("Constraint " + c + " mentions an undeclared level");
    }

    public static Universes of(Collection<String> levels, Constraint... constraints) {
        return new Universes(new TreeSet<>(levels), new TreeSet<>(List.of(constraints)));
    }

    public static Universes of(Term... terms) {
        return new Universes(levelsOf(terms), new TreeSet<>());
    }

    public static SortedSet<String> levelsOf(Term... terms) {
        var out = new TreeSet<String>();
        for (var t : terms) if (t != null) collectLevels(t, out);
        return out;
    }

    private static void collectLevels(Term t, Set<String> out) {
        if (!(t instanceof Term.Lst l)) return;
        if (l.is(TYPE, 2) && l.get(1) instanceof Term.Atom a) out.add(a.value());
        else l.terms.forEach(x -> collectLevels(x, out));
    }

    public Universes union(Universes other) {
        if (other == this || other.isEmpty()) return this;
        if (isEmpty()) return other;
        var ls = new TreeSet<>(levels);
        ls.addAll(other.levels);
        var cs = new TreeSet<>(constraints);
        cs.addAll(other.constraints);
        return new Universes(ls, cs);
    }

    public Universes withLevels(Collection<String> more) {
        if (levels.containsAll(more)) return this;
        var ls = new TreeSet<>(levels);
        ls.addAll(more);
        return new Universes(ls, constraints);
    }

    public Universes with(Constraint c) {
        return withLevels(List.of(c.left(), c.right())).add(c);
    }

    private Universes add(Constraint c) {
        var cs = new TreeSet<>(constraints);
        cs.add(c);
        return new Universes(levels, cs);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return levels.isEmpty();
    }

    /** Collapses equality classes onto their least member and drops trivial constraints. */
    public Universes minimize() {
        return minimize(Set.of());
    }

    /**
     * Like {@link #minimize()}, but levels in {@code keep} survive: a class is represented
     * by its least kept member and its other kept members stay equal to it.
     */
    public Universes minimize(Set<String> keep) {
        Comparator<String> prefer = Comparator.<String, Boolean>comparing(l -> !keep.contains(l)).thenComparing(Comparator.naturalOrder());
        var rep = new HashMap<String, String>();
        levels.forEach(l -> rep.put(l, l));
        for (var c : constraints) {
            if (c.rel() != Rel.EQ) continue;
            var a = find(rep, c.left());
            var b = find(rep, c.right());
            if (a.equals(b)) continue;
            if (prefer.compare(a, b) < 0) rep.put(b, a);
            else rep.put(a, b);
        }
        var ls = new TreeSet<String>();
        var cs = new TreeSet<Constraint>();
        for (var l : levels) {
            var r = find(rep, l);
            ls.add(r);
            if (!r.equals(l) && keep.contains(l)) {
                ls.add(l);
                cs.add(Constraint.eq(r, l));
            }
        }
        for (var c : constraints) {
            if (c.rel() == Rel.EQ) continue;
            var l = find(rep, c.left());
            var r = find(rep, c.right());
            if (l.equals(r) && c.rel() == Rel.LE) continue;
            cs.add(new Constraint(l, c.rel(), r));
        }
        cs.removeIf(c -> c.rel() == Rel.LE && cs.contains(Constraint.lt(c.left(), c.right())));
        return new Universes(ls, cs);
    }

    private static String find(Map<String, String> rep, String l) {
        var r = rep.get(l);
        return r.equals(l) ? l : find(rep, r);
    }

    /**
     * Keeps only {@code keep} and the constraints between kept levels, including those
     * implied through the dropped ones.
     */
    public Universes restrict(Set<String> keep) {
        var kept = new TreeSet<String>();
        levels.stream().filter(keep::contains).forEach(kept::add);
        if (kept.size() == levels.size()) return this;
        var cs = new TreeSet<Constraint>();
        for (var from : kept) {
            reach(from).forEach((to, strict) -> {
                if (!to.equals(from) && kept.contains(to))
                    cs.add(new Constraint(from, strict ? Rel.LT : Rel.LE, to));
            });
        }
        for (var c : List.copyOf(cs)) {
            if (c.rel() == Rel.LE && c.left().compareTo(c.right()) < 0 && cs.contains(Constraint.le(c.right(), c.left()))) {
                cs.remove(c);
                cs.remove(Constraint.le(c.right(), c.left()));
                cs.add(Constraint.eq(c.left(), c.right()));
            }
        }
        return new Universes(kept, cs);
    }

    /** Levels reachable from {@code from} along constraints, with whether some path is strict. */
    private Map<String, Boolean> reach(String from) {
        var out = new HashMap<String, Boolean>();
        var todo = new ArrayDeque<Map.Entry<String, Boolean>>();
        todo.add(Map.entry(from, false));
        while (!todo.isEmpty()) {
            var e = todo.poll();
            var prev = out.get(e.getKey());
            if (prev != null && (prev || !e.getValue())) continue;
            out.put(e.getKey(), e.getValue());
            for (var c : constraints) {
                if (c.left().equals(e.getKey()))
                    todo.add(Map.entry(c.right(), e.getValue() || c.rel() == Rel.LT));
                if (c.rel() == Rel.EQ && c.right().equals(e.getKey()))
                    todo.add(Map.entry(c.left(), e.getValue()));
            }
        }
        return out;
    }

    /** False when some level would have to be strictly below itself. */
    @JsonIgnore
    public boolean isConsistent() {
        return levels.stream().noneMatch(l -> Boolean.TRUE.equals(reach(l).get(l)));
    }

    @Override
    public String toString() {
        return levels + (constraints.isEmpty() ? "" : " " + constraints);
    }

    public enum Rel {
        LT("<"), LE("<="), EQ("=");

        public final String symbol;

        Rel(String symbol) {
            this.symbol = symbol;
        }
    }

    public record Constraint(String left, Rel rel, String right) implements Comparable<Constraint> {
        private static final Comparator<Constraint> ORDER = Comparator.comparing(Constraint::left)
                .thenComparing(Constraint::rel)
                .thenComparing(Constraint::right);

        public Constraint {
            requireNonNull(left);
            requireNonNull(rel);
            requireNonNull(right);
        }

        public static Constraint lt(String l, String r) {
            return new Constraint(l, Rel.LT, r);
        }

        public static Constraint le(String l, String r) {
            return new Constraint(l, Rel.LE, r);
        }

        public static Constraint eq(String l, String r) {
            return new Constraint(l, Rel.EQ, r);
        }

        @Override
        public int compareTo(Constraint o) {
            return ORDER.compare(this, o);
        }

        @Override
        public String toString() {
            return left + " " + rel.symbol + " " + right;
        }
    }
}
