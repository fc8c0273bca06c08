package dumb.obligato;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * A hole of a program that has to be filled by a separate proof. {@code deps} are the
 * positions of the obligations whose terms may occur in {@code type}.
 */
public record Obligation(String name, Term type, String location, SortedSet<Integer> deps, Status status,
                         @Nullable Tactic tactic, @Nullable Body body) {

    public Obligation {
        requireNonNull(name);
        requireNonNull(type);
        requireNonNull(location);
        deps = Collections.unmodifiableSortedSet(new TreeSet<>(deps));
        requireNonNull(status);
    }

    public static String name(String program, int position) {
        return program + "_obligation_" + (position + 1);
    }

    public static Term.Var hole(String name) {
        return Term.Var.of("?" + name);
    }

    public Term.Var hole() {
        return hole(name);
    }

    public boolean isSolved() {
        return body != null;
    }

    public Optional<Tactic> defaultTactic() {
        return Optional.ofNullable(tactic);
    }

    public Obligation withType(Term type) {
        return new Obligation(name, type, location, deps, status, tactic, body);
    }

    public Obligation withStatus(Status status) {
        return new Obligation(name, type, location, deps, status, tactic, body);
    }

    public Obligation withBody(Body body) {
        if (this.body != null) throw new IllegalStateException("Obligation " + name + " is already solved");
        return new Obligation(name, type, location, deps, status, tactic, requireNonNull(body));
    }

    public enum Opacity {OPAQUE, TRANSPARENT}

    /** DEFINE: declared as its own constant and referenced by name. EXPAND: its term is folded into dependents. */
    public enum Mode {DEFINE, EXPAND}

    public record Status(Opacity opacity, Mode mode) {
        public static final Status DEFAULT = new Status(Opacity.OPAQUE, Mode.DEFINE);

        public Status {
            requireNonNull(opacity);
            requireNonNull(mode);
        }

        public boolean transparent() {
            return opacity == Opacity.TRANSPARENT;
        }
    }

    public sealed interface Body permits Body.Defined, Body.Inline {

        /** Solved by the constant of that name. */
        record Defined(String constant) implements Body {
        }

        record Inline(Term term) implements Body {
        }
    }

    /** An obligation as handed over by elaboration, before the program names it. */
    public record Spec(@Nullable Term.Var hole, Term type, String location, SortedSet<Integer> deps, Status status,
                       @Nullable Tactic tactic) {
        public Spec {
            requireNonNull(type);
            requireNonNull(location);
            deps = Collections.unmodifiableSortedSet(new TreeSet<>(deps));
            requireNonNull(status);
        }

        public static Spec of(Term type, Integer... deps) {
            return new Spec(null, type, "", new TreeSet<>(List.of(deps)), Status.DEFAULT, null);
        }

        public Spec hole(String name) {
            return new Spec(Term.Var.of(name), type, location, deps, status, tactic);
        }

        public Spec status(Status status) {
            return new Spec(hole, type, location, deps, status, tactic);
        }

        public Spec tactic(@Nullable Tactic tactic) {
            return new Spec(hole, type, location, deps, status, tactic);
        }

        public Spec location(String location) {
            return new Spec(hole, type, location, deps, status, tactic);
        }
    }
}
