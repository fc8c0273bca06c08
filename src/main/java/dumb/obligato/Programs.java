package dumb.obligato;

import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.BiFunction;

import static java.util.Objects.requireNonNull;

/**
 * Open program declarations by name, in the order they were added. A program leaves the
 * registry when its final term is registered or when it is abandoned.
 */
public class Programs {

    private final Map<String, ProgramDecl> programs = new LinkedHashMap<>();

    public void add(ProgramDecl prg) {
        if (programs.putIfAbsent(prg.name, requireNonNull(prg)) != null)
            throw new ProgramException.AlreadyDeclared(prg.name);
    }

    public Optional<ProgramDecl> find(String name) {
        return Optional.ofNullable(programs.get(name));
    }

    public ProgramDecl get(String name) {
        return find(name).orElseThrow(() -> new ProgramException.UnknownProgram(name));
    }

    public Optional<ProgramDecl> remove(String name) {
        return Optional.ofNullable(programs.remove(name));
    }

    public boolean isEmpty() {
        return programs.isEmpty();
    }

    public int size() {
        return programs.size();
    }

    /** Number of programs with unsolved obligations. */
    public int numPending() {
        return (int) programs.values().stream().filter(p -> p.remaining() > 0).count();
    }

    public Optional<ProgramDecl> firstPending() {
        return programs.values().stream().filter(p -> p.remaining() > 0).findFirst();
    }

    /**
     * The named program or, without a name, the only program with unsolved obligations.
     *
     * @throws ProgramException.UnknownProgram   if the named program is not open
     * @throws ProgramException.AmbiguousProgram if no name is given and zero or several programs are open
     */
    public ProgramDecl uniqueOpen(@Nullable String name) {
        if (name != null) return get(name);
        var open = programs.values().stream().filter(p -> p.remaining() > 0).toList();
        if (open.size() != 1) throw new ProgramException.AmbiguousProgram(open.stream().map(p -> p.name).toList());
        return open.get(0);
    }

    public List<ProgramDecl> all() {
        return List.copyOf(programs.values());
    }

    public List<String> names() {
        return List.copyOf(programs.keySet());
    }

    public <X> X fold(X init, BiFunction<X, ProgramDecl, X> f) {
        var x = init;
        for (var p : all()) x = f.apply(x, p);
        return x;
    }

    /** Programs whose remaining obligations are all solved but which wait on other programs. */
    public List<ProgramDecl> dependent() {
        return programs.values().stream().filter(p -> p.remaining() == 0 && p.defined().isEmpty()).toList();
    }
}
