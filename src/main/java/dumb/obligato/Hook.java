package dumb.obligato;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Callback run once after a declaration has been registered, e.g. to register it as a
 * coercion or index it for search. It may register further declarations itself.
 */
@FunctionalInterface
public interface Hook {

    void call(Info info) throws Exception;

    /**
     * @param universes   universe context the declaration was registered with
     * @param obligations obligation names with the term that replaced each of them
     * @param scope       scope of the original declaration
     * @param ref         the registered declaration
     */
    record Info(Universes universes, List<ObligationTerm> obligations, Kernel.Scope scope, Kernel.GlobalRef ref) {
        public Info {
            requireNonNull(universes);
            obligations = List.copyOf(obligations);
            requireNonNull(scope);
            requireNonNull(ref);
        }
    }

    record ObligationTerm(String name, Term term) {
    }
}
