package dumb.obligato;

import java.util.List;

/**
 * Errors reported to the command interpreter. Apart from {@link KernelError} and
 * {@link UnsolvedObligations}, all of them are raised before any program state is
 * touched, so the command can simply be retried.
 */
public class ProgramException extends RuntimeException {

    public ProgramException(String message) {
        super(message);
    }

    public ProgramException(String message, Throwable cause) {
        super(message, cause);
    }

    /** No program name was given and there is not exactly one open program. */
    public static class AmbiguousProgram extends ProgramException {
        public final List<String> open;

        public AmbiguousProgram(List<String> open) {
            super(open.isEmpty()
                    ? "No obligations remaining"
                    : "More than one program with unsolved obligations: " + String.join(", ", open));
            this.open = List.copyOf(open);
        }
    }

    public static class UnknownProgram extends ProgramException {
        public UnknownProgram(String name) {
            super("Unknown program " + name);
        }
    }

    public static class UnknownObligation extends ProgramException {
        public UnknownObligation(String message) {
            super(message);
        }
    }

    public static class AlreadyDeclared extends ProgramException {
        public final String name;

        public AlreadyDeclared(String name) {
            super(name + " already exists.");
            this.name = name;
        }
    }

    public static class DependenciesUnsolved extends ProgramException {
        public DependenciesUnsolved(String obligation, List<String> missing) {
            super("Obligation " + obligation + " depends on unsolved obligation(s) " + String.join(", ", missing));
        }
    }

    public static class UnsolvedObligations extends ProgramException {
        public final List<String> programs;

        public UnsolvedObligations(String scope, List<String> programs) {
            super("Unsolved obligations when closing " + scope + ": " + String.join(", ", programs)
                    + (programs.size() == 1 ? " has" : " have") + " unsolved obligations");
            this.programs = List.copyOf(programs);
        }
    }

    /** The tactic made no valid step; the proof state it was applied to is unchanged. */
    public static class TacticFailure extends ProgramException {
        public TacticFailure(String message) {
            super(message);
        }

        public TacticFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class IncompleteProof extends ProgramException {
        public IncompleteProof(String name, int goals) {
            super("Attempt to save an incomplete proof " + name + " (" + goals + " goal" + (goals == 1 ? "" : "s") + " remaining)");
        }
    }

    public static class KernelError extends ProgramException {
        public KernelError(String message) {
            super(message);
        }
    }

    public static class MissingLibraries extends ProgramException {
        public MissingLibraries(List<String> missing) {
            super("Program mode requires the libraries " + String.join(", ", missing) + " to be loaded");
        }
    }
}
