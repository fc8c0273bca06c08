package dumb.obligato;

/** Resolution status of a program after a command. */
public sealed interface Progress permits Progress.Remain, Progress.Dependent, Progress.Defined {

    Dependent DEPENDENT = new Dependent();

    record Remain(int remaining) implements Progress {
        @Override
        public String toString() {
            return remaining + " obligation" + (remaining == 1 ? "" : "s") + " remaining";
        }
    }

    /** All obligations are solved but the program waits on other open programs. */
    record Dependent() implements Progress {
    }

    record Defined(Kernel.GlobalRef ref) implements Progress {
        @Override
        public String toString() {
            return ref + " is defined";
        }
    }
}
