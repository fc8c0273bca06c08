package dumb.obligato;

/** An environment snapshot was read after a registration it does not reflect. */
public class StaleEnvironmentException extends IllegalStateException {
    public StaleEnvironmentException(long seen, long current) {
        super("Stale environment: snapshot v" + seen + " read after the kernel moved to v" + current);
    }
}
