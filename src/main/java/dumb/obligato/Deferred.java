package dumb.obligato;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A computation forced at most once, on the first {@link #force()}, whose outcome
 * (value or failure) is cached. Forcing is not cancellable once started.
 */
public final class Deferred<T> {
    public final String key;
    private final Supplier<T> producer;
    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<T> result = new CompletableFuture<>();

    private Deferred(String key, Supplier<T> producer) {
        this.key = requireNonNull(key);
        this.producer = producer;
    }

    public static <T> Deferred<T> of(String key, Supplier<T> producer) {
        return new Deferred<>(key, requireNonNull(producer));
    }

    public static <T> Deferred<T> done(String key, T value) {
        var d = new Deferred<T>(key, () -> value);
        d.started.set(true);
        d.result.complete(value);
        return d;
    }

    public boolean isForced() {
        return result.isDone();
    }

    public T force() {
        if (started.compareAndSet(false, true)) {
            try {
                result.complete(producer.get());
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        }
        try {
            return result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error er) throw er;
            throw e;
        }
    }

    @Override
    public String toString() {
        return "Deferred[" + key + (isForced() ? ", forced]" : "]");
    }
}
