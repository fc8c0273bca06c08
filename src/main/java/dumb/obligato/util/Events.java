package dumb.obligato.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import dumb.obligato.Event;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

public class Events {
    public final Executor exe;
    public final ConcurrentMap<Class<? extends Event>, CopyOnWriteArrayList<Consumer<Event>>> listeners = new ConcurrentHashMap<>();

    public Events(Executor exe) {
        this.exe = requireNonNull(exe);
    }

    /** Dispatches on the emitting thread. */
    public static Events direct() {
        return new Events(Runnable::run);
    }

    private static void exeSafe(Consumer<Event> listener, Event event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            Log.error("Error processing event listener for " + event.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public <T extends Event> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(Event event) {
        exe.execute(() -> {
            listeners.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>()).forEach(listener -> exeSafe(listener, event));
        });
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LogMessageEvent(String message, Log.LogLevel level) implements Event {
        public LogMessageEvent {
            requireNonNull(message);
            requireNonNull(level);
        }

        @Override
        public String getEventType() {
            return "LogMessageEvent";
        }
    }
}
