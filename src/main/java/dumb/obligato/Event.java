package dumb.obligato;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.obligato.util.Events;
import dumb.obligato.util.Json;

import java.util.List;

import static java.util.Objects.requireNonNull;

@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "eventType",
        visible = true)
@JsonSubTypes({
        @Type(value = Event.ProgramAddedEvent.class, name = "ProgramAddedEvent"),
        @Type(value = Event.ObligationSolvedEvent.class, name = "ObligationSolvedEvent"),
        @Type(value = Event.ProgramDefinedEvent.class, name = "ProgramDefinedEvent"),
        @Type(value = Event.ProgramRemovedEvent.class, name = "ProgramRemovedEvent"),
        @Type(value = Event.HookFailedEvent.class, name = "HookFailedEvent"),
        @Type(value = Events.LogMessageEvent.class, name = "LogMessageEvent")
})
public interface Event {

    default String program() {
        return null;
    }

    default JsonNode toJson() {
        return Json.node(this);
    }

    String getEventType();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ProgramAddedEvent(String program, int obligations, int remaining) implements Event {
        public ProgramAddedEvent {
            requireNonNull(program);
        }

        @Override
        public String getEventType() {
            return "ProgramAddedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ObligationSolvedEvent(String program, String obligation, int remaining, boolean auto) implements Event {
        public ObligationSolvedEvent {
            requireNonNull(program);
            requireNonNull(obligation);
        }

        @Override
        public String getEventType() {
            return "ObligationSolvedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ProgramDefinedEvent(String program, List<String> refs, boolean admitted) implements Event {
        public ProgramDefinedEvent {
            requireNonNull(program);
            refs = List.copyOf(refs);
        }

        @Override
        public String getEventType() {
            return "ProgramDefinedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ProgramRemovedEvent(String program, String reason) implements Event {
        public ProgramRemovedEvent {
            requireNonNull(program);
            requireNonNull(reason);
        }

        @Override
        public String getEventType() {
            return "ProgramRemovedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record HookFailedEvent(String program, String ref, String error) implements Event {
        public HookFailedEvent {
            requireNonNull(ref);
            requireNonNull(error);
        }

        @Override
        public String getEventType() {
            return "HookFailedEvent";
        }
    }
}
