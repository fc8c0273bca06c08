package dumb.obligato.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.obligato.Event;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventsTest {

    @Test
    void eventsSurviveJson() throws JsonProcessingException {
        var e = new Event.ObligationSolvedEvent("f", "f_obligation_1", 2, true);
        var json = Json.str(e);
        assertTrue(json.contains("\"eventType\" : \"ObligationSolvedEvent\""));
        assertEquals(e, Json.obj(json, Event.class));
        assertEquals("f_obligation_1", e.toJson().get("obligation").asText());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        var events = Events.direct();
        var seen = new ArrayList<String>();
        events.on(Event.ProgramRemovedEvent.class, r -> {
            throw new IllegalStateException("listener broke");
        });
        events.on(Event.ProgramRemovedEvent.class, r -> seen.add(r.program()));
        events.emit(new Event.ProgramRemovedEvent("g", "abandoned"));
        assertEquals(List.of("g"), seen);
    }
}
