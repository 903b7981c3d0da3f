package com.cellbroker.event;

import com.cellbroker.dto.BrokerEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static com.cellbroker.Fixtures.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemainingHopsTest {

    @Test
    @DisplayName("No hop count on the incoming event gives the reply a fresh budget")
    void freshBudget() {
        assertEquals(OptionalInt.of(RemainingHops.DEFAULT_LIMIT), RemainingHops.forReply(event("e")));
    }

    @Test
    @DisplayName("A positive hop count is decremented for the reply")
    void decrement() {
        BrokerEvent incoming = event("e");
        RemainingHops.set(incoming, 1);
        assertEquals(OptionalInt.of(0), RemainingHops.forReply(incoming));

        RemainingHops.set(incoming, 17);
        assertEquals(OptionalInt.of(16), RemainingHops.forReply(incoming));
    }

    @Test
    @DisplayName("Zero or negative hop count means the reply is dropped")
    void exhausted() {
        BrokerEvent incoming = event("e");
        RemainingHops.set(incoming, 0);
        assertTrue(RemainingHops.forReply(incoming).isEmpty());

        RemainingHops.set(incoming, -3);
        assertTrue(RemainingHops.forReply(incoming).isEmpty());
    }

    @Test
    @DisplayName("The hop count travels as a string and is parsed back")
    void stringValue() {
        BrokerEvent incoming = event("e");
        incoming.setExtension("RemainingHops", " 12 ");
        assertEquals(OptionalInt.of(12), RemainingHops.get(incoming));

        incoming.setExtension(RemainingHops.EXTENSION, "lots");
        assertTrue(RemainingHops.get(incoming).isEmpty());
    }

    @Test
    @DisplayName("delete removes the extension")
    void delete() {
        BrokerEvent incoming = event("e");
        RemainingHops.set(incoming, 4);
        RemainingHops.delete(incoming);
        assertNull(incoming.getExtension(RemainingHops.EXTENSION));
    }
}
