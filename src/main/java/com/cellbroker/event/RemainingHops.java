package com.cellbroker.event;

import com.cellbroker.dto.BrokerEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.OptionalInt;

/**
 * Reads and writes the remaining-hops extension that bounds how many times a
 * reply can loop back into a tenant.
 *
 * The value is kept as a decimal string so it survives HTTP headers unchanged.
 */
@Slf4j
public final class RemainingHops {

    public static final String EXTENSION = "remaininghops";

    /** Budget given to an event that enters the broker without one. */
    public static final int DEFAULT_LIMIT = 255;

    private RemainingHops() {
    }

    /**
     * Empty when the event has no hop count or the value is not an integer.
     */
    public static OptionalInt get(BrokerEvent event) {
        String raw = event.getExtension(EXTENSION);
        if (raw == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            log.debug("ignoring non-numeric {} value '{}' on event {}", EXTENSION, raw, event.getId());
            return OptionalInt.empty();
        }
    }

    public static void set(BrokerEvent event, int hops) {
        event.setExtension(EXTENSION, Integer.toString(hops));
    }

    public static void delete(BrokerEvent event) {
        event.removeExtension(EXTENSION);
    }

    /**
     * Hop count a reply to {@code incoming} should carry, or empty when the
     * budget is used up and the reply must be dropped.
     *
     *   no value   → DEFAULT_LIMIT (fresh budget)
     *   h &lt;= 0     → empty
     *   h &gt; 0      → h - 1
     */
    public static OptionalInt forReply(BrokerEvent incoming) {
        OptionalInt current = get(incoming);
        if (current.isEmpty()) {
            return OptionalInt.of(DEFAULT_LIMIT);
        }
        int hops = current.getAsInt();
        if (hops <= 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(hops - 1);
    }
}
