package com.cellbroker.event;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.EventFormatException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;

import static com.cellbroker.Fixtures.event;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {

    private final EventCodec codec = new EventCodec(new ObjectMapper());

    @Nested
    @DisplayName("Queue message form")
    class QueueForm {

        @Test
        @DisplayName("Decoding an encoded event gives an equal event")
        void encodeDecode() throws Exception {
            BrokerEvent original = event("evt-1");
            original.setExtension("remaininghops", "3");

            BrokerEvent decoded = codec.decode(codec.encode(original));

            assertEquals(original, decoded);
            assertEquals("3", decoded.getExtension("remaininghops"));
        }

        @Test
        @DisplayName("Payloads that are not events are rejected")
        void rejectsGarbage() {
            assertThrows(EventFormatException.class, () -> codec.decode(new byte[0]));
            assertThrows(EventFormatException.class, () -> codec.decode(null));
            assertThrows(EventFormatException.class,
                    () -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)));
        }

        @Test
        @DisplayName("Events without id, source or type are rejected")
        void requiresCoreAttributes() {
            byte[] noType = "{\"id\":\"1\",\"source\":\"s\"}".getBytes(StandardCharsets.UTF_8);
            assertThrows(EventFormatException.class, () -> codec.decode(noType));
        }

        @Test
        @DisplayName("Unknown fields are tolerated")
        void unknownFields() throws Exception {
            byte[] json = "{\"id\":\"1\",\"source\":\"s\",\"type\":\"t\",\"color\":\"blue\"}"
                    .getBytes(StandardCharsets.UTF_8);
            assertEquals("1", codec.decode(json).getId());
        }
    }

    @Nested
    @DisplayName("HTTP binary mode")
    class BinaryMode {

        @Test
        @DisplayName("Attributes and extensions become ce- headers")
        void toHeaders() {
            BrokerEvent e = event("evt-1");
            e.setExtension("remaininghops", "7");

            HttpHeaders headers = HttpEventCodec.toHeaders(e);

            assertEquals("evt-1", headers.getFirst("ce-id"));
            assertEquals("order.placed", headers.getFirst("ce-type"));
            assertEquals("1.0", headers.getFirst("ce-specversion"));
            assertEquals("7", headers.getFirst("ce-remaininghops"));
            assertEquals(MediaType.APPLICATION_JSON, headers.getContentType());
            assertFalse(headers.containsKey("ce-subject"));
        }

        @Test
        @DisplayName("Headers and body read back into the same event")
        void fromHttp() throws Exception {
            BrokerEvent e = event("evt-1");
            e.setExtension("region", "eu");

            BrokerEvent read = HttpEventCodec.fromHttp(HttpEventCodec.toHeaders(e), e.getData());

            assertEquals(e, read);
            assertArrayEquals(e.getData(), read.getData());
        }

        @Test
        @DisplayName("Requests without the required headers are not events")
        void missingHeaders() {
            HttpHeaders headers = new HttpHeaders();
            headers.set("ce-id", "1");
            headers.set("ce-source", "s");

            assertFalse(HttpEventCodec.isEvent(headers));
            assertThrows(EventFormatException.class, () -> HttpEventCodec.fromHttp(headers, new byte[0]));

            headers.set("ce-type", "t");
            assertTrue(HttpEventCodec.isEvent(headers));
        }

        @Test
        @DisplayName("An empty body leaves the event without data")
        void emptyBody() throws Exception {
            HttpHeaders headers = new HttpHeaders();
            headers.set("ce-id", "1");
            headers.set("ce-source", "s");
            headers.set("ce-type", "t");

            BrokerEvent read = HttpEventCodec.fromHttp(headers, new byte[0]);

            assertNull(read.getData());
            assertEquals(BrokerEvent.SPEC_VERSION, read.getSpecversion());
        }
    }
}
