package com.cellbroker.event;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.EventFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Converts events to and from the JSON form stored in queue messages.
 */
@Component
@RequiredArgsConstructor
public class EventCodec {

    private final ObjectMapper objectMapper;

    public byte[] encode(BrokerEvent event) throws EventFormatException {
        try {
            return objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new EventFormatException("failed to encode event " + event.getId(), e);
        }
    }

    /**
     * Decodes a queue message payload. The event must at least carry an id, a
     * source and a type.
     */
    public BrokerEvent decode(byte[] payload) throws EventFormatException {
        if (payload == null || payload.length == 0) {
            throw new EventFormatException("empty message payload");
        }
        BrokerEvent event;
        try {
            event = objectMapper.readValue(payload, BrokerEvent.class);
        } catch (IOException e) {
            throw new EventFormatException("message payload is not an event: " + e.getMessage(), e);
        }
        if (event == null || isBlank(event.getId()) || isBlank(event.getSource()) || isBlank(event.getType())) {
            throw new EventFormatException("event is missing one of the required attributes id, source, type");
        }
        return event;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
