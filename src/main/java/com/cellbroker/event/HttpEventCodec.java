package com.cellbroker.event;

import com.cellbroker.dto.BrokerEvent;
import com.cellbroker.exception.EventFormatException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CloudEvents HTTP binary mode: context attributes and extensions travel as
 * {@code ce-*} headers, the payload is the request body and its media type is
 * the Content-Type header.
 *
 * Every header value is a string, so numeric extensions such as the remaining
 * hop count have to be parsed back by whoever reads them.
 */
public final class HttpEventCodec {

    public static final String HEADER_PREFIX = "ce-";

    private static final List<String> CONTEXT_ATTRIBUTES =
            List.of("id", "source", "specversion", "type", "subject", "time", "dataschema");

    private HttpEventCodec() {
    }

    public static HttpHeaders toHeaders(BrokerEvent event) {
        HttpHeaders headers = new HttpHeaders();
        for (String attribute : CONTEXT_ATTRIBUTES) {
            String value = event.getAttribute(attribute);
            if (value != null) {
                headers.set(HEADER_PREFIX + attribute, value);
            }
        }
        if (event.getExtensions() != null) {
            event.getExtensions().forEach((name, value) -> {
                if (value != null) {
                    headers.set(HEADER_PREFIX + name, value);
                }
            });
        }
        if (event.getDatacontenttype() != null) {
            headers.setContentType(MediaType.parseMediaType(event.getDatacontenttype()));
        }
        return headers;
    }

    /**
     * Reads an event from binary-mode headers and body.
     *
     * @throws EventFormatException if a required attribute is missing
     */
    public static BrokerEvent fromHttp(HttpHeaders headers, byte[] body) throws EventFormatException {
        Map<String, String> attributes = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith(HEADER_PREFIX) && !values.isEmpty()) {
                attributes.put(lower.substring(HEADER_PREFIX.length()), values.get(0));
            }
        });

        BrokerEvent event = new BrokerEvent();
        event.setId(attributes.remove("id"));
        event.setSource(attributes.remove("source"));
        String specversion = attributes.remove("specversion");
        event.setSpecversion(specversion == null ? BrokerEvent.SPEC_VERSION : specversion);
        event.setType(attributes.remove("type"));
        event.setSubject(attributes.remove("subject"));
        event.setTime(attributes.remove("time"));
        event.setDataschema(attributes.remove("dataschema"));
        event.setExtensions(attributes);

        if (event.getId() == null || event.getSource() == null || event.getType() == null) {
            throw new EventFormatException("request is not a binary-mode event: missing ce-id, ce-source or ce-type");
        }
        if (body != null && body.length > 0) {
            event.setData(body);
            MediaType contentType = headers.getContentType();
            if (contentType != null) {
                event.setDatacontenttype(contentType.toString());
            }
        }
        return event;
    }

    /**
     * Whether the headers look like a binary-mode event at all. A 2xx response
     * without these is treated as "no reply".
     */
    public static boolean isEvent(HttpHeaders headers) {
        return headers.containsKey(HEADER_PREFIX + "id")
                && headers.containsKey(HEADER_PREFIX + "type")
                && headers.containsKey(HEADER_PREFIX + "source");
    }
}
