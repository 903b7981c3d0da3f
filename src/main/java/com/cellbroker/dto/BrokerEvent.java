package com.cellbroker.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * An event flowing through the broker, modelled on the CloudEvents envelope.
 *
 * Example JSON (queue message form):
 * {
 *   "id": "evt-abc-123",
 *   "source": "//orders/service",
 *   "specversion": "1.0",
 *   "type": "order.placed",
 *   "datacontenttype": "application/json",
 *   "extensions": {"remaininghops": "12"},
 *   "data": "eyJ0b3RhbCI6IDQyfQ=="
 * }
 *
 * - id, source, type: required context attributes
 * - extensions:       arbitrary string attributes (lower-case names)
 * - data:             raw payload bytes, base64 in JSON
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrokerEvent {

    public static final String SPEC_VERSION = "1.0";

    private String id;
    private String source;

    @Builder.Default
    private String specversion = SPEC_VERSION;

    private String type;
    private String subject;
    private String time;
    private String datacontenttype;
    private String dataschema;

    @Builder.Default
    private Map<String, String> extensions = new LinkedHashMap<>();

    private byte[] data;

    /**
     * Looks up a context attribute or, failing that, an extension by name.
     * Returns null when the event does not carry it.
     */
    public String getAttribute(String name) {
        if (name == null) {
            return null;
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "id":
                return id;
            case "source":
                return source;
            case "specversion":
                return specversion;
            case "type":
                return type;
            case "subject":
                return subject;
            case "time":
                return time;
            case "datacontenttype":
                return datacontenttype;
            case "dataschema":
                return dataschema;
            default:
                return extensions == null ? null : extensions.get(name.toLowerCase(Locale.ROOT));
        }
    }

    public String getExtension(String name) {
        return extensions == null ? null : extensions.get(name);
    }

    public void setExtension(String name, String value) {
        if (extensions == null) {
            extensions = new LinkedHashMap<>();
        }
        extensions.put(name.toLowerCase(Locale.ROOT), value);
    }

    public void removeExtension(String name) {
        if (extensions != null) {
            extensions.remove(name);
        }
    }

    @JsonIgnore
    public boolean hasData() {
        return data != null && data.length > 0;
    }

    /**
     * Deep copy; the extension map and the payload are not shared.
     */
    public BrokerEvent copy() {
        return toBuilder()
                .extensions(extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions))
                .data(data == null ? null : data.clone())
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BrokerEvent)) return false;
        BrokerEvent that = (BrokerEvent) o;
        return Objects.equals(id, that.id)
                && Objects.equals(source, that.source)
                && Objects.equals(specversion, that.specversion)
                && Objects.equals(type, that.type)
                && Objects.equals(subject, that.subject)
                && Objects.equals(time, that.time)
                && Objects.equals(datacontenttype, that.datacontenttype)
                && Objects.equals(dataschema, that.dataschema)
                && Objects.equals(extensions == null ? Map.of() : extensions,
                        that.extensions == null ? Map.of() : that.extensions)
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, source, specversion, type, subject, time, datacontenttype, dataschema);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "BrokerEvent{id=" + id + ", source=" + source + ", type=" + type
                + ", subject=" + subject + ", extensions=" + extensions
                + ", dataBytes=" + (data == null ? 0 : data.length) + "}";
    }
}
