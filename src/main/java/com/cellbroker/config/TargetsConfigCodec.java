package com.cellbroker.config;

import com.cellbroker.model.TargetsConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.MapperBuilder;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Wire forms of a {@link TargetsConfig}.
 *
 *   binary → CBOR; the form the control plane writes and the one compared byte for byte
 *   text   → indented JSON; for debugging and diffs only
 *
 * Both mappers sort properties and map entries so that equal snapshots always
 * encode to identical bytes.
 */
public final class TargetsConfigCodec {

    private static final ObjectMapper BINARY = configure(CBORMapper.builder()).build();
    private static final ObjectMapper TEXT = configure(JsonMapper.builder())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private TargetsConfigCodec() {
    }

    private static <M extends ObjectMapper, B extends MapperBuilder<M, B>> B configure(B builder) {
        return builder
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static byte[] toBytes(TargetsConfig config) {
        try {
            return BINARY.writeValueAsBytes(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static TargetsConfig fromBytes(byte[] bytes) throws IOException {
        TargetsConfig config = BINARY.readValue(bytes, TargetsConfig.class);
        if (config == null) {
            throw new IOException("snapshot bytes decode to nothing");
        }
        return config;
    }

    public static String toText(TargetsConfig config) {
        try {
            return TEXT.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static TargetsConfig fromText(String text) throws IOException {
        TargetsConfig config = TEXT.readValue(text, TargetsConfig.class);
        if (config == null) {
            throw new IOException("snapshot text decodes to nothing");
        }
        return config;
    }
}
