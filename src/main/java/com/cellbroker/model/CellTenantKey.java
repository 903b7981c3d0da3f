package com.cellbroker.model;

import com.cellbroker.exception.MalformedKeyException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Identity of a {@link CellTenant} at a point in time.
 *
 * Two string forms:
 *   persistenceString() → "ns/name" for brokers, "TYPE/ns/name" otherwise.
 *                         Stable: used as the snapshot map key and in request paths.
 *   toString()          → "TYPE:ns//name". Debug only, never parsed back.
 *
 * Brokers omit their type from the persistence form because snapshots written
 * before other tenant types existed are keyed that way.
 */
@Getter
@EqualsAndHashCode
public final class CellTenantKey {

    private static final Pattern DNS1123_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    private static final int DNS1123_LABEL_MAX_LENGTH = 63;

    private final CellTenantType type;
    private final String namespace;
    private final String name;

    public CellTenantKey(CellTenantType type, String namespace, String name) {
        this.type = type;
        this.namespace = namespace;
        this.name = name;
    }

    public static CellTenantKey broker(String namespace, String name) {
        return new CellTenantKey(CellTenantType.BROKER, namespace, name);
    }

    public String persistenceString() {
        if (type == CellTenantType.BROKER) {
            return namespace + "/" + name;
        }
        return type.name() + "/" + namespace + "/" + name;
    }

    /**
     * Parses a persistence string. A single leading '/' is accepted so request
     * paths can be passed in as they arrive.
     *
     * @throws MalformedKeyException if the string is not a valid key
     */
    public static CellTenantKey fromPersistenceString(String s) {
        if (s == null) {
            throw new MalformedKeyException("cell tenant key must not be null");
        }
        String path = s.startsWith("/") ? s.substring(1) : s;
        String[] pieces = path.split("/", -1);
        if (pieces.length != 2 && pieces.length != 3) {
            throw new MalformedKeyException(String.format(
                    "malformed cell tenant key; expect format '<ns>/<name>' or '<type>/<ns>/<name>', actually '%s'", s));
        }

        CellTenantType type;
        String ns;
        String name;
        if (pieces.length == 2) {
            type = CellTenantType.BROKER;
            ns = pieces[0];
            name = pieces[1];
        } else {
            type = parseType(pieces[0]);
            ns = pieces[1];
            name = pieces[2];
        }

        validateLabel("namespace", ns);
        validateLabel("name", name);
        return new CellTenantKey(type, ns, name);
    }

    static void validateLabel(String what, String value) {
        if (value.isEmpty() || value.length() > DNS1123_LABEL_MAX_LENGTH
                || !DNS1123_LABEL.matcher(value).matches()) {
            throw new MalformedKeyException(String.format("invalid %s '%s': must be a DNS-1123 label", what, value));
        }
    }

    private static CellTenantType parseType(String s) {
        try {
            CellTenantType type = CellTenantType.valueOf(s);
            if (type == CellTenantType.UNKNOWN_CELL_TENANT_TYPE) {
                throw new MalformedKeyException("unknown cell tenant type '" + s + "'");
            }
            return type;
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException("unknown cell tenant type '" + s + "'", e);
        }
    }

    @Override
    public String toString() {
        return type + ":" + namespace + "//" + name;
    }
}
