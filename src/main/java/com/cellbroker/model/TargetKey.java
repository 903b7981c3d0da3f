package com.cellbroker.model;

import com.cellbroker.exception.MalformedKeyException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identity of a {@link Target}: its tenant's key plus the target name.
 */
@Getter
@EqualsAndHashCode
public final class TargetKey {

    private final CellTenantKey parentKey;
    private final String name;

    public TargetKey(CellTenantKey parentKey, String name) {
        this.parentKey = parentKey;
        this.name = name;
    }

    public String persistenceString() {
        return parentKey.persistenceString() + "/" + name;
    }

    /**
     * Parses "&lt;tenant persistence string&gt;/&lt;target name&gt;".
     *
     * @throws MalformedKeyException if the string is not a valid key
     */
    public static TargetKey fromPersistenceString(String s) {
        if (s == null) {
            throw new MalformedKeyException("target key must not be null");
        }
        int slash = s.lastIndexOf('/');
        if (slash <= 0 || slash == s.length() - 1) {
            throw new MalformedKeyException("malformed target key '" + s + "'");
        }
        String name = s.substring(slash + 1);
        CellTenantKey.validateLabel("target name", name);
        return new TargetKey(CellTenantKey.fromPersistenceString(s.substring(0, slash)), name);
    }

    @Override
    public String toString() {
        return parentKey + "//" + name;
    }
}
