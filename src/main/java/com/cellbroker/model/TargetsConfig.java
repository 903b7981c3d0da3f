package com.cellbroker.model;

import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The full configuration snapshot: every tenant keyed by its
 * {@link CellTenantKey#persistenceString() persistence string}.
 *
 * A snapshot is produced by the control plane and replaced as a whole.
 * Code that reads it from the cache must not modify it.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@EqualsAndHashCode @ToString
public class TargetsConfig {

    @Builder.Default
    private Map<String, CellTenant> cellTenants = new LinkedHashMap<>();

    public static TargetsConfig empty() {
        return new TargetsConfig();
    }
}
